package work.geodsl.filter;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import work.geodsl.command.Command;
import work.geodsl.value.DslValue;

/**
 * Runs member filters in registration order and returns the first denial.
 */
public final class ArgumentFilterChain implements ArgumentFilter {
    private final List<ArgumentFilter> filters = new CopyOnWriteArrayList<>();

    public ArgumentFilterChain add(ArgumentFilter filter) {
        if (filter != null) {
            filters.add(filter);
        }
        return this;
    }

    public boolean remove(ArgumentFilter filter) {
        return filters.remove(filter);
    }

    public List<ArgumentFilter> filters() {
        return List.copyOf(filters);
    }

    @Override
    public FilterDecision check(Command command, List<DslValue> arguments, FilterContext context) {
        List<DslValue> view = List.copyOf(arguments);
        for (ArgumentFilter filter : filters) {
            FilterDecision decision = filter.check(command, view, context);
            if (decision.denied()) {
                return decision;
            }
        }
        return FilterDecision.allow();
    }
}
