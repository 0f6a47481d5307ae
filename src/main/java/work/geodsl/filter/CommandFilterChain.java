package work.geodsl.filter;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import work.geodsl.command.Command;

/**
 * Runs member filters in registration order and returns the first denial.
 */
public final class CommandFilterChain implements CommandFilter {
    private final List<CommandFilter> filters = new CopyOnWriteArrayList<>();

    public CommandFilterChain add(CommandFilter filter) {
        if (filter != null) {
            filters.add(filter);
        }
        return this;
    }

    public boolean remove(CommandFilter filter) {
        return filters.remove(filter);
    }

    public List<CommandFilter> filters() {
        return List.copyOf(filters);
    }

    @Override
    public FilterDecision check(Command command, FilterContext context) {
        for (CommandFilter filter : filters) {
            FilterDecision decision = filter.check(command, context);
            if (decision.denied()) {
                return decision;
            }
        }
        return FilterDecision.allow();
    }
}
