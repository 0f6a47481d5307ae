package work.geodsl.filter;

import java.util.List;
import work.geodsl.command.Command;
import work.geodsl.value.DslValue;

/**
 * Policy over the resolved argument values of a command. Must be side-effect-free.
 */
@FunctionalInterface
public interface ArgumentFilter {
    FilterDecision check(Command command, List<DslValue> arguments, FilterContext context);
}
