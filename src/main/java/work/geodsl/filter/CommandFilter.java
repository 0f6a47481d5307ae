package work.geodsl.filter;

import work.geodsl.command.Command;

/**
 * Policy that may veto a command before its arguments are evaluated. Must be side-effect-free.
 */
@FunctionalInterface
public interface CommandFilter {
    FilterDecision check(Command command, FilterContext context);
}
