package work.geodsl.filter;

import java.util.EnumSet;
import java.util.Set;
import work.geodsl.command.Command;
import work.geodsl.error.ErrorKind;

/**
 * Exam mode: only the configured commands may run.
 */
public final class AllowListFilter implements CommandFilter {
    private final Set<Command> allowed;

    public AllowListFilter(Set<Command> allowed) {
        this.allowed = allowed == null || allowed.isEmpty() ? EnumSet.noneOf(Command.class) : EnumSet.copyOf(allowed);
    }

    public Set<Command> allowed() {
        return EnumSet.copyOf(allowed);
    }

    @Override
    public FilterDecision check(Command command, FilterContext context) {
        if (allowed.contains(command)) {
            return FilterDecision.allow();
        }
        return FilterDecision.deny(ErrorKind.COMMAND_DISALLOWED, "not permitted in " + context.mode() + " mode");
    }
}
