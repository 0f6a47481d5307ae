package work.geodsl.filter;

import java.util.EnumSet;
import java.util.Set;
import work.geodsl.command.Command;
import work.geodsl.command.CommandCategory;
import work.geodsl.error.ErrorKind;

/**
 * Blocks whole command categories, typically CAS.
 */
public final class CategoryFilter implements CommandFilter {
    private final Set<CommandCategory> blocked;

    public CategoryFilter(Set<CommandCategory> blocked) {
        this.blocked = blocked == null || blocked.isEmpty()
            ? EnumSet.noneOf(CommandCategory.class)
            : EnumSet.copyOf(blocked);
    }

    public static CategoryFilter withoutCas() {
        return new CategoryFilter(EnumSet.of(CommandCategory.CAS));
    }

    public Set<CommandCategory> blocked() {
        return EnumSet.copyOf(blocked);
    }

    @Override
    public FilterDecision check(Command command, FilterContext context) {
        if (blocked.contains(command.category())) {
            return FilterDecision.deny(
                ErrorKind.COMMAND_DISALLOWED,
                command.category().displayName() + " commands are disabled"
            );
        }
        return FilterDecision.allow();
    }
}
