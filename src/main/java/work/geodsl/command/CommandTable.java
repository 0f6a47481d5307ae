package work.geodsl.command;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import work.geodsl.error.CommandNotFoundException;

/**
 * Immutable index from a command's display name (the name users type) to its definition. Built
 * once; safe to share between kernels without locking.
 */
public final class CommandTable {
    private static final CommandTable STANDARD = new CommandTable(EnumSet.allOf(Command.class));

    private final Map<String, Command> byDisplayName;

    public CommandTable(Collection<Command> commands) {
        Map<String, Command> index = new LinkedHashMap<>();
        for (Command command : commands) {
            Command previous = index.put(command.displayName(), command);
            if (previous != null && previous != command) {
                throw new IllegalStateException(
                    "Display name '" + command.displayName() + "' used by " + previous.name() + " and " + command.name()
                );
            }
        }
        this.byDisplayName = Collections.unmodifiableMap(index);
    }

    public static CommandTable standard() {
        return STANDARD;
    }

    /**
     * Case-sensitive lookup by display name.
     *
     * @throws CommandNotFoundException when no command carries that display name
     */
    public Command lookup(String displayName) {
        return find(displayName).orElseThrow(() -> new CommandNotFoundException(displayName));
    }

    public Optional<Command> find(String displayName) {
        if (displayName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byDisplayName.get(displayName));
    }

    public boolean contains(String displayName) {
        return find(displayName).isPresent();
    }

    public Set<CommandCategory> categoriesOf(String displayName) {
        return EnumSet.of(lookup(displayName).category());
    }

    public List<Command> commandsIn(CommandCategory category) {
        return byDisplayName.values().stream()
            .filter(command -> command.category() == category)
            .collect(Collectors.toUnmodifiableList());
    }

    public Set<String> displayNames() {
        return byDisplayName.keySet();
    }

    public Collection<Command> commands() {
        return byDisplayName.values();
    }

    /**
     * Renders a syntax hint such as {@code Segment( <Point>, <Point> )}.
     */
    public String syntaxOf(String displayName) {
        Command command = lookup(displayName);
        int shown = command.isVariadic() ? command.minArgs() + 1 : command.maxArgs();
        StringBuilder out = new StringBuilder(command.displayName()).append("(");
        for (int i = 0; i < shown; i++) {
            out.append(i == 0 ? " " : ", ");
            boolean optional = i >= command.minArgs();
            String token = "<" + command.shapeAt(i).label() + ">";
            out.append(optional ? "[" + token + "]" : token);
        }
        if (command.isVariadic()) {
            out.append(", ...");
        }
        out.append(shown == 0 ? ")" : " )");
        return out.toString();
    }

    public int size() {
        return byDisplayName.size();
    }
}
