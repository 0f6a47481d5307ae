package work.geodsl.runtime;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import work.geodsl.command.Command;

/**
 * Binds commands to their leaf algorithms. A later registration for the same command replaces
 * the earlier one.
 */
public final class AlgorithmRegistry {
    private final Map<Command, Entry> algorithms = new EnumMap<>(Command.class);

    public AlgorithmRegistry register(Command command, CommandAlgorithm algorithm) {
        return register(command, algorithm, false);
    }

    public AlgorithmRegistry register(Command command, CommandAlgorithm algorithm, boolean macro) {
        if (command == null || algorithm == null) {
            throw new IllegalArgumentException("command and algorithm are required");
        }
        algorithms.put(command, new Entry(command, algorithm, macro));
        return this;
    }

    public Optional<Entry> get(Command command) {
        return Optional.ofNullable(algorithms.get(command));
    }

    public boolean isBound(Command command) {
        return algorithms.containsKey(command);
    }

    public void unregister(Command command) {
        if (command != null) {
            algorithms.remove(command);
        }
    }

    public Map<Command, Entry> entries() {
        return Collections.unmodifiableMap(algorithms);
    }

    /**
     * @param macro registered at runtime by the embedding application rather than shipped
     */
    public record Entry(Command command, CommandAlgorithm algorithm, boolean macro) {}
}
