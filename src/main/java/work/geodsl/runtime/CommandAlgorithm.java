package work.geodsl.runtime;

import java.util.List;
import java.util.Set;
import work.geodsl.command.Command;
import work.geodsl.value.DslValue;

/**
 * Leaf computation bound to a command. Receives arguments that are already resolved and
 * validated, plus the labels they were resolved from; never reaches into the construction.
 */
@FunctionalInterface
public interface CommandAlgorithm {
    AlgorithmResult invoke(Command command, List<DslValue> arguments, Set<String> dependencies) throws Exception;
}
