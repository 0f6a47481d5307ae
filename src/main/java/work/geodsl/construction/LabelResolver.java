package work.geodsl.construction;

import java.util.Optional;
import work.geodsl.value.DslValue;

/**
 * Read access to label values during evaluation.
 */
@FunctionalInterface
public interface LabelResolver {
    Optional<DslValue> resolve(String label);
}
