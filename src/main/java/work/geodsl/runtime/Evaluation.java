package work.geodsl.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import work.geodsl.value.DslValue;

/**
 * Value of an evaluated expression together with every label referenced below it.
 */
public record Evaluation(DslValue value, Set<String> dependencies, Map<String, Object> metadata) {
    public Evaluation {
        dependencies = Collections.unmodifiableSet(new LinkedHashSet<>(dependencies));
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    static Evaluation of(DslValue value) {
        return new Evaluation(value, Set.of(), Map.of());
    }
}
