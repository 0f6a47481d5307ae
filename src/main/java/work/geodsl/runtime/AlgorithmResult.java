package work.geodsl.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import work.geodsl.value.DslValue;

public record AlgorithmResult(DslValue value, Map<String, Object> metadata) {
    public AlgorithmResult {
        Objects.requireNonNull(value, "value");
        metadata = metadata == null || metadata.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static AlgorithmResult of(DslValue value) {
        return new AlgorithmResult(value, Map.of());
    }

    public static AlgorithmResult of(DslValue value, Map<String, ?> metadata) {
        Map<String, Object> copy = metadata == null ? Map.of() : new LinkedHashMap<>(metadata);
        return new AlgorithmResult(value, copy);
    }
}
