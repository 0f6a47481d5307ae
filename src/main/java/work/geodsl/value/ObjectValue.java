package work.geodsl.value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Tagged description of a constructed object such as a line, circle or polygon. Properties keep
 * their insertion order.
 */
public record ObjectValue(String type, Map<String, DslValue> properties) implements DslValue {
    public ObjectValue {
        Objects.requireNonNull(type, "type");
        properties = properties == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public static Builder builder(String type) {
        return new Builder(type);
    }

    public Optional<DslValue> property(String name) {
        return Optional.ofNullable(properties.get(name));
    }

    public Optional<PointValue> pointProperty(String name) {
        return property(name).filter(PointValue.class::isInstance).map(PointValue.class::cast);
    }

    public boolean is(String candidate) {
        return type.equals(candidate);
    }

    @Override
    public String typeName() {
        return type;
    }

    @Override
    public String display() {
        return properties.values().stream()
            .map(DslValue::display)
            .collect(Collectors.joining(", ", type + "[", "]"));
    }

    @Override
    public Object toPlain() {
        Map<String, Object> plain = new LinkedHashMap<>();
        plain.put("type", type);
        for (var entry : properties.entrySet()) {
            plain.put(entry.getKey(), entry.getValue().toPlain());
        }
        return plain;
    }

    public static final class Builder {
        private final String type;
        private final Map<String, DslValue> properties = new LinkedHashMap<>();

        private Builder(String type) {
            this.type = type;
        }

        public Builder put(String name, DslValue value) {
            properties.put(name, value);
            return this;
        }

        public Builder put(String name, double value) {
            return put(name, ScalarValue.of(value));
        }

        public ObjectValue build() {
            return new ObjectValue(type, properties);
        }
    }
}
