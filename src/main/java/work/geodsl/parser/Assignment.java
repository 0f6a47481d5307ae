package work.geodsl.parser;

import java.util.Objects;

/**
 * {@code label = value}. The value is a separate child node; an assignment never wraps itself and
 * never appears below the root of a tree.
 */
public record Assignment(String label, ParsedExpression value) implements ParsedExpression {
    public Assignment {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(value, "value");
        if (value instanceof Assignment) {
            throw new IllegalArgumentException("Assignment value must not itself be an assignment");
        }
    }

    @Override
    public String toSource() {
        return label + " = " + value.toSource();
    }
}
