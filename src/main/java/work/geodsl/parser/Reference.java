package work.geodsl.parser;

import java.util.Objects;

/**
 * Bare identifier; resolved against the construction at evaluation time, never while parsing.
 */
public record Reference(String label) implements ParsedExpression {
    public Reference {
        Objects.requireNonNull(label, "label");
    }

    @Override
    public String toSource() {
        return label;
    }
}
