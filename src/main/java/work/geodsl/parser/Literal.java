package work.geodsl.parser;

import java.util.Objects;
import work.geodsl.value.DslValue;

public record Literal(DslValue value) implements ParsedExpression {
    public Literal {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String toSource() {
        return value.source();
    }
}
