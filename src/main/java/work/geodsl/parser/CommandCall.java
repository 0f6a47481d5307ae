package work.geodsl.parser;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public record CommandCall(String name, List<ParsedExpression> arguments) implements ParsedExpression {
    public CommandCall {
        Objects.requireNonNull(name, "name");
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    @Override
    public String toSource() {
        return arguments.stream()
            .map(ParsedExpression::toSource)
            .collect(Collectors.joining(", ", name + "(", ")"));
    }
}
