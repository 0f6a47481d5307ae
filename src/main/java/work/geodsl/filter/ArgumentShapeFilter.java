package work.geodsl.filter;

import java.util.List;
import work.geodsl.command.ArgShape;
import work.geodsl.command.Command;
import work.geodsl.error.ErrorKind;
import work.geodsl.value.DslValue;

/**
 * Checks each resolved argument against the shape the command declares for its position.
 */
public final class ArgumentShapeFilter implements ArgumentFilter {
    @Override
    public FilterDecision check(Command command, List<DslValue> arguments, FilterContext context) {
        for (int i = 0; i < arguments.size(); i++) {
            ArgShape expected = command.shapeAt(i);
            DslValue actual = arguments.get(i);
            if (!expected.accepts(actual)) {
                return FilterDecision.deny(
                    ErrorKind.ARGUMENT_TYPE,
                    "argument " + (i + 1) + " expected " + expected.label() + ", got " + actual.typeName()
                );
            }
        }
        return FilterDecision.allow();
    }
}
