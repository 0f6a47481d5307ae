package work.geodsl.command;

import work.geodsl.value.DslValue;
import work.geodsl.value.ListValue;
import work.geodsl.value.ObjectValue;
import work.geodsl.value.PointValue;
import work.geodsl.value.ScalarValue;
import work.geodsl.value.TextValue;

/**
 * Expected shape of an argument at one position of a command.
 */
public enum ArgShape {
    SCALAR("Number"),
    POINT("Point"),
    GEOMETRIC("Object"),
    LIST("List"),
    TEXT("Text"),
    ANY("Any");

    private final String label;

    ArgShape(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean accepts(DslValue value) {
        return switch (this) {
            case SCALAR -> value instanceof ScalarValue;
            case POINT -> value instanceof PointValue;
            case GEOMETRIC -> value instanceof PointValue || value instanceof ObjectValue;
            case LIST -> value instanceof ListValue;
            case TEXT -> value instanceof TextValue;
            case ANY -> value != null;
        };
    }
}
