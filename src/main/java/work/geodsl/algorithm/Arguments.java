package work.geodsl.algorithm;

import java.util.ArrayList;
import java.util.List;
import work.geodsl.command.Command;
import work.geodsl.error.InvalidArgumentException;
import work.geodsl.shared.Numbers;
import work.geodsl.value.DslValue;
import work.geodsl.value.ListValue;
import work.geodsl.value.ObjectValue;
import work.geodsl.value.PointValue;
import work.geodsl.value.ScalarValue;

/**
 * Typed access to resolved argument values for leaf algorithms.
 */
final class Arguments {
    private Arguments() {}

    static double number(Command command, List<DslValue> args, int index) {
        if (args.get(index) instanceof ScalarValue scalar) {
            return scalar.value();
        }
        throw mismatch(command, index, "a number", args.get(index));
    }

    static long integer(Command command, List<DslValue> args, int index) {
        double value = number(command, args, index);
        if (!Numbers.isIntegral(value)) {
            throw new InvalidArgumentException(
                command.displayName(),
                "argument " + (index + 1) + " must be an integer, got " + Numbers.format(value)
            );
        }
        return (long) value;
    }

    static PointValue point(Command command, List<DslValue> args, int index) {
        if (args.get(index) instanceof PointValue point) {
            return point;
        }
        throw mismatch(command, index, "a point", args.get(index));
    }

    static ListValue list(Command command, List<DslValue> args, int index) {
        if (args.get(index) instanceof ListValue list) {
            return list;
        }
        throw mismatch(command, index, "a list", args.get(index));
    }

    static ObjectValue object(Command command, List<DslValue> args, int index) {
        if (args.get(index) instanceof ObjectValue object) {
            return object;
        }
        throw mismatch(command, index, "an object", args.get(index));
    }

    /**
     * Numbers given either directly or as lists, flattened one level: {@code Mean(1, 2)} and
     * {@code Mean([1, 2])} read the same sample.
     */
    static List<Double> numbers(Command command, List<DslValue> args) {
        List<Double> values = new ArrayList<>();
        for (int i = 0; i < args.size(); i++) {
            DslValue value = args.get(i);
            if (value instanceof ScalarValue scalar) {
                values.add(scalar.value());
            } else if (value instanceof ListValue list) {
                for (DslValue item : list.items()) {
                    if (!(item instanceof ScalarValue scalar)) {
                        throw mismatch(command, i, "a list of numbers", value);
                    }
                    values.add(scalar.value());
                }
            } else {
                throw mismatch(command, i, "a number or a list of numbers", value);
            }
        }
        if (values.isEmpty()) {
            throw new InvalidArgumentException(command.displayName(), "needs at least one number");
        }
        return values;
    }

    /**
     * Points given either directly or as one list of points.
     */
    static List<PointValue> points(Command command, List<DslValue> args) {
        List<DslValue> items = args.size() == 1 && args.get(0) instanceof ListValue list ? list.items() : args;
        List<PointValue> points = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            if (!(items.get(i) instanceof PointValue point)) {
                throw mismatch(command, i, "a point", items.get(i));
            }
            points.add(point);
        }
        return points;
    }

    static InvalidArgumentException invalid(Command command, String message) {
        return new InvalidArgumentException(command.displayName(), message);
    }

    private static InvalidArgumentException mismatch(Command command, int index, String expected, DslValue actual) {
        return new InvalidArgumentException(
            command.displayName(),
            "argument " + (index + 1) + " must be " + expected + ", got " + actual.typeName()
        );
    }
}
