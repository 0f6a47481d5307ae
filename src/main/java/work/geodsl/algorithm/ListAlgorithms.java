package work.geodsl.algorithm;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import work.geodsl.command.Command;
import work.geodsl.runtime.AlgorithmRegistry;
import work.geodsl.runtime.AlgorithmResult;
import work.geodsl.value.DslValue;
import work.geodsl.value.ListValue;
import work.geodsl.value.PointValue;
import work.geodsl.value.ScalarValue;
import work.geodsl.value.TextValue;

public final class ListAlgorithms {
    private ListAlgorithms() {}

    public static AlgorithmRegistry register(AlgorithmRegistry registry) {
        registry.register(Command.FIRST, (command, args, deps) -> {
            List<DslValue> items = Arguments.list(command, args, 0).items();
            return AlgorithmResult.of(new ListValue(items.subList(0, count(command, args, items.size()))));
        });
        registry.register(Command.LAST, (command, args, deps) -> {
            List<DslValue> items = Arguments.list(command, args, 0).items();
            return AlgorithmResult.of(new ListValue(items.subList(items.size() - count(command, args, items.size()), items.size())));
        });
        registry.register(Command.APPEND, ListAlgorithms::append);
        registry.register(Command.SORT, ListAlgorithms::sort);
        return registry;
    }

    private static int count(Command command, List<DslValue> args, int available) {
        if (args.size() < 2) {
            return Math.min(1, available);
        }
        long count = Arguments.integer(command, args, 1);
        if (count < 0 || count > available) {
            throw Arguments.invalid(command, "cannot take " + count + " of " + available + " elements");
        }
        return (int) count;
    }

    /**
     * {@code Append(list, x)} adds at the end, {@code Append(x, list)} at the front.
     */
    private static AlgorithmResult append(Command command, List<DslValue> args, Set<String> dependencies) {
        DslValue first = args.get(0);
        DslValue second = args.get(1);
        List<DslValue> items = new ArrayList<>();
        if (first instanceof ListValue list) {
            items.addAll(list.items());
            items.add(second);
        } else if (second instanceof ListValue list) {
            items.add(first);
            items.addAll(list.items());
        } else {
            throw Arguments.invalid(command, "one argument must be a list");
        }
        return AlgorithmResult.of(new ListValue(items));
    }

    /**
     * Sorts numbers, texts or points (by x, then y). With a second list the first is ordered by
     * the matching keys.
     */
    private static AlgorithmResult sort(Command command, List<DslValue> args, Set<String> dependencies) {
        List<DslValue> items = Arguments.list(command, args, 0).items();
        if (args.size() == 1) {
            List<DslValue> sorted = new ArrayList<>(items);
            sorted.sort(comparator(command, items));
            return AlgorithmResult.of(new ListValue(sorted));
        }
        List<DslValue> keys = Arguments.list(command, args, 1).items();
        if (keys.size() != items.size()) {
            throw Arguments.invalid(command, "key list has " + keys.size() + " elements, expected " + items.size());
        }
        Comparator<DslValue> byKey = comparator(command, keys);
        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            order.add(i);
        }
        order.sort((a, b) -> byKey.compare(keys.get(a), keys.get(b)));
        List<DslValue> sorted = new ArrayList<>(items.size());
        for (int index : order) {
            sorted.add(items.get(index));
        }
        return AlgorithmResult.of(new ListValue(sorted));
    }

    private static Comparator<DslValue> comparator(Command command, List<DslValue> items) {
        if (items.stream().allMatch(ScalarValue.class::isInstance)) {
            return Comparator.comparingDouble(value -> ((ScalarValue) value).value());
        }
        if (items.stream().allMatch(TextValue.class::isInstance)) {
            return Comparator.comparing(value -> ((TextValue) value).text());
        }
        if (items.stream().allMatch(PointValue.class::isInstance)) {
            Comparator<DslValue> byX = Comparator.comparingDouble(value -> ((PointValue) value).x());
            return byX.thenComparingDouble(value -> ((PointValue) value).y());
        }
        throw Arguments.invalid(command, "elements must all be numbers, texts or points");
    }
}
