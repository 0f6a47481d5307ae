package work.geodsl.algorithm;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import work.geodsl.command.Command;
import work.geodsl.runtime.AlgorithmRegistry;
import work.geodsl.runtime.AlgorithmResult;
import work.geodsl.value.DslValue;
import work.geodsl.value.ListValue;
import work.geodsl.value.PointValue;
import work.geodsl.value.ScalarValue;

/**
 * Descriptive statistics over a sample given as numbers or as lists of numbers. Variance and SD
 * are the population forms.
 */
public final class StatisticsAlgorithms {
    private StatisticsAlgorithms() {}

    public static AlgorithmRegistry register(AlgorithmRegistry registry) {
        registry.register(Command.SUM, StatisticsAlgorithms::sum);
        registry.register(Command.MEAN, (command, args, deps) -> scalar(mean(Arguments.numbers(command, args))));
        registry.register(Command.MEDIAN, StatisticsAlgorithms::median);
        registry.register(Command.VARIANCE, (command, args, deps) -> scalar(variance(Arguments.numbers(command, args))));
        registry.register(Command.SD, (command, args, deps) -> scalar(Math.sqrt(variance(Arguments.numbers(command, args)))));
        registry.register(Command.MODE, StatisticsAlgorithms::mode);
        return registry;
    }

    private static AlgorithmResult sum(Command command, List<DslValue> args, Set<String> dependencies) {
        if (allPoints(args)) {
            List<PointValue> points = Arguments.points(command, args);
            PointValue total = points.get(0);
            for (int i = 1; i < points.size(); i++) {
                total = Shapes.plus(total, points.get(i));
            }
            return AlgorithmResult.of(total);
        }
        double total = 0;
        for (double value : Arguments.numbers(command, args)) {
            total += value;
        }
        return scalar(total);
    }

    private static boolean allPoints(List<DslValue> args) {
        List<DslValue> items = args.size() == 1 && args.get(0) instanceof ListValue list ? list.items() : args;
        return !items.isEmpty() && items.stream().allMatch(PointValue.class::isInstance);
    }

    private static double mean(List<Double> values) {
        double total = 0;
        for (double value : values) {
            total += value;
        }
        return total / values.size();
    }

    private static double variance(List<Double> values) {
        double mean = mean(values);
        double squares = 0;
        for (double value : values) {
            squares += (value - mean) * (value - mean);
        }
        return squares / values.size();
    }

    private static AlgorithmResult median(Command command, List<DslValue> args, Set<String> dependencies) {
        List<Double> sorted = new ArrayList<>(Arguments.numbers(command, args));
        sorted.sort(null);
        int middle = sorted.size() / 2;
        if (sorted.size() % 2 == 1) {
            return scalar(sorted.get(middle));
        }
        return scalar((sorted.get(middle - 1) + sorted.get(middle)) / 2);
    }

    /**
     * Every most frequent value, ascending.
     */
    private static AlgorithmResult mode(Command command, List<DslValue> args, Set<String> dependencies) {
        Map<Double, Integer> counts = new TreeMap<>();
        for (double value : Arguments.numbers(command, args)) {
            counts.merge(value, 1, Integer::sum);
        }
        int highest = counts.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        List<DslValue> modes = new ArrayList<>();
        for (var entry : counts.entrySet()) {
            if (entry.getValue() == highest) {
                modes.add(ScalarValue.of(entry.getKey()));
            }
        }
        return AlgorithmResult.of(new ListValue(modes));
    }

    private static AlgorithmResult scalar(double value) {
        return AlgorithmResult.of(ScalarValue.of(value));
    }
}
