package work.geodsl.algorithm;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import work.geodsl.command.Command;
import work.geodsl.runtime.AlgorithmRegistry;
import work.geodsl.runtime.AlgorithmResult;
import work.geodsl.shared.Numbers;
import work.geodsl.value.DslValue;
import work.geodsl.value.ScalarValue;

/**
 * Integer division, remainders, extrema and divisibility.
 */
public final class AlgebraAlgorithms {
    private AlgebraAlgorithms() {}

    public static AlgorithmRegistry register(AlgorithmRegistry registry) {
        registry.register(Command.MOD, AlgebraAlgorithms::mod);
        registry.register(Command.DIV, AlgebraAlgorithms::div);
        registry.register(Command.MIN, (command, args, deps) -> scalar(Collections.min(Arguments.numbers(command, args))));
        registry.register(Command.MAX, (command, args, deps) -> scalar(Collections.max(Arguments.numbers(command, args))));
        registry.register(Command.GCD, AlgebraAlgorithms::gcd);
        registry.register(Command.LCM, AlgebraAlgorithms::lcm);
        return registry;
    }

    // Remainder takes the sign of the divisor: Mod(-7, 3) = 2.
    private static AlgorithmResult mod(Command command, List<DslValue> args, Set<String> dependencies) {
        double dividend = Arguments.number(command, args, 0);
        double divisor = divisor(command, args);
        return scalar(dividend - divisor * Math.floor(dividend / divisor));
    }

    private static AlgorithmResult div(Command command, List<DslValue> args, Set<String> dependencies) {
        double dividend = Arguments.number(command, args, 0);
        return scalar(Math.floor(dividend / divisor(command, args)));
    }

    private static double divisor(Command command, List<DslValue> args) {
        double divisor = Arguments.number(command, args, 1);
        if (divisor == 0) {
            throw Arguments.invalid(command, "division by zero");
        }
        return divisor;
    }

    private static AlgorithmResult gcd(Command command, List<DslValue> args, Set<String> dependencies) {
        long result = 0;
        for (long value : integers(command, args)) {
            result = gcd(result, Math.abs(value));
        }
        return scalar(result);
    }

    private static AlgorithmResult lcm(Command command, List<DslValue> args, Set<String> dependencies) {
        long result = 1;
        for (long value : integers(command, args)) {
            long magnitude = Math.abs(value);
            if (magnitude == 0) {
                return scalar(0);
            }
            result = Math.multiplyExact(result / gcd(result, magnitude), magnitude);
        }
        return scalar(result);
    }

    private static long gcd(long a, long b) {
        while (b != 0) {
            long next = a % b;
            a = b;
            b = next;
        }
        return a;
    }

    private static List<Long> integers(Command command, List<DslValue> args) {
        List<Double> numbers = Arguments.numbers(command, args);
        for (double number : numbers) {
            if (!Numbers.isIntegral(number)) {
                throw Arguments.invalid(command, "expects integers, got " + Numbers.format(number));
            }
        }
        return numbers.stream().map(Double::longValue).toList();
    }

    private static AlgorithmResult scalar(double value) {
        return AlgorithmResult.of(ScalarValue.of(value));
    }
}
