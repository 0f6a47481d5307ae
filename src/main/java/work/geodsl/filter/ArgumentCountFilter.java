package work.geodsl.filter;

import java.util.List;
import work.geodsl.command.Command;
import work.geodsl.error.ErrorKind;
import work.geodsl.value.DslValue;

/**
 * Bounds the number of arguments any command may receive, on top of each command's own arity.
 */
public final class ArgumentCountFilter implements ArgumentFilter {
    private final int min;
    private final int max;

    public ArgumentCountFilter(int min, int max) {
        if (min < 0 || max < min) {
            throw new IllegalArgumentException("Invalid argument bounds [" + min + ", " + max + "]");
        }
        this.min = min;
        this.max = max;
    }

    public int min() {
        return min;
    }

    public int max() {
        return max;
    }

    @Override
    public FilterDecision check(Command command, List<DslValue> arguments, FilterContext context) {
        int count = arguments.size();
        if (count < min || count > max) {
            String expected = min == max ? Integer.toString(min) : min + ".." + max;
            return FilterDecision.deny(ErrorKind.ARGUMENT_COUNT, expected);
        }
        return FilterDecision.allow();
    }
}
