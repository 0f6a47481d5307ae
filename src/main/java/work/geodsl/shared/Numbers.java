package work.geodsl.shared;

/**
 * Number rendering helpers so integral doubles print and serialise without a trailing {@code .0}.
 */
public final class Numbers {
    private static final double INTEGRAL_LIMIT = 1e15;

    private Numbers() {}

    public static boolean isIntegral(double value) {
        return !Double.isInfinite(value) && value == Math.rint(value) && Math.abs(value) < INTEGRAL_LIMIT;
    }

    public static String format(double value) {
        if (isIntegral(value)) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    public static Number plain(double value) {
        if (isIntegral(value)) {
            return (long) value;
        }
        return value;
    }
}
