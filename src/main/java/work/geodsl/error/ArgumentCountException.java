package work.geodsl.error;

public final class ArgumentCountException extends DslException {
    private final int actual;
    private final String expected;

    public ArgumentCountException(String name, int actual, String expected) {
        super(ErrorKind.ARGUMENT_COUNT, name, name + ": expected " + expected + " arguments, got " + actual);
        this.actual = actual;
        this.expected = expected;
    }

    public int actual() {
        return actual;
    }

    public String expected() {
        return expected;
    }
}
