package work.geodsl.error;

/**
 * Raised by leaf algorithms when argument values are well-shaped but unusable (division by zero,
 * an empty sample, coincident points).
 */
public final class InvalidArgumentException extends DslException {
    public InvalidArgumentException(String name, String message) {
        super(ErrorKind.ILLEGAL_ARGUMENT, name, name + ": " + message);
    }

    public InvalidArgumentException(String name, String message, Throwable cause) {
        super(ErrorKind.ILLEGAL_ARGUMENT, name, name + ": " + message, cause);
    }
}
