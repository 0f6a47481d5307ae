package work.geodsl.error;

public final class InvalidInputException extends DslException {
    public InvalidInputException(String message) {
        super(ErrorKind.INVALID_INPUT, null, message);
    }
}
