package work.geodsl.error;

public final class ArgumentTypeException extends DslException {
    public ArgumentTypeException(String name, String reason) {
        super(ErrorKind.ARGUMENT_TYPE, name, name + ": " + reason);
    }
}
