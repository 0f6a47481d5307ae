package work.geodsl.error;

public final class UndefinedLabelException extends DslException {
    public UndefinedLabelException(String label) {
        super(ErrorKind.UNDEFINED_LABEL, label, "Undefined variable: " + label);
    }
}
