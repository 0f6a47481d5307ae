package work.geodsl.error;

public final class NameUsedException extends DslException {
    public NameUsedException(String label) {
        super(ErrorKind.NAME_USED, label, "Label '" + label + "' already in use");
    }
}
