package work.geodsl.error;

/**
 * Malformed input text (unbalanced brackets, empty command name, bad literal).
 */
public final class SyntaxException extends DslException {
    private final int position;

    public SyntaxException(String message, int position) {
        super(ErrorKind.SYNTAX, null, message + " at position " + position);
        this.position = position;
    }

    public int position() {
        return position;
    }
}
