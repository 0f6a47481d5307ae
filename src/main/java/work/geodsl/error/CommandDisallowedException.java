package work.geodsl.error;

public final class CommandDisallowedException extends DslException {
    private final String reason;

    public CommandDisallowedException(String name, String reason) {
        super(ErrorKind.COMMAND_DISALLOWED, name, "Command '" + name + "' is not allowed: " + reason);
        this.reason = reason;
    }

    public String reason() {
        return reason;
    }
}
