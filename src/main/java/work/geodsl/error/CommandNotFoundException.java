package work.geodsl.error;

public final class CommandNotFoundException extends DslException {
    public CommandNotFoundException(String name) {
        super(ErrorKind.COMMAND_NOT_FOUND, name, "Unknown command: " + name);
    }

    public CommandNotFoundException(String name, String detail) {
        super(ErrorKind.COMMAND_NOT_FOUND, name, "Unknown command: " + name + " (" + detail + ")");
    }
}
