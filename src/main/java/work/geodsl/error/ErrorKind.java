package work.geodsl.error;

/**
 * Closed set of failure kinds reported for a rejected input line.
 */
public enum ErrorKind {
    SYNTAX("SyntaxError"),
    INVALID_INPUT("InvalidInputError"),
    COMMAND_NOT_FOUND("CommandNotFoundError"),
    COMMAND_DISALLOWED("CommandDisallowedError"),
    ARGUMENT_COUNT("ArgumentCountError"),
    ARGUMENT_TYPE("ArgumentTypeError"),
    ILLEGAL_ARGUMENT("IllegalArgumentError"),
    UNDEFINED_LABEL("UndefinedLabelError"),
    NAME_USED("NameUsedError"),
    CIRCULAR_DEFINITION("CircularDefinitionError"),
    /** A defect inside the kernel or a plugged-in filter, not a problem with the input. */
    INTERNAL("InternalError");

    private final String code;

    ErrorKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
