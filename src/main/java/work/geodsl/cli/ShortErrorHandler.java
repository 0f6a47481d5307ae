package work.geodsl.cli;

import picocli.CommandLine;
import work.geodsl.error.DslException;

/**
 * Prints a single line for failures that escape the runner. Unreadable scripts and invalid
 * configuration count as usage errors; set {@code -Dgeodsl.debug=true} for the stack trace.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        commandLine.getErr().println(commandLine.getColorScheme().errorText(describe(ex)));
        if (Boolean.getBoolean("geodsl.debug")) {
            ex.printStackTrace(commandLine.getErr());
        }
        if (ex instanceof IllegalArgumentException) {
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    static String describe(Exception ex) {
        if (ex instanceof DslException dsl) {
            return dsl.kind().code() + ": " + dsl.getMessage();
        }
        String message = ex.getMessage();
        return message == null || message.isBlank() ? ex.getClass().getSimpleName() : "geodsl: " + message;
    }
}
