package work.isu.core.cli;

import picocli.CommandLine;
import work.isu.core.diag.IsuParseException;
import work.isu.core.diag.IsuStaticException;
import work.isu.core.diag.StaticError;

/**
 * Keeps CLI failures short: one line per diagnostic, stack traces only with {@code -Disu.debug=true}.
 * Rejected programs exit with 2, every other failure with 1.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    static final int REJECTED = 2;

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        var err = commandLine.getErr();
        if (ex instanceof IsuStaticException staticErrors) {
            for (StaticError error : staticErrors.errors()) {
                err.println(commandLine.getColorScheme().errorText(error.toString()));
            }
        } else {
            String message = ex.getMessage();
            if (message == null || message.isBlank()) {
                message = ex.getClass().getSimpleName();
            }
            err.println(commandLine.getColorScheme().errorText(message));
        }
        if (Boolean.getBoolean("isu.debug")) {
            ex.printStackTrace(err);
        }
        if (ex instanceof IsuParseException || ex instanceof IsuStaticException) {
            return REJECTED;
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }
}
