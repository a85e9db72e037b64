package work.lcod.lookup.cli;

import java.util.Locale;
import picocli.CommandLine;
import work.lcod.lookup.api.LookupException;

/**
 * Keeps CLI failures short and focused on the root cause.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    static final int LOOKUP_FAILURE_EXIT_CODE = 1;

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            message = ex.getClass().getSimpleName();
        }
        if (ex instanceof LookupException lookupFailure) {
            message = lookupFailure.kind().name().toLowerCase(Locale.ROOT) + ": " + message;
        }
        commandLine.getErr().println(commandLine.getColorScheme().errorText(message));
        if (Boolean.getBoolean("lcod.lookup.debug")) {
            ex.printStackTrace(commandLine.getErr());
        }
        return ex instanceof LookupException
            ? LOOKUP_FAILURE_EXIT_CODE
            : commandLine.getCommandSpec().exitCodeOnExecutionException();
    }
}
