package work.keymap.zmk2kanata.cli;

import java.io.UncheckedIOException;
import picocli.CommandLine;
import work.keymap.zmk2kanata.error.ConversionException;

/**
 * Prints one line per failure; the stack trace only with {@code -Dzmk2kanata.debug=true}.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        commandLine.getErr().println(commandLine.getColorScheme().errorText(describe(ex)));
        if (Boolean.getBoolean("zmk2kanata.debug")) {
            ex.printStackTrace(commandLine.getErr());
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    static String describe(Exception ex) {
        if (ex instanceof ConversionException conversion) {
            return conversion.error().describe();
        }
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            message = ex.getClass().getSimpleName();
        }
        if (ex instanceof UncheckedIOException && ex.getCause() != null) {
            message = message + " (" + ex.getCause().getMessage() + ")";
        }
        return message;
    }
}
