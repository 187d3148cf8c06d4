package work.lcod.flow.cli;

import java.io.UncheckedIOException;
import java.nio.file.NoSuchFileException;
import picocli.CommandLine;
import work.lcod.flow.diagnostics.DiagnosticFormatter;
import work.lcod.flow.lexer.LexerException;

/**
 * Prints one short line per failure instead of a stack trace. Flow diagnostics keep their block
 * format; missing files name the path.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        var err = commandLine.getErr();
        if (ex instanceof LexerException lexerException) {
            err.println(DiagnosticFormatter.format(lexerException.diagnostic()));
            return commandLine.getCommandSpec().exitCodeOnExecutionException();
        }
        err.println(commandLine.getColorScheme().errorText("Error: " + describe(ex)));
        if (Boolean.getBoolean("flow.debug")) {
            ex.printStackTrace(err);
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    static String describe(Throwable error) {
        Throwable cause = error instanceof UncheckedIOException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof NoSuchFileException missing) {
            return "File not found: " + missing.getFile();
        }
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }
}
