package work.lcod.flow.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.flow.lexer.LexerException;
import work.lcod.flow.parser.AstPrinter;
import work.lcod.flow.parser.ParseResult;
import work.lcod.flow.parser.Parser;

@CommandLine.Command(
    name = "fmt",
    description = "Print a .flow file in canonical form. Comments are not kept.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class
)
final class FmtCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "FILE", description = "The .flow file to format.")
    private Path file;

    @CommandLine.Option(names = {"-w", "--write"}, description = "Rewrite FILE instead of printing.")
    private boolean write;

    @Override
    public Integer call() throws IOException {
        String source = Files.readString(file, StandardCharsets.UTF_8);
        ParseResult parsed;
        try {
            parsed = Parser.parse(source, file.toString());
        } catch (LexerException ex) {
            ConsoleReport.diagnostics(spec.commandLine().getErr(), List.of(ex.diagnostic()));
            return 1;
        }
        if (parsed.hasErrors()) {
            ConsoleReport.diagnostics(spec.commandLine().getErr(), parsed.errors());
            return 1;
        }
        String formatted = AstPrinter.print(parsed.program());
        if (write) {
            Files.writeString(file, formatted, StandardCharsets.UTF_8);
            spec.commandLine().getOut().println("Formatted " + file);
        } else {
            spec.commandLine().getOut().print(formatted);
            spec.commandLine().getOut().flush();
        }
        return 0;
    }
}
