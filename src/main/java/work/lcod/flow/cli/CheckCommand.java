package work.lcod.flow.cli;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.flow.api.FlowRunner;

@CommandLine.Command(
    name = "check",
    description = "Check a .flow file for errors without running it.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class
)
final class CheckCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "FILE", description = "The .flow file to check.")
    private Path file;

    @Override
    public Integer call() {
        var result = new FlowRunner().check(file);
        ConsoleReport.diagnostics(spec.commandLine().getErr(), result.diagnostics());
        if (result.hasErrors()) {
            return 1;
        }
        spec.commandLine().getOut().println("No errors found in " + file);
        return 0;
    }
}
