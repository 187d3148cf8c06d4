package work.lcod.flow.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "flow",
    description = "Check, run, test and format Flow workflow files.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    subcommands = {
        CheckCommand.class,
        RunCommand.class,
        TestCommand.class,
        FmtCommand.class
    }
)
final class FlowCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 1;
    }
}
