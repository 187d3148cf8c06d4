package work.lcod.flow.cli;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.flow.api.FlowRunConfiguration;
import work.lcod.flow.api.FlowRunner;
import work.lcod.flow.api.InputFiles;
import work.lcod.flow.api.RunResult;
import work.lcod.flow.diagnostics.DiagnosticFormatter;

@CommandLine.Command(
    name = "test",
    description = "Run a .flow file against mock services.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class
)
final class TestCommand implements Callable<Integer> {
    static final Map<String, String> MOCK_ENV = Map.of("API_KEY", "mock-api-key", "SECRET", "mock-secret");

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "FILE", description = "The .flow file to test.")
    private Path file;

    @CommandLine.Option(
        names = {"-i", "--input"},
        paramLabel = "JSON",
        description = "Input data as a JSON object.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String input;

    @CommandLine.Option(names = "--verbose", description = "Print the execution log.")
    private boolean verbose;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();
        out.println("Testing " + file + " with mock services...");

        var configuration = FlowRunConfiguration.builder()
            .flowFile(file)
            .inputPayload(InputFiles.parseJson(input))
            .envVars(MOCK_ENV)
            .verbose(verbose)
            .mock(true)
            .build();
        RunResult result = new FlowRunner().run(configuration);
        if (verbose) {
            ConsoleReport.log(out, result.log());
        }

        switch (result.status()) {
            case COMPLETED:
                out.println();
                out.println("Test passed: workflow completed successfully.");
                ConsoleReport.outputs(out, result.outputs(), true);
                return 0;
            case REJECTED:
                out.println();
                out.println("Test result: workflow rejected: " + result.message().orElse(""));
                return 0;
            case ERROR:
                err.println("Test failed: runtime error");
                err.println(DiagnosticFormatter.format(result.diagnostics().get(result.diagnostics().size() - 1)));
                return 1;
            default:
                ConsoleReport.diagnostics(err, result.diagnostics());
                result.message().ifPresent(err::println);
                return 1;
        }
    }
}
