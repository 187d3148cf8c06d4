package work.lcod.flow.cli;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.flow.api.FlowRunConfiguration;
import work.lcod.flow.api.FlowRunner;
import work.lcod.flow.api.FlowSettings;
import work.lcod.flow.api.FlowSettingsLoader;
import work.lcod.flow.api.InputFiles;
import work.lcod.flow.api.RunResult;
import work.lcod.flow.diagnostics.DiagnosticFormatter;
import work.lcod.flow.shared.DurationParser;

@CommandLine.Command(
    name = "run",
    description = "Run a .flow file.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class RunCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "FILE", description = "The .flow file to run.")
    private Path file;

    @CommandLine.Option(
        names = {"-i", "--input"},
        paramLabel = "JSON",
        description = "Input data as a JSON object.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String input;

    @CommandLine.Option(
        names = "--input-file",
        paramLabel = "PATH",
        description = "Input data from a .json, .yaml, .yml or .csv file.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path inputFile;

    @CommandLine.Option(names = "--verbose", description = "Print the execution log.")
    private boolean verbose;

    @CommandLine.Option(names = "--strict-env", description = "Fail on missing environment variables instead of using empty.")
    private boolean strictEnv;

    @CommandLine.Option(names = "--mock", description = "Use mock services instead of real HTTP calls.")
    private boolean mock;

    @CommandLine.Option(
        names = "--timeout",
        description = "Execution timeout (e.g. 30s, 2m, 5 minutes).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String timeoutRaw;

    @CommandLine.Option(
        names = "--settings",
        paramLabel = "PATH",
        description = "Settings file (default: flow.toml next to FILE).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path settingsFile;

    @CommandLine.Option(names = "--json", description = "Print the result as JSON.")
    private boolean json;

    @Override
    public Integer call() {
        if (input != null && inputFile != null) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Use either --input or --input-file, not both.");
        }
        FlowSettings settings = settingsFile != null
            ? FlowSettingsLoader.load(settingsFile)
            : FlowSettingsLoader.forFlowFile(file);

        Map<String, Object> payload = inputFile != null ? InputFiles.load(inputFile) : InputFiles.parseJson(input);
        Map<String, String> env = new LinkedHashMap<>(settings.env());
        env.putAll(System.getenv());
        Optional<Duration> timeout = DurationParser.parse(timeoutRaw).or(settings::timeout);

        var configuration = FlowRunConfiguration.builder()
            .flowFile(file)
            .inputPayload(payload)
            .envVars(env)
            .strictEnv(strictEnv || settings.strictEnv().orElse(false))
            .verbose(verbose || settings.verbose().orElse(false))
            .mock(mock || settings.mock().orElse(false))
            .timeout(timeout)
            .build();

        RunResult result = new FlowRunner().run(configuration);
        if (json) {
            spec.commandLine().getOut().println(result.toPrettyJson());
            return result.status().exitCode();
        }
        report(result, configuration.verbose());
        return result.status().exitCode();
    }

    private void report(RunResult result, boolean showLog) {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();
        switch (result.status()) {
            case INVALID:
                ConsoleReport.diagnostics(err, result.diagnostics());
                return;
            case COMPLETED:
                ConsoleReport.diagnostics(err, result.diagnostics());
                if (showLog) {
                    ConsoleReport.log(out, result.log());
                }
                out.println();
                out.println("Workflow completed successfully.");
                ConsoleReport.outputs(out, result.outputs(), false);
                return;
            case REJECTED:
                if (showLog) {
                    ConsoleReport.log(out, result.log());
                }
                out.println();
                out.println("Workflow rejected: " + result.message().orElse(""));
                return;
            case ERROR:
                if (showLog) {
                    ConsoleReport.log(out, result.log());
                }
                err.println(DiagnosticFormatter.format(result.diagnostics().get(result.diagnostics().size() - 1)));
                return;
            default:
                err.println(result.message().orElse("The workflow did not finish."));
        }
    }
}
