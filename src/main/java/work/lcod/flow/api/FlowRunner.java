package work.lcod.flow.api;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.flow.analyzer.Analyzer;
import work.lcod.flow.ast.ConfigValue;
import work.lcod.flow.ast.Program;
import work.lcod.flow.ast.ServicesBlock;
import work.lcod.flow.connectors.Connectors;
import work.lcod.flow.diagnostics.FlowDiagnostic;
import work.lcod.flow.lexer.Lexer;
import work.lcod.flow.lexer.LexerException;
import work.lcod.flow.lexer.Token;
import work.lcod.flow.parser.ParseResult;
import work.lcod.flow.parser.Parser;
import work.lcod.flow.runtime.ExecutionResult;
import work.lcod.flow.runtime.Interpreter;
import work.lcod.flow.runtime.RuntimeOptions;
import work.lcod.flow.runtime.ServiceConnector;
import work.lcod.flow.runtime.WorkflowResult;
import work.lcod.flow.shared.DurationParser;

/**
 * Public entry point for embedding Flow: reads, checks and runs a {@code .flow} file.
 */
public final class FlowRunner {
    private static final Logger log = LoggerFactory.getLogger(FlowRunner.class);

    public CheckResult check(Path flowFile) {
        return check(readSource(flowFile), flowFile.toString());
    }

    /** Lexes, parses and analyzes {@code source}. Never throws for problems in the program. */
    public CheckResult check(String source, String fileName) {
        List<Token> tokens;
        try {
            tokens = Lexer.tokenize(source, fileName);
        } catch (LexerException ex) {
            return new CheckResult(fileName, source, Optional.empty(), List.of(ex.diagnostic()));
        }
        ParseResult parsed = Parser.parse(tokens, source, fileName);
        var diagnostics = new ArrayList<>(parsed.errors());
        diagnostics.addAll(Analyzer.analyze(parsed.program(), source, fileName));
        return new CheckResult(fileName, source, Optional.of(parsed.program()), diagnostics);
    }

    public RunResult run(FlowRunConfiguration configuration) {
        var started = Instant.now();
        String fileName = configuration.flowFile().toString();
        CheckResult checked = check(configuration.flowFile());
        if (checked.hasErrors()) {
            log.info("Not running {}: {} problem(s) found", fileName, checked.errors().size());
            return RunResult.invalid(checked.diagnostics(), started);
        }
        Program program = checked.program().orElseThrow();
        List<FlowDiagnostic> warnings = checked.warnings();

        var options = RuntimeOptions.builder()
            .input(configuration.inputPayload())
            .connectors(connectorsFor(program, configuration))
            .envVars(configuration.envVars())
            .verbose(configuration.verbose())
            .strictEnv(configuration.strictEnv())
            .sleeper(configuration.sleeper())
            .fileName(fileName)
            .executor(configuration.executor())
            .build();

        Optional<Duration> timeout = configuration.timeout().or(() -> configuredTimeout(program));
        log.info("Running {}", fileName);
        CompletableFuture<ExecutionResult> future = Interpreter.execute(program, checked.source(), options);
        ExecutionResult execution;
        try {
            execution = timeout.isPresent()
                ? future.get(timeout.get().toMillis(), TimeUnit.MILLISECONDS)
                : future.get();
        } catch (TimeoutException ex) {
            future.cancel(true);
            log.warn("{} timed out after {}", fileName, timeout.get());
            return RunResult.timeout("The workflow timed out after " + describe(timeout.get()) + ".", started);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while running " + fileName, ex);
        } catch (ExecutionException ex) {
            throw new IllegalStateException("Unable to run " + fileName + ": " + ex.getCause().getMessage(), ex.getCause());
        }

        WorkflowResult result = execution.result();
        log.info("Finished {} with {}", fileName, result.getClass().getSimpleName());
        if (result instanceof WorkflowResult.Completed completed) {
            return RunResult.completed(completed.outputs(), warnings, execution.log(), started);
        }
        if (result instanceof WorkflowResult.Rejected rejected) {
            return RunResult.rejected(rejected.message(), warnings, execution.log(), started);
        }
        if (result instanceof WorkflowResult.Errored errored) {
            return RunResult.error(errored.diagnostic(), warnings, execution.log(), started);
        }
        throw new IllegalStateException("Unknown result " + result);
    }

    private static Map<String, ServiceConnector> connectorsFor(Program program, FlowRunConfiguration configuration) {
        Map<String, ServiceConnector> connectors = new LinkedHashMap<>(Connectors.forDeclarations(
            program.services().map(ServicesBlock::declarations).orElse(List.of()),
            configuration.mock()
        ));
        connectors.putAll(configuration.connectors());
        return connectors;
    }

    /** The {@code timeout} config key: a number of seconds or a duration text. */
    static Optional<Duration> configuredTimeout(Program program) {
        return program.configEntry("timeout").flatMap(entry -> {
            if (entry.value() instanceof ConfigValue.Numeric numeric) {
                return Optional.of(DurationParser.ofSeconds(numeric.value()));
            }
            if (entry.value() instanceof ConfigValue.Text text) {
                return DurationParser.parse(text.value());
            }
            return Optional.empty();
        }).filter(duration -> !duration.isZero());
    }

    private static String describe(Duration duration) {
        long millis = duration.toMillis();
        if (millis % 1_000L == 0) {
            long seconds = millis / 1_000L;
            return seconds + (seconds == 1 ? " second" : " seconds");
        }
        return millis + " milliseconds";
    }

    private static String readSource(Path flowFile) {
        try {
            return Files.readString(flowFile, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new IllegalArgumentException("Could not read file \"" + flowFile + "\"", ex);
        }
    }
}
