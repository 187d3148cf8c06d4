package work.lcod.flow.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.flow.support.FlowTestSupport.flowFile;
import static work.lcod.flow.support.FlowTestSupport.inputFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.flow.ast.Program;
import work.lcod.flow.ast.ServiceKind;
import work.lcod.flow.diagnostics.FlowDiagnostic;
import work.lcod.flow.parser.Parser;
import work.lcod.flow.runtime.FlowValue;
import work.lcod.flow.runtime.MockConnector;
import work.lcod.flow.runtime.ServiceConnector;
import work.lcod.flow.runtime.ServiceResponse;

class FlowRunnerTest {
    private final FlowRunner runner = new FlowRunner();

    @Test
    void checkReportsEveryProblem() {
        CheckResult result = runner.check(flowFile("invalid.flow"));

        assertTrue(result.hasErrors());
        assertEquals(2, result.errors().size());
        assertEquals(1, result.warnings().size());
        assertTrue(result.program().isPresent());
    }

    @Test
    void checkSurvivesLexerFailure() {
        CheckResult result = runner.check(flowFile("tabs.flow"));

        assertTrue(result.program().isEmpty());
        assertTrue(result.hasErrors());
        assertEquals(1, result.diagnostics().size());
    }

    @Test
    void checkOfCleanFile() {
        CheckResult result = runner.check(flowFile("order.flow"));

        assertFalse(result.hasErrors());
        assertTrue(result.diagnostics().isEmpty());
    }

    @Test
    void oversizedRetryCountIsReportedAsDiagnostic() {
        CheckResult result = runner.check(String.join("\n",
            "services:",
            "    Store is an API at \"https://store.example.com\"",
            "workflow:",
            "    sync the data using Store",
            "        on failure:",
            "            retry 99999999999 times",
            ""), "retry.flow");

        assertTrue(result.hasErrors());
        assertEquals(1, result.errors().size());
        assertEquals(6, result.errors().get(0).line());
    }

    @Test
    void missingFileIsReported() {
        var error = assertThrows(IllegalArgumentException.class, () -> runner.check(Path.of("no", "such.flow")));

        assertTrue(error.getMessage().startsWith("Could not read file"));
    }

    @Test
    void runsOrderFlowWithMocks() {
        RunResult result = runner.run(FlowRunConfiguration.builder()
            .flowFile(flowFile("order.flow"))
            .inputPayload(InputFiles.load(inputFile("order.json")))
            .envVars(Map.of("API_KEY", "secret"))
            .mock(true)
            .sleeper(duration -> {})
            .build());

        assertEquals(RunResult.Status.COMPLETED, result.status());
        assertEquals(0, result.status().exitCode());
        assertEquals(FlowValue.text("A-100"), result.outputs().get("order_id"));
        assertEquals(FlowValue.number(31), result.outputs().get("total"));
        assertEquals(FlowValue.text("processed"), result.outputs().get("status"));
        assertFalse(result.log().isEmpty());
    }

    @Test
    void doesNotRunInvalidFile() {
        RunResult result = runner.run(FlowRunConfiguration.builder().flowFile(flowFile("invalid.flow")).mock(true).build());

        assertEquals(RunResult.Status.INVALID, result.status());
        assertEquals(1, result.status().exitCode());
        assertEquals(3, result.diagnostics().size());
        assertTrue(result.log().isEmpty());
    }

    @Test
    void reportsRejectionFromFallback() {
        RunResult result = runner.run(FlowRunConfiguration.builder()
            .flowFile(flowFile("fallback.flow"))
            .connectors(Map.of("Payments", new MockConnector(ServiceKind.API, 5)))
            .build());

        assertEquals(RunResult.Status.REJECTED, result.status());
        assertEquals(Optional.of("Payment could not be processed"), result.message());
    }

    @Test
    void reportsRuntimeError() {
        RunResult result = runner.run(FlowRunConfiguration.builder().flowFile(flowFile("divide.flow")).build());

        assertEquals(RunResult.Status.ERROR, result.status());
        FlowDiagnostic error = result.diagnostics().get(result.diagnostics().size() - 1);
        assertTrue(error.isError());
        assertEquals(3, error.line());
        assertEquals(result.message(), Optional.of(error.message()));
    }

    @Test
    void explicitConnectorsOverrideMocks() {
        ServiceConnector inventory = request -> CompletableFuture.completedFuture(
            ServiceResponse.of(FlowValue.record(Map.of("status", FlowValue.text("reserved")))));

        RunResult result = runner.run(FlowRunConfiguration.builder()
            .flowFile(flowFile("retry.flow"))
            .inputPayload(Map.of("sku", "B-7"))
            .mock(true)
            .connectors(Map.of("Inventory", inventory))
            .build());

        assertEquals(RunResult.Status.COMPLETED, result.status());
        assertEquals(FlowValue.text("reserved"), result.outputs().get("reservation"));
    }

    @Test
    void timesOutStalledWorkflow(@TempDir Path directory) throws IOException {
        Path flow = directory.resolve("stalled.flow");
        Files.writeString(flow, String.join("\n",
            "services:",
            "    Store is an API at \"https://store.example.com\"",
            "workflow:",
            "    load the cart using Store",
            "    complete with done true",
            ""));
        ServiceConnector stalled = request -> new CompletableFuture<>();

        RunResult result = runner.run(FlowRunConfiguration.builder()
            .flowFile(flow)
            .connectors(Map.of("Store", stalled))
            .timeout(Optional.of(Duration.ofMillis(200)))
            .build());

        assertEquals(RunResult.Status.TIMEOUT, result.status());
        assertEquals(Optional.of("The workflow timed out after 200 milliseconds."), result.message());
    }

    @Test
    void readsTimeoutFromConfig() {
        Program withMinutes = Parser.parse(String.join("\n", "config:", "    timeout: 5 minutes", ""), "t.flow").program();
        Program withSeconds = Parser.parse(String.join("\n", "config:", "    timeout: 90", ""), "t.flow").program();
        Program without = Parser.parse(String.join("\n", "config:", "    name: \"x\"", ""), "t.flow").program();

        assertEquals(Optional.of(Duration.ofMinutes(5)), FlowRunner.configuredTimeout(withMinutes));
        assertEquals(Optional.of(Duration.ofSeconds(90)), FlowRunner.configuredTimeout(withSeconds));
        assertEquals(Optional.empty(), FlowRunner.configuredTimeout(without));
    }

    @Test
    void serializesCompletedRun() {
        RunResult result = runner.run(FlowRunConfiguration.builder()
            .flowFile(flowFile("hello.flow"))
            .inputPayload(Map.of("name", "Ada"))
            .build());

        Map<String, Object> serialized = result.toSerializableMap();

        assertEquals("completed", serialized.get("status"));
        assertEquals(Map.of("greeting", "Hello, Ada"), serialized.get("outputs"));
        assertTrue(serialized.containsKey("startedAt"));
        assertTrue(result.toPrettyJson().contains("\"greeting\" : \"Hello, Ada\""));
        assertEquals(List.of("status", "outputs", "log", "startedAt", "finishedAt"), List.copyOf(serialized.keySet()));
    }
}
