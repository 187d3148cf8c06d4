package work.lcod.flow.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.flow.support.FlowTestSupport.flowFile;
import static work.lcod.flow.support.FlowTestSupport.inputFile;
import static work.lcod.flow.support.FlowTestSupport.read;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;
import work.lcod.flow.support.FlowTestSupport;

class FlowCommandTest {
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int execute(String... args) {
        CommandLine commandLine = Main.commandLine();
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    @Test
    void checkPassesCleanFile() {
        int exitCode = execute("check", flowFile("order.flow").toString());

        assertEquals(0, exitCode);
        assertTrue(out.toString().contains("No errors found in "), out.toString());
    }

    @Test
    void checkPrintsDiagnostics() {
        int exitCode = execute("check", flowFile("invalid.flow").toString());

        assertEquals(1, exitCode);
        String errors = err.toString();
        assertTrue(errors.contains("EmailVerfier"), errors);
        assertTrue(errors.contains("EmailVerifier"), errors);
    }

    @Test
    void runWithMocksPrintsOutputs() {
        int exitCode = execute("run", flowFile("order.flow").toString(),
            "--mock", "--input-file", inputFile("order.json").toString());

        assertEquals(0, exitCode);
        String printed = out.toString();
        assertTrue(printed.contains("Workflow completed successfully."), printed);
        assertTrue(printed.contains("Outputs:"), printed);
        assertTrue(printed.contains("  order_id: A-100"), printed);
        assertFalse(printed.contains("--- Execution Log ---"), printed);
    }

    @Test
    void verboseRunPrintsLog() {
        int exitCode = execute("run", flowFile("order.flow").toString(),
            "--mock", "--verbose", "--input-file", inputFile("order.json").toString());

        assertEquals(0, exitCode);
        String printed = out.toString();
        assertTrue(printed.contains("--- Execution Log ---"), printed);
        assertTrue(printed.contains("step \"Validate\" started success"), printed);
        assertTrue(printed.contains("log success Subtotal is 31"), printed);
    }

    @Test
    void runPrintsJson() {
        int exitCode = execute("run", flowFile("hello.flow").toString(), "--json", "--input", "{\"name\":\"Ada\"}");

        assertEquals(0, exitCode);
        assertTrue(out.toString().contains("\"status\" : \"completed\""), out.toString());
    }

    @Test
    void runReportsRuntimeError() {
        int exitCode = execute("run", flowFile("divide.flow").toString());

        assertEquals(1, exitCode);
        assertTrue(err.toString().contains("divide.flow"), err.toString());
    }

    @Test
    void runRejectsBothInputs() {
        int exitCode = execute("run", flowFile("hello.flow").toString(),
            "--input", "{}", "--input-file", inputFile("order.json").toString());

        assertEquals(2, exitCode);
        assertTrue(err.toString().contains("Use either --input or --input-file, not both."), err.toString());
    }

    @Test
    void badInputIsShortError() {
        int exitCode = execute("run", flowFile("hello.flow").toString(), "--input", "[1]");

        assertEquals(1, exitCode);
        assertTrue(err.toString().contains("Error: The input must be a JSON object"), err.toString());
    }

    @Test
    void testCommandUsesMocks() {
        int exitCode = execute("test", flowFile("retry.flow").toString(), "--input", "{\"sku\":\"B-7\"}");

        assertEquals(0, exitCode);
        String printed = out.toString();
        assertTrue(printed.startsWith("Testing "), printed);
        assertTrue(printed.contains("Test passed: workflow completed successfully."), printed);
        assertTrue(printed.contains("reservation: \"ok\""), printed);
    }

    @Test
    void fmtPrintsCanonicalSource() {
        int exitCode = execute("fmt", flowFile("messy.flow").toString());

        assertEquals(0, exitCode);
        assertEquals(FlowTestSupport.source(
            "workflow:",
            "    set total to 2 plus 3",
            "    complete with total total"
        ), out.toString());
    }

    @Test
    void fmtWritesFile(@TempDir Path directory) throws IOException {
        Path copy = Files.writeString(directory.resolve("messy.flow"), read(flowFile("messy.flow")));

        int exitCode = execute("fmt", "--write", copy.toString());

        assertEquals(0, exitCode);
        assertTrue(Files.readString(copy).startsWith("workflow:\n    set total to 2 plus 3"));
    }

    @Test
    void fmtRefusesBrokenFile() {
        assertEquals(1, execute("fmt", flowFile("tabs.flow").toString()));
        assertFalse(err.toString().isEmpty());
    }

    @Test
    void missingFileIsNamed() {
        int exitCode = execute("fmt", Path.of("no", "such.flow").toString());

        assertEquals(1, exitCode);
        assertTrue(err.toString().contains("Error: File not found: " + Path.of("no", "such.flow")), err.toString());
    }

    @Test
    void versionNamesRuntime() {
        int exitCode = execute("--version");

        assertEquals(0, exitCode);
        assertTrue(out.toString().startsWith("flow "), out.toString());
        assertTrue(out.toString().contains("Java " + Runtime.version()), out.toString());
    }

    @Test
    void noSubcommandPrintsUsage() {
        int exitCode = execute();

        assertEquals(1, exitCode);
        assertTrue(out.toString().contains("Usage: flow"), out.toString());
    }
}
