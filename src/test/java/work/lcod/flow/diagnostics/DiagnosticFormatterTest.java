package work.lcod.flow.diagnostics;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.Test;

class DiagnosticFormatterTest {
    private static final String SOURCE = "workflow:\n    log totl\n";

    @Test
    void formatsLocationSourceLineAndAdvice() {
        var diagnostic = FlowDiagnostic.of(Severity.ERROR, "order.flow", 2, 9,
            "I don't recognize the variable \"totl\".", SOURCE, "Did you mean \"total\"?", "Set it first:\n    set totl to ...");

        assertEquals(String.join("\n",
            "Error in order.flow, line 2:",
            "",
            "        log totl",
            "",
            "    I don't recognize the variable \"totl\".",
            "",
            "    Did you mean \"total\"?",
            "",
            "    Set it first:",
            "        set totl to ..."
        ), DiagnosticFormatter.format(diagnostic));
    }

    @Test
    void omitsMissingParts() {
        var diagnostic = FlowDiagnostic.of(Severity.WARNING, "order.flow", 9, 1, "Unknown config key \"x\".", SOURCE, null, null);

        assertEquals("Warning in order.flow, line 9:\n\n    Unknown config key \"x\".", DiagnosticFormatter.format(diagnostic));
        assertEquals("", diagnostic.sourceLine());
    }

    @Test
    void summarizesCounts() {
        var error = FlowDiagnostic.error("a.flow", 1, 1, "bad", SOURCE);
        var warning = FlowDiagnostic.of(Severity.WARNING, "a.flow", 1, 1, "odd", SOURCE, null, null);

        assertEquals("1 error, 0 warnings found.", DiagnosticFormatter.summary(List.of(error)));
        assertEquals("2 errors, 1 warning found.", DiagnosticFormatter.summary(List.of(error, error, warning)));
    }

    @Test
    void separatesMultipleDiagnostics() {
        var first = FlowDiagnostic.error("a.flow", 1, 1, "first", "");
        var second = FlowDiagnostic.error("a.flow", 2, 1, "second", "");

        assertEquals("Error in a.flow, line 1:\n\n    first\n\nError in a.flow, line 2:\n\n    second",
            DiagnosticFormatter.formatAll(List.of(first, second)));
    }
}
