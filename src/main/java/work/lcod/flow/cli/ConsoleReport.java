package work.lcod.flow.cli;

import java.io.PrintWriter;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import work.lcod.flow.diagnostics.DiagnosticFormatter;
import work.lcod.flow.diagnostics.FlowDiagnostic;
import work.lcod.flow.runtime.FlowValue;
import work.lcod.flow.runtime.FlowValues;
import work.lcod.flow.runtime.LogEntry;

/**
 * Human-readable output shared by the subcommands.
 */
final class ConsoleReport {
    private ConsoleReport() {}

    static void diagnostics(PrintWriter err, List<FlowDiagnostic> diagnostics) {
        if (diagnostics.isEmpty()) {
            return;
        }
        err.println(DiagnosticFormatter.formatAll(diagnostics));
        err.println();
        err.println(DiagnosticFormatter.summary(diagnostics));
    }

    static void outputs(PrintWriter out, Map<String, FlowValue> outputs, boolean asJson) {
        if (outputs.isEmpty()) {
            return;
        }
        out.println();
        out.println("Outputs:");
        outputs.forEach((key, value) -> out.println("  " + key + ": "
            + (asJson ? FlowValues.toJson(value) : FlowValues.display(value))));
    }

    static void log(PrintWriter out, List<LogEntry> log) {
        if (log.isEmpty()) {
            return;
        }
        out.println();
        out.println("--- Execution Log ---");
        for (LogEntry entry : log) {
            var line = new StringBuilder("  ");
            entry.step().ifPresent(step -> line.append('[').append(step).append("] "));
            line.append(entry.action()).append(' ').append(entry.outcome().name().toLowerCase(Locale.ROOT));
            Object message = entry.details().get("message");
            if (message != null) {
                line.append(' ').append(message);
            }
            out.println(line);
        }
        out.println("--- End Log ---");
    }
}
