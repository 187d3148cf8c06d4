package work.lcod.flow.diagnostics;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders diagnostics the way the CLI prints them.
 */
public final class DiagnosticFormatter {
    private static final String INDENT = "    ";

    private DiagnosticFormatter() {}

    public static String format(FlowDiagnostic diagnostic) {
        var out = new StringBuilder();
        out.append(diagnostic.severity().label())
            .append(" in ")
            .append(diagnostic.file())
            .append(", line ")
            .append(diagnostic.line())
            .append(":\n\n");
        if (!diagnostic.sourceLine().isBlank()) {
            out.append(INDENT).append(diagnostic.sourceLine().stripTrailing()).append("\n\n");
        }
        out.append(INDENT).append(diagnostic.message());
        diagnostic.suggestion().ifPresent(suggestion -> out.append("\n\n").append(INDENT).append(suggestion));
        diagnostic.hint().ifPresent(hint -> {
            out.append('\n');
            for (String line : hint.split("\n")) {
                out.append('\n').append(INDENT).append(line);
            }
        });
        return out.toString();
    }

    public static String formatAll(List<FlowDiagnostic> diagnostics) {
        return diagnostics.stream().map(DiagnosticFormatter::format).collect(Collectors.joining("\n\n"));
    }

    public static String summary(List<FlowDiagnostic> diagnostics) {
        long errors = diagnostics.stream().filter(FlowDiagnostic::isError).count();
        long warnings = diagnostics.size() - errors;
        return plural(errors, "error") + ", " + plural(warnings, "warning") + " found.";
    }

    private static String plural(long count, String noun) {
        return count + " " + noun + (count == 1 ? "" : "s");
    }
}
