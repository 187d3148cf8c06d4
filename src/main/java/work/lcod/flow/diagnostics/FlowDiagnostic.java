package work.lcod.flow.diagnostics;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A located problem found in a Flow program, either while reading it or while running it.
 */
public record FlowDiagnostic(
    Severity severity,
    String file,
    int line,
    int column,
    String message,
    String sourceLine,
    Optional<String> suggestion,
    Optional<String> hint
) {
    public FlowDiagnostic {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(sourceLine, "sourceLine");
        Objects.requireNonNull(suggestion, "suggestion");
        Objects.requireNonNull(hint, "hint");
    }

    public static FlowDiagnostic error(String file, int line, int column, String message, String source) {
        return of(Severity.ERROR, file, line, column, message, source, null, null);
    }

    /**
     * Builds a diagnostic, copying the offending line out of {@code source}.
     */
    public static FlowDiagnostic of(
        Severity severity,
        String file,
        int line,
        int column,
        String message,
        String source,
        String suggestion,
        String hint
    ) {
        return new FlowDiagnostic(
            severity,
            file,
            line,
            column,
            message,
            lineOf(source, line),
            Optional.ofNullable(suggestion),
            Optional.ofNullable(hint)
        );
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("severity", severity.name().toLowerCase());
        map.put("file", file);
        map.put("line", line);
        map.put("column", column);
        map.put("message", message);
        map.put("sourceLine", sourceLine);
        suggestion.ifPresent(value -> map.put("suggestion", value));
        hint.ifPresent(value -> map.put("hint", value));
        return map;
    }

    static String lineOf(String source, int line) {
        if (source == null || line < 1) {
            return "";
        }
        String[] lines = source.split("\n", -1);
        if (line > lines.length) {
            return "";
        }
        String text = lines[line - 1];
        return text.endsWith("\r") ? text.substring(0, text.length() - 1) : text;
    }
}
