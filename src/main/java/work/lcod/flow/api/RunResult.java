package work.lcod.flow.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import work.lcod.flow.diagnostics.FlowDiagnostic;
import work.lcod.flow.runtime.FlowValue;
import work.lcod.flow.runtime.FlowValues;
import work.lcod.flow.runtime.LogEntry;

/**
 * Outcome of a {@link FlowRunner} execution (usable by the CLI and embedding apps).
 */
public record RunResult(
    Status status,
    Map<String, FlowValue> outputs,
    Optional<String> message,
    List<FlowDiagnostic> diagnostics,
    List<LogEntry> log,
    Instant startedAt,
    Instant finishedAt
) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public RunResult {
        outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        diagnostics = List.copyOf(diagnostics);
        log = List.copyOf(log);
    }

    public static RunResult completed(Map<String, FlowValue> outputs, List<FlowDiagnostic> warnings, List<LogEntry> log,
        Instant startedAt) {
        return new RunResult(Status.COMPLETED, outputs, Optional.empty(), warnings, log, startedAt, Instant.now());
    }

    public static RunResult rejected(String message, List<FlowDiagnostic> warnings, List<LogEntry> log, Instant startedAt) {
        return new RunResult(Status.REJECTED, Map.of(), Optional.of(message), warnings, log, startedAt, Instant.now());
    }

    public static RunResult error(FlowDiagnostic error, List<FlowDiagnostic> warnings, List<LogEntry> log, Instant startedAt) {
        var diagnostics = new ArrayList<>(warnings);
        diagnostics.add(error);
        return new RunResult(Status.ERROR, Map.of(), Optional.of(error.message()), diagnostics, log, startedAt, Instant.now());
    }

    public static RunResult invalid(List<FlowDiagnostic> diagnostics, Instant startedAt) {
        return new RunResult(Status.INVALID, Map.of(), Optional.empty(), diagnostics, List.of(), startedAt, Instant.now());
    }

    public static RunResult timeout(String message, Instant startedAt) {
        return new RunResult(Status.TIMEOUT, Map.of(), Optional.of(message), List.of(), List.of(), startedAt, Instant.now());
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase(Locale.ROOT));
        if (status == Status.COMPLETED) {
            serializable.put("outputs", FlowValues.toJava(outputs));
        }
        message.ifPresent(value -> serializable.put("message", value));
        if (!diagnostics.isEmpty()) {
            serializable.put("diagnostics", diagnostics.stream().map(FlowDiagnostic::toSerializableMap).toList());
        }
        serializable.put("log", log.stream().map(LogEntry::toSerializableMap).toList());
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getMessage() + "\"}";
        }
    }

    public enum Status {
        COMPLETED(0),
        REJECTED(1),
        ERROR(1),
        INVALID(1),
        TIMEOUT(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
