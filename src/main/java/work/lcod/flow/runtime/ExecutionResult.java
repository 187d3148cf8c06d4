package work.lcod.flow.runtime;

import java.util.List;
import java.util.Objects;

public record ExecutionResult(WorkflowResult result, List<LogEntry> log) {
    public ExecutionResult {
        Objects.requireNonNull(result, "result");
        log = List.copyOf(log);
    }
}
