package work.lcod.flow.runtime;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Append-only log of one execution. Entries are tagged with the step being run.
 */
final class ExecutionLog {
    private final List<LogEntry> entries = new ArrayList<>();
    private Optional<String> currentStep = Optional.empty();

    void add(String action, LogOutcome outcome, Map<String, Object> details) {
        entries.add(new LogEntry(Instant.now(), currentStep, action, outcome, Optional.empty(), details));
    }

    void add(String action, LogOutcome outcome, Duration elapsed, Map<String, Object> details) {
        entries.add(new LogEntry(Instant.now(), currentStep, action, outcome, Optional.of(elapsed.toMillis()), details));
    }

    /** Switches the current step and returns the one it replaces. */
    Optional<String> enterStep(String name) {
        var previous = currentStep;
        currentStep = Optional.of(name);
        return previous;
    }

    void restoreStep(Optional<String> previous) {
        currentStep = previous;
    }

    List<LogEntry> entries() {
        return List.copyOf(entries);
    }
}
