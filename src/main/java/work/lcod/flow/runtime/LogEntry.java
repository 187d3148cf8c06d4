package work.lcod.flow.runtime;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One line of the user-visible execution log.
 */
public record LogEntry(
    Instant timestamp,
    Optional<String> step,
    String action,
    LogOutcome outcome,
    Optional<Long> durationMillis,
    Map<String, Object> details
) {
    public LogEntry {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(step, "step");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(durationMillis, "durationMillis");
        details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("timestamp", timestamp.toString());
        step.ifPresent(value -> map.put("step", value));
        map.put("action", action);
        map.put("outcome", outcome.name().toLowerCase(Locale.ROOT));
        durationMillis.ifPresent(value -> map.put("durationMillis", value));
        if (!details.isEmpty()) {
            map.put("details", details);
        }
        return map;
    }
}
