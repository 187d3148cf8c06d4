package work.lcod.flow.ast;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@code on failure:} / {@code on timeout:} block attached to a service call.
 */
public record ErrorHandler(
    Kind kind,
    Optional<Integer> retryCount,
    Optional<Duration> retryWait,
    Optional<List<Statement>> fallback,
    SourceLocation location
) {
    /** Largest count accepted in {@code retry N times}. */
    public static final int MAX_RETRIES = 100;

    public ErrorHandler {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(retryCount, "retryCount");
        if (retryCount.isPresent() && (retryCount.get() < 0 || retryCount.get() > MAX_RETRIES)) {
            throw new IllegalArgumentException("retryCount must be between 0 and " + MAX_RETRIES + ": " + retryCount.get());
        }
        Objects.requireNonNull(retryWait, "retryWait");
        fallback = fallback.map(List::copyOf);
    }

    public int maxAttempts() {
        return 1 + retryCount.orElse(0);
    }

    public enum Kind {
        FAILURE("on failure"),
        TIMEOUT("on timeout");

        private final String keyword;

        Kind(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }
    }
}
