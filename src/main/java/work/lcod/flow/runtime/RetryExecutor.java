package work.lcod.flow.runtime;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.flow.ast.ErrorHandler;
import work.lcod.flow.ast.SourceLocation;
import work.lcod.flow.ast.Statement;

/**
 * Runs a service call under an {@code on failure:} handler.
 *
 * <p>States: ATTEMPTING(n) moves to SUCCEEDED, or to WAITING and back to ATTEMPTING(n + 1) while
 * attempts remain. Once they are used up the fallback runs (FALLBACK_RUNNING) or the call fails
 * (FAILED).
 */
final class RetryExecutor {
    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    enum State {
        ATTEMPTING,
        WAITING,
        SUCCEEDED,
        FALLBACK_RUNNING,
        FAILED
    }

    /** One attempt of the guarded call. */
    @FunctionalInterface
    interface Attempt {
        void run();
    }

    /** Runs the fallback statements and reports how they ended. */
    @FunctionalInterface
    interface Fallback {
        Outcome run(List<Statement> statements);
    }

    private final ExecutionContext context;

    RetryExecutor(ExecutionContext context) {
        this.context = context;
    }

    /**
     * @return {@link Outcome.Continue} when an attempt succeeded, otherwise the outcome of the fallback
     * @throws FlowRuntimeException when every attempt failed and there is no fallback
     */
    Outcome execute(
        ErrorHandler handler,
        SourceLocation location,
        Map<String, Object> details,
        Attempt attempt,
        Fallback fallback
    ) {
        int maxAttempts = handler.maxAttempts();
        int retryCount = handler.retryCount().orElse(0);
        String lastError = "";
        State state = State.ATTEMPTING;
        int attemptNumber = 1;

        while (state == State.ATTEMPTING) {
            long started = System.nanoTime();
            try {
                attempt.run();
                state = State.SUCCEEDED;
            } catch (ServiceCallException ex) {
                lastError = ex.getMessage();
                Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
                log.debug("Attempt {}/{} failed: {}", attemptNumber, maxAttempts, lastError);
                if (attemptNumber < maxAttempts) {
                    context.log.add("retry " + attemptNumber + "/" + retryCount, LogOutcome.FAILURE, elapsed,
                        withError(details, lastError));
                    state = State.WAITING;
                } else {
                    state = handler.fallback().isPresent() ? State.FALLBACK_RUNNING : State.FAILED;
                }
            }

            if (state == State.WAITING) {
                waitBeforeRetry(handler.retryWait(), location);
                attemptNumber++;
                state = State.ATTEMPTING;
            }
        }

        switch (state) {
            case SUCCEEDED:
                return Outcome.Continue.INSTANCE;
            case FALLBACK_RUNNING:
                context.log.add("executing fallback", LogOutcome.SUCCESS, details);
                return fallback.run(handler.fallback().orElseThrow());
            default:
                context.log.add("all retries failed", LogOutcome.FAILURE, withError(details, lastError));
                throw context.error(location, "All " + maxAttempts + " attempts failed: " + lastError);
        }
    }

    private void waitBeforeRetry(Optional<Duration> wait, SourceLocation location) {
        if (wait.isEmpty() || wait.get().isZero()) {
            return;
        }
        Duration duration = wait.get();
        context.log.add("waiting", LogOutcome.SKIPPED, duration, Map.of());
        try {
            context.sleeper.sleep(duration);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw context.error(location, "The workflow was interrupted while waiting to retry.");
        }
    }

    private static Map<String, Object> withError(Map<String, Object> details, String error) {
        var merged = new LinkedHashMap<>(details);
        merged.put("error", error);
        return merged;
    }
}
