package work.lcod.flow.runtime;

import java.time.Duration;

/**
 * Waits between retry attempts. Tests swap in a recording implementation.
 */
@FunctionalInterface
public interface Sleeper {
    Sleeper REAL = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
