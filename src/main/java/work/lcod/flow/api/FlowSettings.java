package work.lcod.flow.api;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Project settings read from {@code flow.toml}. Unset keys stay empty so command-line flags can
 * take over.
 */
public record FlowSettings(
    Map<String, String> env,
    Optional<Boolean> strictEnv,
    Optional<Boolean> verbose,
    Optional<Boolean> mock,
    Optional<Duration> timeout
) {
    public static final FlowSettings EMPTY =
        new FlowSettings(Map.of(), Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty());

    public FlowSettings {
        env = Map.copyOf(env);
        Objects.requireNonNull(strictEnv, "strictEnv");
        Objects.requireNonNull(verbose, "verbose");
        Objects.requireNonNull(mock, "mock");
        Objects.requireNonNull(timeout, "timeout");
    }
}
