package work.lcod.flow.api;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import work.lcod.flow.runtime.ServiceConnector;
import work.lcod.flow.runtime.Sleeper;

/**
 * Immutable configuration passed to {@link FlowRunner} when running a Flow file.
 */
public record FlowRunConfiguration(
    Path flowFile,
    Map<String, Object> inputPayload,
    Map<String, String> envVars,
    boolean strictEnv,
    boolean verbose,
    boolean mock,
    Optional<Duration> timeout,
    Map<String, ServiceConnector> connectors,
    Optional<Executor> executor,
    Sleeper sleeper
) {
    public FlowRunConfiguration {
        Objects.requireNonNull(flowFile, "flowFile");
        inputPayload = Collections.unmodifiableMap(new LinkedHashMap<>(inputPayload));
        envVars = Map.copyOf(envVars);
        Objects.requireNonNull(timeout, "timeout");
        connectors = Map.copyOf(connectors);
        Objects.requireNonNull(executor, "executor");
        Objects.requireNonNull(sleeper, "sleeper");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path flowFile;
        private Map<String, Object> inputPayload = Map.of();
        private Map<String, String> envVars = Map.of();
        private boolean strictEnv;
        private boolean verbose;
        private boolean mock;
        private Optional<Duration> timeout = Optional.empty();
        private Map<String, ServiceConnector> connectors = Map.of();
        private Optional<Executor> executor = Optional.empty();
        private Sleeper sleeper = Sleeper.REAL;

        public Builder flowFile(Path flowFile) {
            this.flowFile = flowFile;
            return this;
        }

        public Builder inputPayload(Map<String, Object> inputPayload) {
            this.inputPayload = inputPayload;
            return this;
        }

        public Builder envVars(Map<String, String> envVars) {
            this.envVars = envVars;
            return this;
        }

        public Builder strictEnv(boolean strictEnv) {
            this.strictEnv = strictEnv;
            return this;
        }

        public Builder verbose(boolean verbose) {
            this.verbose = verbose;
            return this;
        }

        public Builder mock(boolean mock) {
            this.mock = mock;
            return this;
        }

        public Builder timeout(Optional<Duration> timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder connectors(Map<String, ServiceConnector> connectors) {
            this.connectors = connectors;
            return this;
        }

        public Builder executor(Optional<Executor> executor) {
            this.executor = executor;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public FlowRunConfiguration build() {
            return new FlowRunConfiguration(
                flowFile,
                inputPayload,
                envVars,
                strictEnv,
                verbose,
                mock,
                timeout,
                connectors,
                executor,
                sleeper
            );
        }
    }
}
