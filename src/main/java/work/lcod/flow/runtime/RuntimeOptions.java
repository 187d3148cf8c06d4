package work.lcod.flow.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * Inputs of one execution. Connectors missing from {@link #connectors()} are replaced by
 * {@link MockConnector}s.
 */
public record RuntimeOptions(
    Map<String, Object> input,
    Map<String, ServiceConnector> connectors,
    Map<String, String> envVars,
    boolean verbose,
    boolean strictEnv,
    Sleeper sleeper,
    String fileName,
    Optional<Executor> executor
) {
    public RuntimeOptions {
        input = Collections.unmodifiableMap(new LinkedHashMap<>(input));
        connectors = Map.copyOf(connectors);
        envVars = Map.copyOf(envVars);
        Objects.requireNonNull(sleeper, "sleeper");
        Objects.requireNonNull(fileName, "fileName");
        Objects.requireNonNull(executor, "executor");
    }

    public static RuntimeOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Map<String, Object> input = Map.of();
        private Map<String, ServiceConnector> connectors = Map.of();
        private Map<String, String> envVars = Map.of();
        private boolean verbose;
        private boolean strictEnv;
        private Sleeper sleeper = Sleeper.REAL;
        private String fileName = "<input>";
        private Optional<Executor> executor = Optional.empty();

        public Builder input(Map<String, Object> input) {
            this.input = input;
            return this;
        }

        public Builder connectors(Map<String, ServiceConnector> connectors) {
            this.connectors = connectors;
            return this;
        }

        public Builder envVars(Map<String, String> envVars) {
            this.envVars = envVars;
            return this;
        }

        public Builder verbose(boolean verbose) {
            this.verbose = verbose;
            return this;
        }

        public Builder strictEnv(boolean strictEnv) {
            this.strictEnv = strictEnv;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public Builder fileName(String fileName) {
            this.fileName = fileName;
            return this;
        }

        public Builder executor(Optional<Executor> executor) {
            this.executor = executor;
            return this;
        }

        public RuntimeOptions build() {
            return new RuntimeOptions(input, connectors, envVars, verbose, strictEnv, sleeper, fileName, executor);
        }
    }
}
