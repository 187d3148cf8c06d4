package work.lcod.flow.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lcod.flow.shared.DurationParser;

/**
 * Reads {@code flow.toml}:
 *
 * <pre>
 * [env]
 * API_KEY = "..."
 *
 * [run]
 * strict_env = true
 * verbose = false
 * mock = false
 * timeout = "2m"
 * </pre>
 */
public final class FlowSettingsLoader {
    public static final String FILE_NAME = "flow.toml";

    private FlowSettingsLoader() {}

    /** Settings next to {@code flowFile}, or {@link FlowSettings#EMPTY} when there are none. */
    public static FlowSettings forFlowFile(Path flowFile) {
        Path parent = flowFile.toAbsolutePath().getParent();
        if (parent == null) {
            return FlowSettings.EMPTY;
        }
        Path candidate = parent.resolve(FILE_NAME);
        return Files.isRegularFile(candidate) ? load(candidate) : FlowSettings.EMPTY;
    }

    public static FlowSettings load(Path path) {
        TomlParseResult result;
        try {
            result = Toml.parse(Files.readString(path));
        } catch (IOException ex) {
            throw new IllegalArgumentException("Cannot read settings file " + path + ": " + ex.getMessage(), ex);
        }
        if (result.hasErrors()) {
            throw new IllegalArgumentException("Invalid settings file " + path + ": " + result.errors().get(0).toString());
        }

        Map<String, String> env = new LinkedHashMap<>();
        TomlTable envTable = result.getTable("env");
        if (envTable != null) {
            for (String key : envTable.keySet()) {
                Object value = envTable.get(key);
                if (value instanceof TomlTable || value == null) {
                    continue;
                }
                env.put(key, String.valueOf(value));
            }
        }

        TomlTable run = result.getTable("run");
        if (run == null) {
            return new FlowSettings(env, Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty());
        }
        return new FlowSettings(
            env,
            Optional.ofNullable(run.getBoolean("strict_env")),
            Optional.ofNullable(run.getBoolean("verbose")),
            Optional.ofNullable(run.getBoolean("mock")),
            timeout(run, path)
        );
    }

    private static Optional<Duration> timeout(TomlTable run, Path path) {
        Object raw = run.get("timeout");
        if (raw == null) {
            return Optional.empty();
        }
        if (raw instanceof Number number) {
            return Optional.of(DurationParser.ofSeconds(number.doubleValue()));
        }
        try {
            return DurationParser.parse(String.valueOf(raw));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Invalid timeout in " + path + ": " + ex.getMessage(), ex);
        }
    }
}
