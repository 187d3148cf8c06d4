package work.lcod.flow.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.flow.support.FlowTestSupport.flowFile;
import static work.lcod.flow.support.FlowTestSupport.settingsDirectory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FlowSettingsLoaderTest {
    @Test
    void loadsEnvAndRunSections() {
        FlowSettings settings = FlowSettingsLoader.load(settingsDirectory().resolve(FlowSettingsLoader.FILE_NAME));

        assertEquals(Map.of("API_KEY", "from-settings", "RETRIES", "3"), settings.env());
        assertEquals(Optional.of(true), settings.strictEnv());
        assertEquals(Optional.of(false), settings.verbose());
        assertEquals(Optional.of(true), settings.mock());
        assertEquals(Optional.of(Duration.ofSeconds(30)), settings.timeout());
    }

    @Test
    void findsSettingsNextToFlowFile() {
        FlowSettings settings = FlowSettingsLoader.forFlowFile(settingsDirectory().resolve("env.flow"));

        assertEquals("from-settings", settings.env().get("API_KEY"));
    }

    @Test
    void noSettingsFileGivesEmpty() {
        assertSame(FlowSettings.EMPTY, FlowSettingsLoader.forFlowFile(flowFile("order.flow")));
    }

    @Test
    void numericTimeoutIsSeconds(@TempDir Path directory) throws IOException {
        Path file = Files.writeString(directory.resolve("flow.toml"), "[run]\ntimeout = 45\n");

        FlowSettings settings = FlowSettingsLoader.load(file);

        assertEquals(Optional.of(Duration.ofSeconds(45)), settings.timeout());
        assertTrue(settings.env().isEmpty());
        assertEquals(Optional.empty(), settings.mock());
    }

    @Test
    void rejectsBadTimeout(@TempDir Path directory) throws IOException {
        Path file = Files.writeString(directory.resolve("flow.toml"), "[run]\ntimeout = \"soon\"\n");

        var error = assertThrows(IllegalArgumentException.class, () -> FlowSettingsLoader.load(file));

        assertTrue(error.getMessage().startsWith("Invalid timeout in "), error.getMessage());
    }

    @Test
    void rejectsMalformedToml(@TempDir Path directory) throws IOException {
        Path file = Files.writeString(directory.resolve("flow.toml"), "[run\nmock = \n");

        var error = assertThrows(IllegalArgumentException.class, () -> FlowSettingsLoader.load(file));

        assertTrue(error.getMessage().startsWith("Invalid settings file "), error.getMessage());
    }
}
