package work.lcod.flow.ast;

import java.util.Objects;

public record ConfigEntry(String key, ConfigValue value, SourceLocation location) {
    public ConfigEntry {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
    }
}
