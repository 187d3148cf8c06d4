package work.lcod.flow.ast;

import java.util.List;

public record ConfigBlock(List<ConfigEntry> entries, SourceLocation location) {
    public ConfigBlock {
        entries = List.copyOf(entries);
    }
}
