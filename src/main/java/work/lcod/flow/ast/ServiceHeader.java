package work.lcod.flow.ast;

import java.util.Objects;

/**
 * A request header attached to a service; the value is evaluated once when a run starts.
 */
public record ServiceHeader(String name, Expression value, SourceLocation location) {
    public ServiceHeader {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
    }
}
