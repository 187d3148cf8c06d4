package work.lcod.flow.ast;

import java.util.Objects;

/**
 * Named value passed to a service call or produced by {@code complete with}.
 */
public record Parameter(String name, Expression value, SourceLocation location) {
    public Parameter {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
    }
}
