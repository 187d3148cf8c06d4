package work.lcod.flow.ast;

import java.util.List;
import java.util.Objects;

public record OtherwiseIf(Expression condition, List<Statement> body, SourceLocation location) {
    public OtherwiseIf {
        Objects.requireNonNull(condition, "condition");
        body = List.copyOf(body);
    }
}
