package work.lcod.flow.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

public record WorkflowBlock(Optional<Trigger> trigger, List<Statement> body, SourceLocation location) {
    public WorkflowBlock {
        Objects.requireNonNull(trigger, "trigger");
        body = List.copyOf(body);
    }
}
