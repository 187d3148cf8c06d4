package work.lcod.flow.ast;

import java.util.List;
import java.util.Objects;

public record ServiceDeclaration(
    String name,
    ServiceKind kind,
    String target,
    List<ServiceHeader> headers,
    SourceLocation location
) {
    public ServiceDeclaration {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(target, "target");
        headers = List.copyOf(headers);
    }
}
