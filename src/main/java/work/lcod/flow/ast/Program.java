package work.lcod.flow.ast;

import java.util.Objects;
import java.util.Optional;

/**
 * Root of a parsed Flow file; each block appears at most once.
 */
public record Program(
    Optional<ConfigBlock> config,
    Optional<ServicesBlock> services,
    Optional<WorkflowBlock> workflow,
    SourceLocation location
) {
    public Program {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(services, "services");
        Objects.requireNonNull(workflow, "workflow");
        Objects.requireNonNull(location, "location");
    }

    /** Looks up a declared service by exact name. */
    public Optional<ServiceDeclaration> service(String name) {
        return services.flatMap(block -> block.declarations().stream()
            .filter(declaration -> declaration.name().equals(name))
            .findFirst());
    }

    public Optional<ConfigEntry> configEntry(String key) {
        return config.flatMap(block -> block.entries().stream()
            .filter(entry -> entry.key().equals(key))
            .findFirst());
    }
}
