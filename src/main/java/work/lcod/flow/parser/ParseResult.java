package work.lcod.flow.parser;

import java.util.List;
import java.util.Objects;
import work.lcod.flow.ast.Program;
import work.lcod.flow.diagnostics.FlowDiagnostic;

/**
 * A best-effort program plus every syntax error found while building it.
 */
public record ParseResult(Program program, List<FlowDiagnostic> errors) {
    public ParseResult {
        Objects.requireNonNull(program, "program");
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
