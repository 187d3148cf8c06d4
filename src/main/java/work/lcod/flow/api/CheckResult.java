package work.lcod.flow.api;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import work.lcod.flow.ast.Program;
import work.lcod.flow.diagnostics.FlowDiagnostic;

/**
 * Result of reading a Flow file: the program (absent when lexing failed) and every diagnostic
 * found along the way.
 */
public record CheckResult(String fileName, String source, Optional<Program> program, List<FlowDiagnostic> diagnostics) {
    public CheckResult {
        Objects.requireNonNull(fileName, "fileName");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(program, "program");
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean hasErrors() {
        return program.isEmpty() || diagnostics.stream().anyMatch(FlowDiagnostic::isError);
    }

    public List<FlowDiagnostic> errors() {
        return diagnostics.stream().filter(FlowDiagnostic::isError).toList();
    }

    public List<FlowDiagnostic> warnings() {
        return diagnostics.stream().filter(diagnostic -> !diagnostic.isError()).toList();
    }
}
