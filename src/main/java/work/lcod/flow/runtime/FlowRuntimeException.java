package work.lcod.flow.runtime;

import work.lcod.flow.diagnostics.FlowDiagnostic;

/**
 * Fatal problem while running a program. Ends that execution only and surfaces as
 * {@link WorkflowResult.Errored}.
 */
public final class FlowRuntimeException extends RuntimeException {
    private final FlowDiagnostic diagnostic;

    public FlowRuntimeException(FlowDiagnostic diagnostic) {
        super(diagnostic.message());
        this.diagnostic = diagnostic;
    }

    public FlowDiagnostic diagnostic() {
        return diagnostic;
    }
}
