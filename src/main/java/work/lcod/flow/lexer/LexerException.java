package work.lcod.flow.lexer;

import work.lcod.flow.diagnostics.FlowDiagnostic;

/**
 * Fatal lexical error; lexing stops at the first one.
 */
public final class LexerException extends RuntimeException {
    private final FlowDiagnostic diagnostic;

    public LexerException(FlowDiagnostic diagnostic) {
        super(diagnostic.message());
        this.diagnostic = diagnostic;
    }

    public FlowDiagnostic diagnostic() {
        return diagnostic;
    }
}
