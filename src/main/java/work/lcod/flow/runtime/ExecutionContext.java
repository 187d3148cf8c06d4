package work.lcod.flow.runtime;

import java.util.Map;
import work.lcod.flow.ast.SourceLocation;
import work.lcod.flow.diagnostics.FlowDiagnostic;

/**
 * Per-execution state shared by the evaluator, the retry executor and the interpreter.
 */
final class ExecutionContext {
    final String source;
    final String fileName;
    final ExecutionLog log;
    final boolean verbose;
    final boolean strictEnv;
    final Sleeper sleeper;
    final Map<String, ServiceConnector> connectors;
    final Map<String, Map<String, String>> resolvedHeaders;

    ExecutionContext(
        String source,
        String fileName,
        ExecutionLog log,
        boolean verbose,
        boolean strictEnv,
        Sleeper sleeper,
        Map<String, ServiceConnector> connectors,
        Map<String, Map<String, String>> resolvedHeaders
    ) {
        this.source = source;
        this.fileName = fileName;
        this.log = log;
        this.verbose = verbose;
        this.strictEnv = strictEnv;
        this.sleeper = sleeper;
        this.connectors = connectors;
        this.resolvedHeaders = resolvedHeaders;
    }

    FlowRuntimeException error(SourceLocation location, String message) {
        return new FlowRuntimeException(
            FlowDiagnostic.error(fileName, location.line(), location.column(), message, source)
        );
    }
}
