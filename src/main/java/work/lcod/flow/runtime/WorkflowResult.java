package work.lcod.flow.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import work.lcod.flow.diagnostics.FlowDiagnostic;

/**
 * How an execution ended.
 */
public sealed interface WorkflowResult {
    record Completed(Map<String, FlowValue> outputs) implements WorkflowResult {
        public Completed {
            outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        }
    }

    record Rejected(String message) implements WorkflowResult {
        public Rejected {
            Objects.requireNonNull(message, "message");
        }
    }

    record Errored(FlowDiagnostic diagnostic) implements WorkflowResult {
        public Errored {
            Objects.requireNonNull(diagnostic, "diagnostic");
        }
    }
}
