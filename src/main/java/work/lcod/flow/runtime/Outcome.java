package work.lcod.flow.runtime;

import java.util.Map;

/**
 * Result of running a statement list: keep going, or stop the whole workflow.
 */
sealed interface Outcome {
    enum Continue implements Outcome {
        INSTANCE
    }

    record Completed(Map<String, FlowValue> outputs) implements Outcome {}

    record Rejected(String message) implements Outcome {}
}
