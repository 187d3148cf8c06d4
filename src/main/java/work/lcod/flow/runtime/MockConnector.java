package work.lcod.flow.runtime;

import java.util.LinkedHashMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicInteger;
import work.lcod.flow.ast.ServiceKind;

/**
 * In-memory connector answering with a canned value per service kind. It can be told to fail a
 * number of times before answering, which is how retry paths are exercised.
 */
public final class MockConnector implements ServiceConnector {
    private final ServiceKind kind;
    private final AtomicInteger remainingFailures;
    private final AtomicInteger calls = new AtomicInteger();

    public MockConnector(ServiceKind kind) {
        this(kind, 0);
    }

    public MockConnector(ServiceKind kind, int failCount) {
        this.kind = kind;
        this.remainingFailures = new AtomicInteger(failCount);
    }

    public int callCount() {
        return calls.get();
    }

    @Override
    public CompletionStage<ServiceResponse> call(ServiceRequest request) {
        calls.incrementAndGet();
        if (remainingFailures.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            return CompletableFuture.failedFuture(new IllegalStateException(failureMessage(request)));
        }
        return CompletableFuture.completedFuture(ServiceResponse.of(response(request)));
    }

    private String failureMessage(ServiceRequest request) {
        switch (kind) {
            case AI:
                return "AI service failed: " + request.description() + " (mock failure)";
            case PLUGIN:
                return "Plugin failed: " + request.verb() + " " + request.description() + " (mock failure)";
            case WEBHOOK:
                return "Webhook failed: " + request.verb() + " " + request.description() + " (mock failure)";
            default:
                return "Service call failed: " + request.verb() + " " + request.description() + " (mock failure)";
        }
    }

    private FlowValue response(ServiceRequest request) {
        var fields = new LinkedHashMap<String, FlowValue>();
        switch (kind) {
            case AI:
                fields.put("result", FlowValue.text("mock AI response for: " + request.description()));
                fields.put("confidence", FlowValue.number(0.85));
                break;
            case PLUGIN:
                fields.put("status", FlowValue.text("ok"));
                fields.put("data", FlowValue.text("mock plugin response for: " + request.verb() + " " + request.description()));
                break;
            case WEBHOOK:
                fields.put("status", FlowValue.text("ok"));
                break;
            default:
                fields.put("status", FlowValue.text("ok"));
                fields.put("data", FlowValue.text("mock response for: " + request.verb() + " " + request.description()));
        }
        return FlowValue.record(fields);
    }
}
