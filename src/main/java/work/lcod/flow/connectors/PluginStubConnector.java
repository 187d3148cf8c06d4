package work.lcod.flow.connectors;

import java.util.LinkedHashMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import work.lcod.flow.runtime.FlowValue;
import work.lcod.flow.runtime.ServiceConnector;
import work.lcod.flow.runtime.ServiceRequest;
import work.lcod.flow.runtime.ServiceResponse;

/**
 * Stands in for plugin services, which have no loader yet. Answers like the plugin mock.
 */
public final class PluginStubConnector implements ServiceConnector {
    @Override
    public CompletionStage<ServiceResponse> call(ServiceRequest request) {
        var fields = new LinkedHashMap<String, FlowValue>();
        fields.put("status", FlowValue.text("ok"));
        fields.put("data", FlowValue.text("mock plugin response for: " + request.verb() + " " + request.description()));
        return CompletableFuture.completedFuture(ServiceResponse.of(FlowValue.record(fields)));
    }
}
