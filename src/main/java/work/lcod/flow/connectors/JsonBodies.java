package work.lcod.flow.connectors;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;
import work.lcod.flow.runtime.FlowValue;
import work.lcod.flow.runtime.FlowValues;
import work.lcod.flow.runtime.ServiceRequest;

final class JsonBodies {
    private static final ObjectMapper JSON = new ObjectMapper();

    private JsonBodies() {}

    /** {@code {verb, description, ...parameters}} */
    static String requestBody(ServiceRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("verb", request.verb());
        body.put("description", request.description());
        for (Map.Entry<String, FlowValue> parameter : request.parameters().entrySet()) {
            body.put(parameter.getKey(), FlowValues.toJava(parameter.getValue()));
        }
        try {
            return JSON.writeValueAsString(body);
        } catch (JsonProcessingException ex) {
            throw new ConnectorException("Unable to serialize request body: " + ex.getOriginalMessage(), ex);
        }
    }

    static FlowValue parse(String body) {
        try {
            return FlowValues.fromJava(JSON.readValue(body, Object.class));
        } catch (JsonProcessingException ex) {
            throw new ConnectorException("The service answered with invalid JSON: " + ex.getOriginalMessage(), ex);
        }
    }
}
