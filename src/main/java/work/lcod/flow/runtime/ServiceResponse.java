package work.lcod.flow.runtime;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Value returned by a connector, plus the HTTP status and headers when the transport has them.
 */
public record ServiceResponse(FlowValue value, Optional<Integer> status, Optional<Map<String, String>> headers) {
    public ServiceResponse {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(status, "status");
        headers = headers.map(Map::copyOf);
    }

    public static ServiceResponse of(FlowValue value) {
        return new ServiceResponse(value, Optional.empty(), Optional.empty());
    }
}
