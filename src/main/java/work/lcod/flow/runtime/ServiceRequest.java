package work.lcod.flow.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public record ServiceRequest(
    String verb,
    String description,
    Map<String, FlowValue> parameters,
    Optional<String> path,
    Map<String, String> headers
) {
    public ServiceRequest {
        Objects.requireNonNull(verb, "verb");
        Objects.requireNonNull(description, "description");
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        Objects.requireNonNull(path, "path");
        headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }
}
