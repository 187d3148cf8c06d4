package work.lcod.flow.connectors;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.flow.runtime.FlowValue;
import work.lcod.flow.runtime.FlowValues;
import work.lcod.flow.runtime.ServiceConnector;
import work.lcod.flow.runtime.ServiceRequest;
import work.lcod.flow.runtime.ServiceResponse;

/**
 * Calls a REST API. The HTTP method is inferred from the verb; GET and DELETE send parameters as
 * query string, other methods as a JSON body. Non-2xx answers fail the call.
 */
public final class HttpApiConnector implements ServiceConnector {
    private static final Logger log = LoggerFactory.getLogger(HttpApiConnector.class);
    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    static final HttpClient SHARED_CLIENT = HttpClient.newBuilder()
        .followRedirects(HttpClient.Redirect.NORMAL)
        .connectTimeout(DEFAULT_TIMEOUT)
        .build();

    private final String baseUrl;
    private final HttpClient client;
    private final Duration timeout;

    public HttpApiConnector(String baseUrl) {
        this(baseUrl, SHARED_CLIENT, DEFAULT_TIMEOUT);
    }

    public HttpApiConnector(String baseUrl, HttpClient client, Duration timeout) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.client = client;
        this.timeout = timeout;
    }

    public String baseUrl() {
        return baseUrl;
    }

    @Override
    public CompletionStage<ServiceResponse> call(ServiceRequest request) {
        String method = HttpMethods.infer(request.verb());
        String url = baseUrl + request.path().map(path -> path.startsWith("/") ? path : "/" + path).orElse("");

        HttpRequest.Builder builder;
        if (HttpMethods.usesQueryString(method)) {
            url += queryString(url, request.parameters());
            builder = HttpRequest.newBuilder(URI.create(url)).method(method, HttpRequest.BodyPublishers.noBody());
        } else {
            builder = HttpRequest.newBuilder(URI.create(url))
                .method(method, HttpRequest.BodyPublishers.ofString(JsonBodies.requestBody(request)))
                .header("Content-Type", "application/json");
        }
        builder.header("Accept", "application/json").timeout(timeout);
        request.headers().forEach(builder::setHeader);

        log.debug("{} {}", method, url);
        return client.sendAsync(builder.build(), HttpResponse.BodyHandlers.ofString())
            .thenApply(this::toServiceResponse)
            .exceptionally(this::translateFailure);
    }

    private ServiceResponse toServiceResponse(HttpResponse<String> response) {
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            String body = response.body() == null ? "" : response.body();
            throw new ConnectorException("Service returned error " + status + ": " + (body.isEmpty() ? "HTTP " + status : body));
        }
        Map<String, String> headers = new LinkedHashMap<>();
        response.headers().map().forEach((name, values) -> headers.put(name, String.join(", ", values)));
        String contentType = response.headers().firstValue("content-type").orElse("");
        FlowValue value = contentType.contains("application/json")
            ? JsonBodies.parse(response.body())
            : FlowValue.text(response.body());
        return new ServiceResponse(value, Optional.of(status), Optional.of(headers));
    }

    private ServiceResponse translateFailure(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof ConnectorException connectorException) {
            throw connectorException;
        }
        if (cause instanceof HttpTimeoutException) {
            throw new ConnectorException("Request to " + baseUrl + " timed out after " + timeout.toSeconds() + " seconds", cause);
        }
        throw new ConnectorException("Request to " + baseUrl + " failed: " + cause.getMessage(), cause);
    }

    static String queryString(String url, Map<String, FlowValue> parameters) {
        if (parameters.isEmpty()) {
            return "";
        }
        List<String> parts = new ArrayList<>();
        parameters.forEach((name, value) -> parts.add(encode(name) + "=" + encode(FlowValues.display(value))));
        return (url.contains("?") ? "&" : "?") + String.join("&", parts);
    }

    private static String encode(String text) {
        return URLEncoder.encode(text, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
