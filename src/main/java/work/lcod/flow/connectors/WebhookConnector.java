package work.lcod.flow.connectors;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import work.lcod.flow.runtime.FlowValue;
import work.lcod.flow.runtime.ServiceConnector;
import work.lcod.flow.runtime.ServiceRequest;
import work.lcod.flow.runtime.ServiceResponse;

/**
 * Posts the call as JSON to a fixed URL and answers {@code {status: "ok"}}.
 */
public final class WebhookConnector implements ServiceConnector {
    private final String url;
    private final HttpClient client;
    private final Duration timeout;

    public WebhookConnector(String url) {
        this(url, HttpApiConnector.SHARED_CLIENT, HttpApiConnector.DEFAULT_TIMEOUT);
    }

    public WebhookConnector(String url, HttpClient client, Duration timeout) {
        this.url = url;
        this.client = client;
        this.timeout = timeout;
    }

    @Override
    public CompletionStage<ServiceResponse> call(ServiceRequest request) {
        var builder = HttpRequest.newBuilder(URI.create(url))
            .POST(HttpRequest.BodyPublishers.ofString(JsonBodies.requestBody(request)))
            .header("Content-Type", "application/json")
            .timeout(timeout);
        request.headers().forEach(builder::setHeader);
        return client.sendAsync(builder.build(), HttpResponse.BodyHandlers.ofString())
            .thenApply(response -> {
                int status = response.statusCode();
                if (status < 200 || status >= 300) {
                    String body = response.body() == null ? "" : response.body();
                    throw new ConnectorException("Webhook returned error " + status + ": "
                        + (body.isEmpty() ? "HTTP " + status : body));
                }
                return new ServiceResponse(FlowValue.record(Map.of("status", FlowValue.text("ok"))),
                    Optional.of(status), Optional.empty());
            })
            .exceptionally(error -> {
                Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
                if (cause instanceof ConnectorException connectorException) {
                    throw connectorException;
                }
                if (cause instanceof HttpTimeoutException) {
                    throw new ConnectorException("Webhook at " + url + " timed out after " + timeout.toSeconds() + " seconds", cause);
                }
                throw new ConnectorException("Webhook at " + url + " failed: " + cause.getMessage(), cause);
            });
    }
}
