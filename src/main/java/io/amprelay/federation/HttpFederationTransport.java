package io.amprelay.federation;

import com.fasterxml.jackson.databind.JsonNode;
import io.amprelay.util.Jsons;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

public final class HttpFederationTransport implements FederationTransport {
    public static final String PROVIDER_HEADER = "X-AMP-Provider";

    private final URI deliverUri;
    private final String ownProvider;
    private final Duration timeout;
    private final HttpClient client;

    public HttpFederationTransport(String baseUrl, String ownProvider, Duration timeout) {
        this.deliverUri = URI.create(baseUrl + "/federation/deliver");
        this.ownProvider = ownProvider;
        this.timeout = timeout;
        this.client = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }

    @Override
    public FederationReceipt send(FederationRequest request) throws IOException, InterruptedException {
        HttpRequest httpRequest = HttpRequest.newBuilder(deliverUri)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header(PROVIDER_HEADER, ownProvider)
                .POST(HttpRequest.BodyPublishers.ofString(Jsons.toCompactJson(request), StandardCharsets.UTF_8))
                .build();
        HttpResponse<String> response = client.send(httpRequest, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        JsonNode body = response.body() == null || response.body().isBlank()
                ? Jsons.mapper().createObjectNode()
                : Jsons.mapper().readTree(response.body());
        return new FederationReceipt(
                response.statusCode(),
                textOrNull(body, "id"),
                textOrNull(body, "status"),
                textOrNull(body, "method"),
                textOrNull(body, "delivered_at"),
                textOrNull(body, "error"),
                textOrNull(body, "message")
        );
    }

    public URI deliverUri() {
        return deliverUri;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isMissingNode() || value.isNull() ? null : value.asText();
    }
}
