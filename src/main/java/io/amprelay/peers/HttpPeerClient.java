package io.amprelay.peers;

import io.amprelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

public final class HttpPeerClient implements PeerClient {
    private static final Logger LOG = LoggerFactory.getLogger(HttpPeerClient.class);

    private final Duration requestTimeout;
    private final Duration probeTimeout;
    private final HttpClient client;

    public HttpPeerClient(Duration requestTimeout, Duration probeTimeout) {
        this.requestTimeout = requestTimeout;
        this.probeTimeout = probeTimeout;
        this.client = HttpClient.newBuilder()
                .connectTimeout(requestTimeout)
                .build();
    }

    @Override
    public PeerRegistrationResponse register(String peerUrl, PeerRegistrationRequest request) throws IOException, InterruptedException {
        HttpResponse<String> response = post(peerUrl + "/hosts/register-peer", Jsons.toCompactJson(request));
        if (response.statusCode() >= 500) {
            throw new IOException("HTTP " + response.statusCode() + " from " + peerUrl);
        }
        return Jsons.fromJson(response.body(), PeerRegistrationResponse.class);
    }

    @Override
    public PeerExchangeResponse exchange(String peerUrl, PeerExchangeRequest request) throws IOException, InterruptedException {
        HttpResponse<String> response = post(peerUrl + "/hosts/exchange-peers", Jsons.toCompactJson(request));
        if (response.statusCode() >= 500) {
            throw new IOException("HTTP " + response.statusCode() + " from " + peerUrl);
        }
        return Jsons.fromJson(response.body(), PeerExchangeResponse.class);
    }

    @Override
    public boolean probe(String peerUrl) {
        try {
            HttpRequest request = HttpRequest.newBuilder(URI.create(peerUrl + "/health"))
                    .timeout(probeTimeout)
                    .GET()
                    .build();
            HttpResponse<Void> response = client.send(request, HttpResponse.BodyHandlers.discarding());
            return response.statusCode() >= 200 && response.statusCode() < 300;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (IOException | IllegalArgumentException e) {
            LOG.debug("Probe of {} failed: {}", peerUrl, e.getMessage());
            return false;
        }
    }

    private HttpResponse<String> post(String url, String body) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(URI.create(url))
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    }
}
