package io.amprelay.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.amprelay.agent.AgentRecord;
import io.amprelay.config.AmpRelayConfig;
import io.amprelay.federation.FederationRequest;
import io.amprelay.federation.HttpFederationTransport;
import io.amprelay.model.AmpError;
import io.amprelay.model.ErrorKind;
import io.amprelay.model.RouteOutcome;
import io.amprelay.peers.PeerExchangeRequest;
import io.amprelay.peers.PeerExchangeResponse;
import io.amprelay.peers.PeerRegistrationRequest;
import io.amprelay.peers.PeerRegistrationResponse;
import io.amprelay.routing.RouteRequest;
import io.amprelay.runtime.AmpRuntime;
import io.amprelay.storage.RelayQueueStore;
import io.amprelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

public final class AmpHttpServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(AmpHttpServer.class);

    private final HttpServer server;
    private final ExecutorService executor;

    private AmpHttpServer(HttpServer server, ExecutorService executor) {
        this.server = server;
        this.executor = executor;
    }

    public int port() {
        return server.getAddress().getPort();
    }

    /**
     * Stops accepting requests, gives in-flight exchanges up to
     * {@code delaySeconds} to finish, then stops the handler threads.
     */
    public void stop(int delaySeconds) {
        server.stop(delaySeconds);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(Math.max(1, delaySeconds), TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    @Override
    public void close() {
        stop(0);
    }

    @FunctionalInterface
    interface Handler {
        void handle(HttpExchange exchange) throws IOException;
    }

    public static AmpHttpServer start(AmpRuntime runtime, int port) throws IOException {
        HttpServer server = HttpServer.create(new InetSocketAddress(port), 0);
        server.createContext("/health", guarded(exchange -> {
            if (!allowMethods(exchange, "GET")) return;
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", "healthy");
            body.put("host_id", runtime.settings().hostId());
            body.put("provider", runtime.settings().provider());
            body.put("version", runtime.settings().version());
            writeJson(exchange, body, 200);
        }));
        server.createContext("/route", guarded(exchange -> {
            if (!allowMethods(exchange, "POST")) return;
            Optional<AgentRecord> sender = authenticate(exchange, runtime);
            if (sender.isEmpty()) return;
            Optional<RouteRequest> request = readBody(exchange, RouteRequest.class);
            if (request.isEmpty()) return;
            writeOutcome(exchange, runtime.route(sender.get(), request.get()));
        }));
        server.createContext("/federation/deliver", guarded(exchange -> {
            if (!allowMethods(exchange, "POST")) return;
            String provider = exchange.getRequestHeaders().getFirst(HttpFederationTransport.PROVIDER_HEADER);
            Optional<RouteOutcome> refused = runtime.federationAdmit(provider);
            if (refused.isPresent()) {
                writeOutcome(exchange, refused.get());
                return;
            }
            Optional<FederationRequest> request = readBody(exchange, FederationRequest.class);
            if (request.isEmpty()) return;
            writeOutcome(exchange, runtime.federationAccept(provider, request.get()));
        }));
        server.createContext("/messages/pending", guarded(exchange -> {
            if (!"/messages/pending".equals(exchange.getRequestURI().getPath())) {
                writeError(exchange, AmpError.of(ErrorKind.NOT_FOUND, "Not found"));
                return;
            }
            if (!allowMethods(exchange, "GET", "DELETE")) return;
            Optional<AgentRecord> agent = authenticate(exchange, runtime);
            if (agent.isEmpty()) return;
            Map<String, String> q = parseQuery(exchange.getRequestURI());
            if ("GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                int limit = parseLimit(q.get("limit"));
                RelayQueueStore.PendingMessages pending = runtime.pending(agent.get(), limit);
                writeJson(exchange, pending, 200);
                return;
            }
            String id = q.get("id");
            if (id == null || id.isBlank()) {
                writeError(exchange, AmpError.field(ErrorKind.MISSING_FIELD, "id", "Message id is required"));
                return;
            }
            if (!runtime.acknowledge(agent.get(), id.trim())) {
                writeError(exchange, AmpError.of(ErrorKind.NOT_FOUND, "Message not found"));
                return;
            }
            writeJson(exchange, Map.of("acknowledged", true), 200);
        }));
        server.createContext("/messages/pending/ack", guarded(exchange -> {
            if (!allowMethods(exchange, "POST")) return;
            Optional<AgentRecord> agent = authenticate(exchange, runtime);
            if (agent.isEmpty()) return;
            Optional<JsonNode> body = readBody(exchange, JsonNode.class);
            if (body.isEmpty()) return;
            JsonNode ids = body.get().path("ids");
            if (!ids.isArray() || ids.isEmpty() || ids.size() > AmpRelayConfig.MAX_ACK_BATCH) {
                writeError(exchange, AmpError.of(ErrorKind.INVALID_REQUEST,
                        "ids must be an array of 1 to " + AmpRelayConfig.MAX_ACK_BATCH + " message ids"));
                return;
            }
            List<String> messageIds = new ArrayList<>();
            for (JsonNode id : ids) {
                if (!id.isTextual() || id.asText().isBlank()) {
                    writeError(exchange, AmpError.of(ErrorKind.INVALID_REQUEST, "ids must contain non-empty strings"));
                    return;
                }
                messageIds.add(id.asText().trim());
            }
            writeJson(exchange, Map.of("acknowledged", runtime.acknowledgeBatch(agent.get(), messageIds)), 200);
        }));
        server.createContext("/hosts/register-peer", guarded(exchange -> {
            if (!allowMethods(exchange, "POST")) return;
            Optional<PeerRegistrationRequest> request = readBody(exchange, PeerRegistrationRequest.class);
            if (request.isEmpty()) return;
            PeerRegistrationResponse response = runtime.registerPeer(request.get());
            writeJson(exchange, response, response.success() ? 200 : 400);
        }));
        server.createContext("/hosts/exchange-peers", guarded(exchange -> {
            if (!allowMethods(exchange, "POST")) return;
            Optional<PeerExchangeRequest> request = readBody(exchange, PeerExchangeRequest.class);
            if (request.isEmpty()) return;
            PeerExchangeResponse response = runtime.exchangePeers(request.get());
            writeJson(exchange, response, response.success() ? 200 : 400);
        }));
        server.createContext("/hosts/identity", guarded(exchange -> {
            if (!allowMethods(exchange, "GET")) return;
            writeJson(exchange, Map.of("host", runtime.identity(
                    exchange.getRequestHeaders().getFirst("X-Forwarded-Host"),
                    exchange.getRequestHeaders().getFirst("X-Forwarded-Proto"))), 200);
        }));
        ExecutorService executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);
        server.start();
        LOG.info("AMP relay listening on port {}", server.getAddress().getPort());
        return new AmpHttpServer(server, executor);
    }

    private static com.sun.net.httpserver.HttpHandler guarded(Handler handler) {
        return exchange -> {
            try {
                handler.handle(exchange);
            } catch (RuntimeException e) {
                LOG.error("Request {} {} failed", exchange.getRequestMethod(), exchange.getRequestURI().getPath(), e);
                writeError(exchange, AmpError.of(ErrorKind.INTERNAL_ERROR, "Internal server error"));
            } finally {
                exchange.close();
            }
        };
    }

    private static Optional<AgentRecord> authenticate(HttpExchange exchange, AmpRuntime runtime) throws IOException {
        Optional<AgentRecord> agent = runtime.authenticate(exchange.getRequestHeaders().getFirst("Authorization"));
        if (agent.isEmpty()) {
            writeError(exchange, AmpError.of(ErrorKind.UNAUTHORIZED, "Invalid or missing API key"));
        }
        return agent;
    }

    /**
     * Parses the request body. On failure the error response has already been
     * written and the result is empty.
     */
    private static <T> Optional<T> readBody(HttpExchange exchange, Class<T> type) throws IOException {
        String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8).trim();
        if (body.isEmpty()) {
            writeError(exchange, AmpError.of(ErrorKind.INVALID_REQUEST, "Request body is required"));
            return Optional.empty();
        }
        try {
            T value = Jsons.compact().readValue(body, type);
            if (value == null) {
                writeError(exchange, AmpError.of(ErrorKind.INVALID_REQUEST, "Request body is required"));
                return Optional.empty();
            }
            return Optional.of(value);
        } catch (JsonMappingException e) {
            String field = e.getPath().stream()
                    .map(JsonMappingException.Reference::getFieldName)
                    .filter(name -> name != null)
                    .collect(Collectors.joining("."));
            if (field.isEmpty()) {
                writeError(exchange, AmpError.of(ErrorKind.INVALID_REQUEST, "Malformed request body"));
            } else {
                writeError(exchange, AmpError.field(ErrorKind.INVALID_FIELD, field, "Invalid value for " + field));
            }
            return Optional.empty();
        } catch (JsonProcessingException e) {
            writeError(exchange, AmpError.of(ErrorKind.INVALID_REQUEST, "Malformed JSON body"));
            return Optional.empty();
        }
    }

    private static void writeOutcome(HttpExchange exchange, RouteOutcome outcome) throws IOException {
        if (!outcome.isRejected()) {
            writeJson(exchange, outcome, 200);
            return;
        }
        if (outcome.retryAfterSeconds() != null) {
            exchange.getResponseHeaders().set("Retry-After", String.valueOf(outcome.retryAfterSeconds()));
        }
        writeError(exchange, outcome.error());
    }

    private static void writeError(HttpExchange exchange, AmpError error) throws IOException {
        writeJson(exchange, error, error.httpStatus());
    }

    private static void writeJson(HttpExchange exchange, Object body, int status) throws IOException {
        byte[] bytes = Jsons.toJson(body).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private static boolean allowMethods(HttpExchange exchange, String... methods) throws IOException {
        String method = exchange.getRequestMethod();
        for (String allowed : methods) {
            if (allowed.equalsIgnoreCase(method)) {
                return true;
            }
        }
        exchange.getResponseHeaders().set("Allow", String.join(",", methods));
        writeJson(exchange, Map.of("error", "method_not_allowed", "method", String.valueOf(method)), 405);
        return false;
    }

    static int parseLimit(String raw) {
        if (raw == null || raw.isBlank()) {
            return AmpRelayConfig.DEFAULT_PENDING_LIMIT;
        }
        try {
            return RelayQueueStore.clampLimit(Integer.parseInt(raw.trim()));
        } catch (NumberFormatException e) {
            return AmpRelayConfig.DEFAULT_PENDING_LIMIT;
        }
    }

    private static Map<String, String> parseQuery(URI uri) {
        Map<String, String> out = new LinkedHashMap<>();
        String raw = uri.getRawQuery();
        if (raw == null || raw.isBlank()) {
            return out;
        }
        for (String pair : raw.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int idx = pair.indexOf('=');
            String key = idx >= 0 ? pair.substring(0, idx) : pair;
            String value = idx >= 0 ? pair.substring(idx + 1) : "";
            out.put(URLDecoder.decode(key, StandardCharsets.UTF_8), URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return out;
    }
}
