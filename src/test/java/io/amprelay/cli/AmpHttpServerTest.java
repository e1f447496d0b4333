package io.amprelay.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.amprelay.TestSupport;
import io.amprelay.config.AmpRelayConfig;
import io.amprelay.runtime.AmpRuntime;
import io.amprelay.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

final class AmpHttpServerTest {
    private static final String SETTINGS = """
            {
              "hostId": "host-a",
              "hostName": "Host A",
              "hostUrl": "http://10.30.0.1:23000",
              "provider": "aimaestro.local",
              "organization": "acme"
            }
            """;

    private final HttpClient http = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();

    @Test
    void routeQueueAndAcknowledgeOverHttp() throws Exception {
        Path root = Files.createTempDirectory("amprelay-test-http-route-");
        AmpHttpServer server = null;
        try {
            TestSupport.writeSettings(root, SETTINGS);
            try (AmpRuntime runtime = new AmpRuntime(AmpRelayConfig.fromRoot(root.toString()))) {
                runtime.init();
                String aliceKey = runtime.registerAgent("alice", null, null, true).apiKey();
                String bobKey = runtime.registerAgent("bob", null, null, false).apiKey();
                server = AmpHttpServer.start(runtime, 0);
                String base = "http://127.0.0.1:" + server.port();

                HttpResponse<String> health = send(HttpRequest.newBuilder(URI.create(base + "/health")).GET(), null);
                Assertions.assertEquals(200, health.statusCode());
                Assertions.assertEquals("host-a", json(health).path("host_id").asText());

                String routeBody = """
                        {"to":"bob@acme.aimaestro.local","subject":"hi","priority":"high",
                         "payload":{"type":"request","message":"are you there?"}}
                        """;
                HttpResponse<String> anonymous = send(post(base + "/route", routeBody), null);
                Assertions.assertEquals(401, anonymous.statusCode());
                Assertions.assertEquals("unauthorized", json(anonymous).path("error").asText());

                HttpResponse<String> routed = send(post(base + "/route", routeBody), aliceKey);
                Assertions.assertEquals(200, routed.statusCode(), routed.body());
                JsonNode outcome = json(routed);
                Assertions.assertEquals("queued", outcome.path("status").asText());
                Assertions.assertEquals("relay", outcome.path("method").asText());
                String messageId = outcome.path("id").asText();

                HttpResponse<String> pending = send(HttpRequest.newBuilder(URI.create(base + "/messages/pending?limit=5")).GET(), bobKey);
                Assertions.assertEquals(200, pending.statusCode());
                JsonNode page = json(pending);
                Assertions.assertEquals(1, page.path("count").asInt());
                Assertions.assertEquals(messageId, page.path("messages").get(0).path("envelope").path("id").asText());
                Assertions.assertEquals("high", page.path("messages").get(0).path("envelope").path("priority").asText());

                HttpResponse<String> ack = send(HttpRequest.newBuilder(
                        URI.create(base + "/messages/pending?id=" + messageId)).DELETE(), bobKey);
                Assertions.assertEquals(200, ack.statusCode());
                Assertions.assertTrue(json(ack).path("acknowledged").asBoolean());

                HttpResponse<String> again = send(HttpRequest.newBuilder(
                        URI.create(base + "/messages/pending?id=" + messageId)).DELETE(), bobKey);
                Assertions.assertEquals(404, again.statusCode());
                Assertions.assertEquals("not_found", json(again).path("error").asText());

                HttpResponse<String> missingId = send(HttpRequest.newBuilder(URI.create(base + "/messages/pending")).DELETE(), bobKey);
                Assertions.assertEquals(400, missingId.statusCode());
                Assertions.assertEquals("id", json(missingId).path("field").asText());
            }
        } finally {
            if (server != null) {
                server.stop(0);
            }
            TestSupport.deleteRecursively(root);
        }
    }

    @Test
    void requestErrorsUseTheErrorShape() throws Exception {
        Path root = Files.createTempDirectory("amprelay-test-http-errors-");
        AmpHttpServer server = null;
        try {
            TestSupport.writeSettings(root, SETTINGS);
            try (AmpRuntime runtime = new AmpRuntime(AmpRelayConfig.fromRoot(root.toString()))) {
                runtime.init();
                String bobKey = runtime.registerAgent("bob", null, null, false).apiKey();
                server = AmpHttpServer.start(runtime, 0);
                String base = "http://127.0.0.1:" + server.port();

                HttpResponse<String> emptyBatch = send(post(base + "/messages/pending/ack", "{\"ids\":[]}"), bobKey);
                Assertions.assertEquals(400, emptyBatch.statusCode());
                Assertions.assertEquals("invalid_request", json(emptyBatch).path("error").asText());

                HttpResponse<String> batch = send(post(base + "/messages/pending/ack", "{\"ids\":[\"msg_1_x\"]}"), bobKey);
                Assertions.assertEquals(200, batch.statusCode());
                Assertions.assertEquals(0, json(batch).path("acknowledged").asInt());

                HttpResponse<String> noHeader = send(post(base + "/federation/deliver", "{}"), null);
                Assertions.assertEquals(400, noHeader.statusCode());
                Assertions.assertEquals("missing_header", json(noHeader).path("error").asText());

                HttpResponse<String> malformed = send(post(base + "/route", "{not json"), bobKey);
                Assertions.assertEquals(400, malformed.statusCode());
                Assertions.assertEquals("invalid_request", json(malformed).path("error").asText());

                HttpResponse<String> wrongMethod = send(HttpRequest.newBuilder(URI.create(base + "/route")).GET(), bobKey);
                Assertions.assertEquals(405, wrongMethod.statusCode());
                Assertions.assertEquals("POST", wrongMethod.headers().firstValue("Allow").orElse(""));

                HttpResponse<String> unknown = send(HttpRequest.newBuilder(URI.create(base + "/messages/pending/other")).GET(), bobKey);
                Assertions.assertEquals(404, unknown.statusCode());
            }
        } finally {
            if (server != null) {
                server.stop(0);
            }
            TestSupport.deleteRecursively(root);
        }
    }

    @Test
    void hostEndpointsRegisterPeersAndDescribeThisHost() throws Exception {
        Path root = Files.createTempDirectory("amprelay-test-http-hosts-");
        AmpHttpServer server = null;
        try {
            TestSupport.writeSettings(root, SETTINGS);
            try (AmpRuntime runtime = new AmpRuntime(AmpRelayConfig.fromRoot(root.toString()))) {
                runtime.init();
                server = AmpHttpServer.start(runtime, 0);
                String base = "http://127.0.0.1:" + server.port();

                HttpResponse<String> identity = send(HttpRequest.newBuilder(URI.create(base + "/hosts/identity"))
                        .header("X-Forwarded-Host", "relay.example.com")
                        .header("X-Forwarded-Proto", "https")
                        .GET(), null);
                Assertions.assertEquals(200, identity.statusCode());
                JsonNode host = json(identity).path("host");
                Assertions.assertEquals("host-a", host.path("id").asText());
                Assertions.assertEquals("https://relay.example.com", host.path("url").asText());
                Assertions.assertTrue(host.path("isSelf").asBoolean());

                String registration = """
                        {"host":{"id":"host-b","name":"Host B","url":"http://10.30.0.2:23000"},
                         "source":{"initiator":"host-b","timestamp":"2026-10-17T00:00:00Z"}}
                        """;
                HttpResponse<String> registered = send(post(base + "/hosts/register-peer", registration), null);
                Assertions.assertEquals(200, registered.statusCode(), registered.body());
                Assertions.assertTrue(json(registered).path("registered").asBoolean());

                String tooDeep = """
                        {"host":{"id":"host-c","name":"Host C","url":"http://10.30.0.3:23000"},
                         "source":{"initiator":"host-b","propagationId":"prop_x","propagationDepth":4}}
                        """;
                HttpResponse<String> rejected = send(post(base + "/hosts/register-peer", tooDeep), null);
                Assertions.assertEquals(400, rejected.statusCode());
                Assertions.assertFalse(json(rejected).path("success").asBoolean());
                Assertions.assertEquals(1, runtime.listPeers().size());
            }
        } finally {
            if (server != null) {
                server.stop(0);
            }
            TestSupport.deleteRecursively(root);
        }
    }

    @Test
    void malformedFederationBodiesCountAgainstProviderLimit() throws Exception {
        Path root = Files.createTempDirectory("amprelay-test-http-fed-limit-");
        AmpHttpServer server = null;
        try {
            TestSupport.writeSettings(root, """
                    {
                      "hostId": "host-a",
                      "hostUrl": "http://10.30.0.1:23000",
                      "provider": "aimaestro.local",
                      "organization": "acme",
                      "rateLimitPerWindow": 3
                    }
                    """);
            try (AmpRuntime runtime = new AmpRuntime(AmpRelayConfig.fromRoot(root.toString()))) {
                runtime.init();
                server = AmpHttpServer.start(runtime, 0);
                String base = "http://127.0.0.1:" + server.port();

                for (String body : new String[]{"{", "{\"envelope\":{\"priority\":\"whenever\"}}", " "}) {
                    HttpResponse<String> rejected = send(post(base + "/federation/deliver", body)
                            .header("X-AMP-Provider", "flood.example"), null);
                    Assertions.assertEquals(400, rejected.statusCode(), rejected.body());
                }
                HttpResponse<String> limited = send(post(base + "/federation/deliver", "{")
                        .header("X-AMP-Provider", "flood.example"), null);
                Assertions.assertEquals(429, limited.statusCode());
                Assertions.assertEquals("rate_limited", json(limited).path("error").asText());
                Assertions.assertTrue(limited.headers().firstValue("Retry-After").isPresent());

                HttpResponse<String> otherProvider = send(post(base + "/federation/deliver", "{")
                        .header("X-AMP-Provider", "calm.example"), null);
                Assertions.assertEquals(400, otherProvider.statusCode());
            }
        } finally {
            if (server != null) {
                server.stop(0);
            }
            TestSupport.deleteRecursively(root);
        }
    }

    @Test
    void stoppingTheServerReleasesItsPort() throws Exception {
        Path root = Files.createTempDirectory("amprelay-test-http-stop-");
        try {
            TestSupport.writeSettings(root, SETTINGS);
            try (AmpRuntime runtime = new AmpRuntime(AmpRelayConfig.fromRoot(root.toString()))) {
                runtime.init();
                String base;
                try (AmpHttpServer server = AmpHttpServer.start(runtime, 0)) {
                    base = "http://127.0.0.1:" + server.port();
                    Assertions.assertEquals(200, send(HttpRequest.newBuilder(URI.create(base + "/health")).GET(), null).statusCode());
                }
                HttpClient fresh = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(2)).build();
                HttpRequest health = HttpRequest.newBuilder(URI.create(base + "/health")).timeout(Duration.ofSeconds(5)).GET().build();
                Assertions.assertThrows(IOException.class, () -> fresh.send(health, HttpResponse.BodyHandlers.ofString()));
            }
        } finally {
            TestSupport.deleteRecursively(root);
        }
    }

    @Test
    void limitIsClampedAndDefaulted() {
        Assertions.assertEquals(10, AmpHttpServer.parseLimit(null));
        Assertions.assertEquals(10, AmpHttpServer.parseLimit("abc"));
        Assertions.assertEquals(100, AmpHttpServer.parseLimit("500"));
        Assertions.assertEquals(3, AmpHttpServer.parseLimit("3"));
    }

    private HttpResponse<String> send(HttpRequest.Builder builder, String apiKey) throws Exception {
        if (apiKey != null) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        return http.send(builder.timeout(Duration.ofSeconds(10)).build(), HttpResponse.BodyHandlers.ofString());
    }

    private static HttpRequest.Builder post(String url, String body) {
        return HttpRequest.newBuilder(URI.create(url))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body));
    }

    private static JsonNode json(HttpResponse<String> response) throws Exception {
        return Jsons.compact().readTree(response.body());
    }
}
