package io.amprelay.peers;

import io.amprelay.TestSupport;
import io.amprelay.config.AmpRelayConfig;
import io.amprelay.model.PeerHost;
import io.amprelay.runtime.AmpRuntime;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;

final class PeerDirectoryTest {
    static final String SETTINGS = """
            {
              "hostId": "host-a",
              "hostName": "Host A",
              "hostUrl": "http://10.0.0.1:23000",
              "hostAliases": ["alpha", "10.0.0.1"],
              "provider": "aimaestro.local",
              "organization": "acme"
            }
            """;

    @Test
    void newPeerIsStoredAndGetsPrunedHostList() throws Exception {
        Path root = Files.createTempDirectory("amprelay-test-peers-register-");
        try {
            TestSupport.writeSettings(root, SETTINGS);
            try (AmpRuntime runtime = runtime(root, new RecordingPeerClient())) {
                PeerRegistrationResponse first = runtime.registerPeer(registration(host("host-b", "http://10.0.0.2:23000"), null));
                Assertions.assertTrue(first.success());
                Assertions.assertTrue(first.registered());
                Assertions.assertFalse(first.alreadyKnown());
                Assertions.assertEquals("host-a", first.host().id());
                Assertions.assertTrue(first.knownHosts().isEmpty());

                PeerRegistrationResponse second = runtime.registerPeer(registration(host("host-c", "http://10.0.0.3:23000"), null));
                Assertions.assertTrue(second.registered());
                Assertions.assertEquals(List.of("host-b"), second.knownHosts().stream().map(PeerHost::id).toList());

                PeerHost stored = runtime.listPeers().get(0);
                Assertions.assertEquals("host-b", stored.id());
                Assertions.assertEquals(Boolean.TRUE, stored.enabled());
                Assertions.assertEquals("peer-registration", stored.syncSource());
                Assertions.assertNotNull(stored.syncedAt());
            }
        } finally {
            TestSupport.deleteRecursively(root);
        }
    }

    @Test
    void duplicatesByIdUrlOrAliasAreAlreadyKnown() throws Exception {
        Path root = Files.createTempDirectory("amprelay-test-peers-dup-");
        try {
            TestSupport.writeSettings(root, SETTINGS);
            try (AmpRuntime runtime = runtime(root, new RecordingPeerClient())) {
                PeerHost b = new PeerHost("host-b", "Host B", "http://10.0.0.2:23000", List.of("bravo"),
                        null, null, null, null, null, null, null);
                runtime.registerPeer(registration(b, null));
                runtime.registerPeer(registration(host("host-c", "http://10.0.0.3:23000"), null));

                PeerRegistrationResponse sameId = runtime.registerPeer(registration(host("host-b", "http://10.9.9.9:1"), null));
                Assertions.assertTrue(sameId.success());
                Assertions.assertTrue(sameId.alreadyKnown());
                Assertions.assertFalse(sameId.registered());
                Assertions.assertEquals(List.of("host-c"), sameId.knownHosts().stream().map(PeerHost::id).toList());

                PeerRegistrationResponse sameUrl = runtime.registerPeer(registration(host("host-b2", "http://10.0.0.2:23000/"), null));
                Assertions.assertTrue(sameUrl.alreadyKnown());

                PeerHost aliasClash = new PeerHost("renamed", "Renamed", "http://10.7.7.7:23000", List.of("BRAVO"),
                        null, null, null, null, null, null, null);
                Assertions.assertTrue(runtime.registerPeer(registration(aliasClash, null)).alreadyKnown());
                Assertions.assertEquals(2, runtime.listPeers().size());
            }
        } finally {
            TestSupport.deleteRecursively(root);
        }
    }

    @Test
    void propagationIsBoundedByDepthAndDeduplicatedById() throws Exception {
        Path root = Files.createTempDirectory("amprelay-test-peers-propagation-");
        try {
            TestSupport.writeSettings(root, SETTINGS);
            try (AmpRuntime runtime = runtime(root, new RecordingPeerClient())) {
                runtime.registerPeer(registration(host("host-b", "http://10.0.0.2:23000"), null));

                PeerRegistrationResponse tooDeep = runtime.registerPeer(registration(
                        host("host-x", "http://10.0.0.9:23000"),
                        new RegistrationSource("host-b", "2026-10-17T00:00:00Z", "prop_deep", 4)));
                Assertions.assertFalse(tooDeep.success());
                Assertions.assertTrue(tooDeep.knownHosts().isEmpty());
                Assertions.assertTrue(tooDeep.error().contains("depth"));

                RegistrationSource atLimit = new RegistrationSource("host-b", "2026-10-17T00:00:00Z", "prop_1", 3);
                PeerRegistrationResponse accepted = runtime.registerPeer(registration(host("host-d", "http://10.0.0.4:23000"), atLimit));
                Assertions.assertTrue(accepted.registered());
                Assertions.assertEquals("host-b", runtime.listPeers().get(1).syncSource());

                PeerRegistrationResponse repeated = runtime.registerPeer(registration(host("host-e", "http://10.0.0.5:23000"), atLimit));
                Assertions.assertTrue(repeated.success());
                Assertions.assertTrue(repeated.alreadyKnown());
                Assertions.assertFalse(repeated.registered());
                Assertions.assertTrue(repeated.knownHosts().isEmpty());
                Assertions.assertEquals(2, runtime.listPeers().size());
            }
        } finally {
            TestSupport.deleteRecursively(root);
        }
    }

    @Test
    void selfRegistrationIsRefused() throws Exception {
        Path root = Files.createTempDirectory("amprelay-test-peers-self-");
        try {
            TestSupport.writeSettings(root, SETTINGS);
            try (AmpRuntime runtime = runtime(root, new RecordingPeerClient())) {
                Assertions.assertFalse(runtime.registerPeer(registration(host("HOST-A", "http://10.5.5.5:1"), null)).success());
                Assertions.assertFalse(runtime.registerPeer(registration(host("alpha", "http://10.5.5.5:1"), null)).success());
                Assertions.assertFalse(runtime.registerPeer(registration(host("other", "http://10.0.0.1:23000"), null)).success());
                Assertions.assertFalse(runtime.registerPeer(registration(
                        new PeerHost("x", null, "http://10.0.0.8:1", List.of(), null, null, null, null, null, null, null), null)).success());
                Assertions.assertTrue(runtime.listPeers().isEmpty());
            }
        } finally {
            TestSupport.deleteRecursively(root);
        }
    }

    @Test
    void exchangeMergesOnlyNewReachableHosts() throws Exception {
        Path root = Files.createTempDirectory("amprelay-test-peers-exchange-");
        try {
            TestSupport.writeSettings(root, SETTINGS);
            RecordingPeerClient client = new RecordingPeerClient();
            client.reachable.add("http://10.0.0.4:23000");
            try (AmpRuntime runtime = runtime(root, client)) {
                runtime.registerPeer(registration(host("host-c", "http://10.0.0.3:23000"), null));

                PeerExchangeResponse response = runtime.exchangePeers(new PeerExchangeRequest(
                        host("host-b", "http://10.0.0.2:23000"),
                        List.of(
                                host("host-a", "http://10.0.0.1:23000"),
                                host("host-b", "http://10.0.0.2:23000"),
                                host("host-c", "http://10.0.0.3:23000"),
                                host("host-c-alt", "http://10.0.0.3:23000"),
                                host("host-d", "http://10.0.0.4:23000"),
                                host("host-d", "http://10.0.0.4:23000"),
                                host("host-e", "http://10.0.0.5:23000")
                        ),
                        "prop_exchange_1"));
                Assertions.assertTrue(response.success());
                Assertions.assertEquals(List.of("host-d"), response.newlyAdded());
                Assertions.assertEquals(List.of("host-c", "host-c-alt"), response.alreadyKnown());
                Assertions.assertEquals(List.of("host-e"), response.unreachable());
                PeerHost added = runtime.listPeers().get(1);
                Assertions.assertEquals("peer-exchange:host-b", added.syncSource());

                PeerExchangeResponse repeated = runtime.exchangePeers(new PeerExchangeRequest(
                        host("host-b", "http://10.0.0.2:23000"),
                        List.of(host("host-f", "http://10.0.0.4:23000")),
                        "prop_exchange_1"));
                Assertions.assertTrue(repeated.newlyAdded().isEmpty());
                Assertions.assertTrue(repeated.alreadyKnown().isEmpty());
                Assertions.assertFalse(runtime.exchangePeers(new PeerExchangeRequest(null, List.of(), null)).success());
            }
        } finally {
            TestSupport.deleteRecursively(root);
        }
    }

    @Test
    void identityDescribesThisHostAndHonorsForwardedHeaders() throws Exception {
        Path root = Files.createTempDirectory("amprelay-test-peers-identity-");
        try {
            TestSupport.writeSettings(root, SETTINGS);
            try (AmpRuntime runtime = runtime(root, new RecordingPeerClient())) {
                PeerHost self = runtime.identity(null, null);
                Assertions.assertEquals("host-a", self.id());
                Assertions.assertEquals("Host A", self.name());
                Assertions.assertEquals("http://10.0.0.1:23000", self.url());
                Assertions.assertEquals(Boolean.TRUE, self.isSelf());
                Assertions.assertNotNull(self.version());
                Assertions.assertNotNull(self.tailscale());

                PeerHost forwarded = runtime.identity("relay.example.com", "https, http");
                Assertions.assertEquals("https://relay.example.com", forwarded.url());
            }
        } finally {
            TestSupport.deleteRecursively(root);
        }
    }

    @Test
    void descriptionsAreStrippedOfControlCharactersAndTruncated() {
        Assertions.assertEquals("ab", PeerDirectory.sanitizeDescription("a\u0000\nb", "x"));
        Assertions.assertEquals("fallback", PeerDirectory.sanitizeDescription("  ", "fallback"));
        Assertions.assertEquals(500, PeerDirectory.sanitizeDescription("y".repeat(800), "x").length());
    }

    static AmpRuntime runtime(Path root, PeerClient client) {
        AmpRuntime runtime = new AmpRuntime(AmpRelayConfig.fromRoot(root.toString()), Clock.systemUTC(),
                null, null, client, Map.of());
        runtime.init();
        return runtime;
    }

    static PeerHost host(String id, String url) {
        return PeerHost.descriptor(id, id.toUpperCase(), url, List.of(), null);
    }

    static PeerRegistrationRequest registration(PeerHost host, RegistrationSource source) {
        return new PeerRegistrationRequest(host, source);
    }
}
