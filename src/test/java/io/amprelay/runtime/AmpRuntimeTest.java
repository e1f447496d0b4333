package io.amprelay.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.amprelay.TestSupport;
import io.amprelay.agent.AgentRecord;
import io.amprelay.config.AmpRelayConfig;
import io.amprelay.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

final class AmpRuntimeTest {
    private static final String SETTINGS = """
            {
              "hostId": "host-a",
              "hostUrl": "http://10.40.0.1:23000",
              "provider": "aimaestro.local",
              "organization": "acme"
            }
            """;

    @Test
    void agentRegistrationIssuesAddressKeyAndKeyPair() throws Exception {
        Path root = Files.createTempDirectory("amprelay-test-runtime-agents-");
        try {
            TestSupport.writeSettings(root, SETTINGS);
            try (AmpRuntime runtime = new AmpRuntime(AmpRelayConfig.fromRoot(root.toString()))) {
                runtime.init();
                AmpRuntime.AgentRegistration alice = runtime.registerAgent("alice", "Alice", "proj-alice", false);
                Assertions.assertEquals("alice@acme.aimaestro.local", alice.address());
                Assertions.assertTrue(alice.apiKey().startsWith("amp_live_sk_"));
                Assertions.assertEquals(64, alice.publicKey().length());
                Assertions.assertFalse(alice.agent().online());

                Assertions.assertThrows(IllegalArgumentException.class, () -> runtime.registerAgent("alice", null, null, true));
                Assertions.assertThrows(IllegalArgumentException.class, () -> runtime.registerAgent("-bad", null, null, true));
                Assertions.assertThrows(IllegalArgumentException.class, () -> runtime.registerAgent("a b", null, null, true));

                AgentRecord authenticated = runtime.authenticate("Bearer " + alice.apiKey()).orElseThrow();
                Assertions.assertEquals(alice.agent().id(), authenticated.id());
                Assertions.assertTrue(runtime.authenticate(alice.apiKey()).isPresent());
                Assertions.assertTrue(runtime.authenticate("Bearer amp_live_sk_" + "0".repeat(64)).isEmpty());
                Assertions.assertTrue(runtime.authenticate(null).isEmpty());

                String rotated = runtime.rotateApiKey("alice", false);
                Assertions.assertTrue(rotated.startsWith("amp_test_sk_"));
                Assertions.assertTrue(runtime.authenticate("Bearer " + alice.apiKey()).isEmpty());
                Assertions.assertTrue(runtime.authenticate("Bearer " + rotated).isPresent());

                Assertions.assertTrue(runtime.setOnline("alice", true).online());
                Assertions.assertEquals(List.of("alice"), runtime.listAgents().stream().map(AgentRecord::name).toList());
                Assertions.assertThrows(IllegalArgumentException.class, () -> runtime.setOnline("nobody", true));
            }
        } finally {
            TestSupport.deleteRecursively(root);
        }
    }

    @Test
    void auditRowsAreHashChainedAndSigned() throws Exception {
        Path root = Files.createTempDirectory("amprelay-test-runtime-audit-");
        try {
            TestSupport.writeSettings(root, SETTINGS);
            try (AmpRuntime runtime = new AmpRuntime(AmpRelayConfig.fromRoot(root.toString()))) {
                runtime.init();
                runtime.registerAgent("alice", null, null, true);
                runtime.registerAgent("bob", null, null, true);

                List<String> tail = runtime.auditTail(2);
                Assertions.assertEquals(2, tail.size());
                JsonNode first = Jsons.compact().readTree(tail.get(0));
                JsonNode second = Jsons.compact().readTree(tail.get(1));
                Assertions.assertEquals("agent.register", first.path("action").asText());
                Assertions.assertEquals("host-a", first.path("host_id").asText());
                Assertions.assertEquals(first.path("hash").asText(), second.path("prev_hash").asText());
                Assertions.assertFalse(second.path("signature").asText().isBlank());
                Assertions.assertTrue(Files.exists(runtime.config().auditSigningKeyFile()));
            }
            try (AmpRuntime reopened = new AmpRuntime(AmpRelayConfig.fromRoot(root.toString()))) {
                reopened.init();
                String lastHash = Jsons.compact().readTree(reopened.auditTail(1).get(0)).path("hash").asText();
                reopened.registerAgent("carol", null, null, true);
                JsonNode row = Jsons.compact().readTree(reopened.auditTail(1).get(0));
                Assertions.assertEquals(lastHash, row.path("prev_hash").asText());
            }
        } finally {
            TestSupport.deleteRecursively(root);
        }
    }

    @Test
    void schemaMigrationsAreRecordedOnInit() throws Exception {
        Path root = Files.createTempDirectory("amprelay-test-runtime-schema-");
        try {
            TestSupport.writeSettings(root, SETTINGS);
            try (AmpRuntime runtime = new AmpRuntime(AmpRelayConfig.fromRoot(root.toString()))) {
                runtime.init();
                runtime.init();
                Assertions.assertFalse(runtime.schemaMigrations().isEmpty());
                Assertions.assertTrue(runtime.schemaMigrations().stream().allMatch(row -> row.success()));
                Assertions.assertEquals(0, runtime.expireRelay());
            }
        } finally {
            TestSupport.deleteRecursively(root);
        }
    }
}
