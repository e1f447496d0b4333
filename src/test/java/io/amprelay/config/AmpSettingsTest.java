package io.amprelay.config;

import io.amprelay.TestSupport;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

final class AmpSettingsTest {
    @Test
    void missingFileFallsBackToDefaults() throws Exception {
        Path root = Files.createTempDirectory("amprelay-test-settings-defaults-");
        try {
            AmpSettings settings = AmpSettings.load(AmpRelayConfig.fromRoot(root.toString()));
            Assertions.assertEquals(AmpSettings.DEFAULT_PROVIDER, settings.provider());
            Assertions.assertEquals(AmpRelayConfig.RATE_LIMIT_PER_WINDOW, settings.rateLimitPerWindow());
            Assertions.assertEquals(AmpRelayConfig.RELAY_TTL_MS, settings.relayTtlMs());
            Assertions.assertTrue(settings.federationTransports().isEmpty());
            Assertions.assertFalse(settings.hostId().contains("."));
        } finally {
            TestSupport.deleteRecursively(root);
        }
    }

    @Test
    void fileValuesAreSanitized() throws Exception {
        Path root = Files.createTempDirectory("amprelay-test-settings-file-");
        try {
            TestSupport.writeSettings(root, """
                    {
                      "hostId": "Mac-Mini.lan",
                      "hostUrl": "http://10.1.0.1:23000///",
                      "hostAliases": ["  mini ", "", null],
                      "provider": "Crabmail.AI",
                      "rateLimitPerWindow": 0,
                      "deliveryTimeoutMs": 5,
                      "federationTransports": {"Crabmail.AI": "https://crabmail.ai/amp/", "": "http://ignored"},
                      "unknownKey": true
                    }
                    """);
            AmpSettings settings = AmpSettings.load(AmpRelayConfig.fromRoot(root.toString()));
            Assertions.assertEquals("mac-mini", settings.hostId());
            Assertions.assertEquals("mac-mini", settings.hostName());
            Assertions.assertEquals("http://10.1.0.1:23000", settings.hostUrl());
            Assertions.assertEquals(List.of("mini"), settings.hostAliases());
            Assertions.assertEquals("crabmail.ai", settings.provider());
            Assertions.assertEquals(AmpSettings.DEFAULT_ORGANIZATION, settings.organization());
            Assertions.assertEquals(1, settings.rateLimitPerWindow());
            Assertions.assertEquals(100L, settings.deliveryTimeoutMs());
            Assertions.assertEquals("https://crabmail.ai/amp", settings.federationTransportUrl("CRABMAIL.ai"));
            Assertions.assertEquals(1, settings.federationTransports().size());
            Assertions.assertNull(settings.federationTransportUrl(null));
        } finally {
            TestSupport.deleteRecursively(root);
        }
    }
}
