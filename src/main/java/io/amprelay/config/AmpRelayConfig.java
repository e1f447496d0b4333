package io.amprelay.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class AmpRelayConfig {
    public static final String SETTINGS_FILE = "amprelay-settings.json";
    public static final int DEFAULT_HTTP_PORT = 23000;
    public static final int DEFAULT_PENDING_LIMIT = 10;
    public static final int MAX_PENDING_LIMIT = 100;
    public static final int MAX_ACK_BATCH = 100;
    public static final int MAX_PROPAGATION_DEPTH = 3;
    public static final int RATE_LIMIT_PER_WINDOW = 120;
    public static final long RATE_LIMIT_WINDOW_MS = 60_000L;
    public static final long RELAY_TTL_MS = 7L * 24L * 60L * 60L * 1000L;
    public static final long RELAY_SWEEP_INTERVAL_MS = 60L * 60L * 1000L;
    public static final long REPLAY_WINDOW_MS = 24L * 60L * 60L * 1000L;
    public static final long REPLAY_SWEEP_INTERVAL_MS = 60L * 60L * 1000L;
    public static final long PROPAGATION_WINDOW_MS = 60L * 60L * 1000L;
    public static final long PROPAGATION_SWEEP_INTERVAL_MS = 10L * 60L * 1000L;
    public static final long DELIVERY_TIMEOUT_MS = 5_000L;
    public static final long FEDERATION_TIMEOUT_MS = 10_000L;
    public static final long PEER_PROBE_TIMEOUT_MS = 5_000L;

    private final Path rootDir;

    public AmpRelayConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static AmpRelayConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        return new AmpRelayConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("amprelay.db");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path inboxRoot() {
        return rootDir.resolve("inbox");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path securityRoot() {
        return rootDir.resolve("security");
    }

    public Path auditSigningKeyFile() {
        return securityRoot().resolve("audit-signing.key");
    }

    public Path keysRoot() {
        return securityRoot().resolve("agent-keys");
    }
}
