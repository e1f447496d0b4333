package io.amprelay.storage;

import io.amprelay.config.AmpRelayConfig;
import io.amprelay.util.Hashing;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Properties;
import java.util.Set;

public final class Database {
    private static final String MIGRATION_SCHEMA_VERSION = "amprelay.schema.migration.v1";
    private final AmpRelayConfig config;
    private final String jdbcUrl;

    public Database(AmpRelayConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public AmpRelayConfig config() {
        return config;
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        Properties props = new Properties();
        props.setProperty("busy_timeout", "5000");
        props.setProperty("foreign_keys", "true");
        return DriverManager.getConnection(jdbcUrl, props);
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.inboxRoot());
            Files.createDirectories(config.auditRoot());
            Files.createDirectories(config.securityRoot());
            Files.createDirectories(config.keysRoot());
        } catch (IOException e) {
            throw new AmpStorageException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS agents (
                        agent_id TEXT PRIMARY KEY,
                        name TEXT NOT NULL UNIQUE,
                        alias TEXT,
                        session_name TEXT,
                        organization TEXT NOT NULL,
                        online INTEGER NOT NULL DEFAULT 0,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS api_keys (
                        key_hash TEXT PRIMARY KEY,
                        agent_id TEXT NOT NULL,
                        address TEXT NOT NULL,
                        created_at_ms INTEGER NOT NULL,
                        revoked INTEGER NOT NULL DEFAULT 0,
                        FOREIGN KEY(agent_id) REFERENCES agents(agent_id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS relay_queue (
                        recipient_key TEXT NOT NULL,
                        message_id TEXT NOT NULL,
                        envelope_json TEXT NOT NULL,
                        payload_json TEXT NOT NULL,
                        sender_public_key TEXT,
                        queued_at_ms INTEGER NOT NULL,
                        expires_at_ms INTEGER NOT NULL,
                        attempts INTEGER NOT NULL DEFAULT 0,
                        PRIMARY KEY(recipient_key, message_id)
                    )
                    """);
            ensureRelayQueueColumns(conn);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS replay_seen (
                        message_id TEXT PRIMARY KEY,
                        first_seen_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS propagation_seen (
                        propagation_id TEXT PRIMARY KEY,
                        seen_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS peer_hosts (
                        host_id TEXT PRIMARY KEY,
                        name TEXT NOT NULL,
                        url TEXT NOT NULL,
                        aliases_json TEXT NOT NULL DEFAULT '[]',
                        description TEXT NOT NULL DEFAULT '',
                        enabled INTEGER NOT NULL DEFAULT 1,
                        synced_at_ms INTEGER,
                        sync_source TEXT,
                        created_at_ms INTEGER NOT NULL
                    )
                    """);
            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);

            st.execute("CREATE INDEX IF NOT EXISTS idx_relay_queue_recipient_queued ON relay_queue(recipient_key, queued_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_relay_queue_expires ON relay_queue(expires_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_replay_seen_time ON replay_seen(first_seen_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_propagation_seen_time ON propagation_seen(seen_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_api_keys_agent ON api_keys(agent_id)");
        } catch (SQLException e) {
            throw new AmpStorageException("Failed to initialize SQLite schema", e);
        }
    }

    private void ensureRelayQueueColumns(Connection conn) throws SQLException {
        Set<String> columns = new HashSet<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(relay_queue)")) {
            while (rs.next()) {
                columns.add(rs.getString("name").toLowerCase());
            }
        }
        try (Statement st = conn.createStatement()) {
            if (!columns.contains("sender_public_key")) {
                st.execute("ALTER TABLE relay_queue ADD COLUMN sender_public_key TEXT");
            }
            if (!columns.contains("attempts")) {
                st.execute("ALTER TABLE relay_queue ADD COLUMN attempts INTEGER NOT NULL DEFAULT 0");
            }
        }
    }

    private void ensureSchemaMigrationsTable(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL,
                        success INTEGER NOT NULL
                    )
                    """);
        }
    }

    private void applyVersionedMigrations(Connection conn) throws SQLException {
        List<MigrationStep> steps = new ArrayList<>();
        steps.add(new MigrationStep(
                "20261001_001_agent_lookup_indexes",
                "Index agent alias and session name used by recipient resolution",
                List.of(
                        "CREATE INDEX IF NOT EXISTS idx_agents_alias ON agents(alias COLLATE NOCASE)",
                        "CREATE INDEX IF NOT EXISTS idx_agents_session ON agents(session_name)"
                )
        ));
        steps.add(new MigrationStep(
                "20261001_002_peer_host_url_index",
                "Index peer host url for duplicate detection",
                List.of("CREATE INDEX IF NOT EXISTS idx_peer_hosts_url ON peer_hosts(url)")
        ));
        for (MigrationStep step : steps) {
            if (isMigrationApplied(conn, step.version())) {
                continue;
            }
            applyMigration(conn, step);
        }
    }

    private boolean isMigrationApplied(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM schema_migrations WHERE version=? AND success=1 LIMIT 1")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void applyMigration(Connection conn, MigrationStep step) throws SQLException {
        try (Statement st = conn.createStatement()) {
            for (String sql : step.sql()) {
                st.execute(sql);
            }
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
            ps.setString(1, step.version());
            ps.setString(2, step.description());
            ps.setString(3, checksum(step));
            ps.setLong(4, Instant.now().toEpochMilli());
            ps.executeUpdate();
        }
    }

    private String checksum(MigrationStep step) {
        StringBuilder sb = new StringBuilder();
        sb.append(MIGRATION_SCHEMA_VERSION).append('|')
                .append(step.version()).append('|')
                .append(step.description()).append('|');
        for (String sql : step.sql()) {
            sb.append(sql).append(';');
        }
        return Hashing.sha256Hex(sb.toString()).substring(0, 16);
    }

    private record MigrationStep(String version, String description, List<String> sql) {
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
            validatePragma(st, "foreign_keys", "1");
        } catch (SQLException e) {
            throw new AmpStorageException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }

    public List<SchemaMigrationRow> listSchemaMigrations() {
        List<SchemaMigrationRow> out = new ArrayList<>();
        try (Connection c = openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT version,description,checksum,applied_at_ms,success FROM schema_migrations ORDER BY version")) {
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new SchemaMigrationRow(
                            rs.getString("version"),
                            rs.getString("description"),
                            rs.getString("checksum"),
                            rs.getLong("applied_at_ms"),
                            rs.getInt("success") == 1
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new AmpStorageException("Failed to list schema migrations", e);
        }
    }

    public record SchemaMigrationRow(
            String version,
            String description,
            String checksum,
            long appliedAtMs,
            boolean success
    ) {
    }
}
