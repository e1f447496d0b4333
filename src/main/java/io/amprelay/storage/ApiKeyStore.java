package io.amprelay.storage;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.Optional;

public final class ApiKeyStore {
    private final Database database;
    private final Clock clock;
    private final Object writeLock = new Object();

    public ApiKeyStore(Database database, Clock clock) {
        this.database = database;
        this.clock = clock;
    }

    public void insert(String keyHash, String agentId, String address) {
        synchronized (writeLock) {
            try (Connection c = database.openConnection();
                 PreparedStatement ps = c.prepareStatement(
                         "INSERT INTO api_keys(key_hash,agent_id,address,created_at_ms,revoked) VALUES(?,?,?,?,0)")) {
                ps.setString(1, keyHash);
                ps.setString(2, agentId);
                ps.setString(3, address);
                ps.setLong(4, clock.millis());
                ps.executeUpdate();
            } catch (SQLException e) {
                throw new AmpStorageException("Failed to store api key for agent " + agentId, e);
            }
        }
    }

    public Optional<ApiKeyRow> findActive(String keyHash) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT key_hash,agent_id,address,created_at_ms FROM api_keys WHERE key_hash=? AND revoked=0")) {
            ps.setString(1, keyHash);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new ApiKeyRow(
                        rs.getString("key_hash"),
                        rs.getString("agent_id"),
                        rs.getString("address"),
                        rs.getLong("created_at_ms")
                ));
            }
        } catch (SQLException e) {
            throw new AmpStorageException("Failed to look up api key", e);
        }
    }

    public int revokeAll(String agentId) {
        synchronized (writeLock) {
            try (Connection c = database.openConnection();
                 PreparedStatement ps = c.prepareStatement("UPDATE api_keys SET revoked=1 WHERE agent_id=? AND revoked=0")) {
                ps.setString(1, agentId);
                return ps.executeUpdate();
            } catch (SQLException e) {
                throw new AmpStorageException("Failed to revoke api keys for agent " + agentId, e);
            }
        }
    }

    public record ApiKeyRow(String keyHash, String agentId, String address, long createdAtMs) {
    }
}
