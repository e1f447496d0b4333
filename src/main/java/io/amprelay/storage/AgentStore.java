package io.amprelay.storage;

import io.amprelay.agent.AgentRecord;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class AgentStore {
    private final Database database;
    private final Clock clock;
    private final Object writeLock = new Object();

    public AgentStore(Database database, Clock clock) {
        this.database = database;
        this.clock = clock;
    }

    public AgentRecord insert(AgentRecord agent) {
        long nowMs = clock.millis();
        synchronized (writeLock) {
            try (Connection c = database.openConnection();
                 PreparedStatement ps = c.prepareStatement("""
                         INSERT INTO agents(agent_id,name,alias,session_name,organization,online,created_at_ms,updated_at_ms)
                         VALUES(?,?,?,?,?,?,?,?)
                         """)) {
                ps.setString(1, agent.id());
                ps.setString(2, agent.name());
                ps.setString(3, agent.alias());
                ps.setString(4, agent.sessionName());
                ps.setString(5, agent.organization());
                ps.setInt(6, agent.online() ? 1 : 0);
                ps.setLong(7, agent.createdAtMs() > 0 ? agent.createdAtMs() : nowMs);
                ps.setLong(8, nowMs);
                ps.executeUpdate();
            } catch (SQLException e) {
                throw new AmpStorageException("Failed to insert agent: " + agent.name(), e);
            }
        }
        return get(agent.id()).orElseThrow();
    }

    public Optional<AgentRecord> get(String agentId) {
        return queryOne("SELECT * FROM agents WHERE agent_id=?", agentId);
    }

    public Optional<AgentRecord> findByName(String name) {
        return queryOne("SELECT * FROM agents WHERE name=?", name);
    }

    public List<AgentRecord> list() {
        List<AgentRecord> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT * FROM agents ORDER BY created_at_ms ASC, agent_id ASC");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(map(rs));
            }
            return out;
        } catch (SQLException e) {
            throw new AmpStorageException("Failed to list agents", e);
        }
    }

    public boolean setOnline(String agentId, boolean online) {
        synchronized (writeLock) {
            try (Connection c = database.openConnection();
                 PreparedStatement ps = c.prepareStatement(
                         "UPDATE agents SET online=?, updated_at_ms=? WHERE agent_id=?")) {
                ps.setInt(1, online ? 1 : 0);
                ps.setLong(2, clock.millis());
                ps.setString(3, agentId);
                return ps.executeUpdate() > 0;
            } catch (SQLException e) {
                throw new AmpStorageException("Failed to update agent presence: " + agentId, e);
            }
        }
    }

    private Optional<AgentRecord> queryOne(String sql, String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, value.trim());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new AmpStorageException("Failed to load agent: " + value, e);
        }
    }

    private static AgentRecord map(ResultSet rs) throws SQLException {
        return new AgentRecord(
                rs.getString("agent_id"),
                rs.getString("name"),
                rs.getString("alias"),
                rs.getString("session_name"),
                rs.getString("organization"),
                rs.getInt("online") == 1,
                rs.getLong("created_at_ms")
        );
    }
}
