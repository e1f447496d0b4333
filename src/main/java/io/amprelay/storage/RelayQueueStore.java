package io.amprelay.storage;

import io.amprelay.config.AmpRelayConfig;
import io.amprelay.model.Envelope;
import io.amprelay.model.Payload;
import io.amprelay.model.RelayEntry;
import io.amprelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public final class RelayQueueStore {
    private static final Logger LOG = LoggerFactory.getLogger(RelayQueueStore.class);

    private final Database database;
    private final Clock clock;
    private final long ttlMs;
    private final long sweepIntervalMs;
    private final Object writeLock = new Object();
    private volatile long lastSweptAtMs;

    public RelayQueueStore(Database database, Clock clock) {
        this(database, clock, AmpRelayConfig.RELAY_TTL_MS, AmpRelayConfig.RELAY_SWEEP_INTERVAL_MS);
    }

    public RelayQueueStore(Database database, Clock clock, long ttlMs, long sweepIntervalMs) {
        this.database = database;
        this.clock = clock;
        this.ttlMs = ttlMs;
        this.sweepIntervalMs = sweepIntervalMs;
        this.lastSweptAtMs = clock.millis();
    }

    /**
     * Holds a message for {@code recipientKey}. Enqueuing the same envelope id
     * twice for one recipient keeps the first entry.
     */
    public RelayEntry enqueue(String recipientKey, Envelope envelope, Payload payload, String senderPublicKey) {
        requireKey(recipientKey);
        long nowMs = clock.millis();
        maybeSweep(nowMs);
        synchronized (writeLock) {
            try (Connection c = database.openConnection();
                 PreparedStatement ps = c.prepareStatement("""
                         INSERT OR IGNORE INTO relay_queue(
                             recipient_key,message_id,envelope_json,payload_json,sender_public_key,
                             queued_at_ms,expires_at_ms,attempts
                         ) VALUES(?,?,?,?,?,?,?,0)
                         """)) {
                ps.setString(1, recipientKey);
                ps.setString(2, envelope.id());
                ps.setString(3, Jsons.toCompactJson(envelope));
                ps.setString(4, Jsons.toCompactJson(payload));
                ps.setString(5, senderPublicKey);
                ps.setLong(6, nowMs);
                ps.setLong(7, nowMs + ttlMs);
                if (ps.executeUpdate() == 0) {
                    LOG.debug("Message {} already queued for {}", envelope.id(), recipientKey);
                }
            } catch (SQLException e) {
                throw new AmpStorageException("Failed to enqueue message " + envelope.id() + " for " + recipientKey, e);
            }
        }
        return get(recipientKey, envelope.id());
    }

    public RelayEntry get(String recipientKey, String messageId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT * FROM relay_queue WHERE recipient_key=? AND message_id=?")) {
            ps.setString(1, recipientKey);
            ps.setString(2, messageId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? mapEntry(rs) : null;
            }
        } catch (SQLException e) {
            throw new AmpStorageException("Failed to load queued message " + messageId, e);
        }
    }

    /**
     * Oldest-first page of unexpired messages. Every returned entry has its
     * attempt counter incremented.
     */
    public PendingMessages pending(String recipientKey, int limit) {
        requireKey(recipientKey);
        int safeLimit = clampLimit(limit);
        long nowMs = clock.millis();
        maybeSweep(nowMs);
        synchronized (writeLock) {
            try (Connection c = database.openConnection()) {
                c.setAutoCommit(false);
                try {
                    int total = countLive(c, recipientKey, nowMs);
                    List<RelayEntry> page = new ArrayList<>();
                    try (PreparedStatement ps = c.prepareStatement("""
                            SELECT * FROM relay_queue
                            WHERE recipient_key=? AND expires_at_ms>?
                            ORDER BY queued_at_ms ASC, message_id ASC
                            LIMIT ?
                            """)) {
                        ps.setString(1, recipientKey);
                        ps.setLong(2, nowMs);
                        ps.setInt(3, safeLimit);
                        try (ResultSet rs = ps.executeQuery()) {
                            while (rs.next()) {
                                page.add(mapEntry(rs));
                            }
                        }
                    }
                    List<RelayEntry> out = new ArrayList<>(page.size());
                    try (PreparedStatement inc = c.prepareStatement(
                            "UPDATE relay_queue SET attempts=attempts+1 WHERE recipient_key=? AND message_id=?")) {
                        for (RelayEntry entry : page) {
                            inc.setString(1, recipientKey);
                            inc.setString(2, entry.id());
                            inc.executeUpdate();
                            out.add(new RelayEntry(
                                    entry.id(),
                                    entry.envelope(),
                                    entry.payload(),
                                    entry.senderPublicKey(),
                                    entry.recipientKey(),
                                    entry.queuedAt(),
                                    entry.expiresAt(),
                                    entry.attempts() + 1
                            ));
                        }
                    }
                    c.commit();
                    return new PendingMessages(out, out.size(), Math.max(0, total - out.size()));
                } catch (SQLException e) {
                    c.rollback();
                    throw e;
                } finally {
                    c.setAutoCommit(true);
                }
            } catch (SQLException e) {
                throw new AmpStorageException("Failed to list pending messages for " + recipientKey, e);
            }
        }
    }

    public int count(String recipientKey) {
        try (Connection c = database.openConnection()) {
            return countLive(c, recipientKey, clock.millis());
        } catch (SQLException e) {
            throw new AmpStorageException("Failed to count pending messages for " + recipientKey, e);
        }
    }

    public boolean acknowledge(String recipientKey, String messageId) {
        requireKey(recipientKey);
        if (messageId == null || messageId.isBlank()) {
            throw new IllegalArgumentException("messageId must not be blank");
        }
        synchronized (writeLock) {
            try (Connection c = database.openConnection();
                 PreparedStatement ps = c.prepareStatement(
                         "DELETE FROM relay_queue WHERE recipient_key=? AND message_id=?")) {
                ps.setString(1, recipientKey);
                ps.setString(2, messageId.trim());
                return ps.executeUpdate() > 0;
            } catch (SQLException e) {
                throw new AmpStorageException("Failed to acknowledge message " + messageId, e);
            }
        }
    }

    public int acknowledgeBatch(String recipientKey, List<String> messageIds) {
        requireKey(recipientKey);
        Set<String> ids = normalizeBatch(messageIds);
        synchronized (writeLock) {
            try (Connection c = database.openConnection()) {
                c.setAutoCommit(false);
                try (PreparedStatement ps = c.prepareStatement(
                        "DELETE FROM relay_queue WHERE recipient_key=? AND message_id=?")) {
                    int removed = 0;
                    for (String id : ids) {
                        ps.setString(1, recipientKey);
                        ps.setString(2, id);
                        removed += ps.executeUpdate();
                    }
                    c.commit();
                    return removed;
                } catch (SQLException e) {
                    c.rollback();
                    throw e;
                } finally {
                    c.setAutoCommit(true);
                }
            } catch (SQLException e) {
                throw new AmpStorageException("Failed to acknowledge message batch for " + recipientKey, e);
            }
        }
    }

    public PendingMessages pendingFor(String agentId, String agentName, int limit) {
        PendingMessages byId = pending(agentId, limit);
        if (byId.count() > 0 || agentName == null || agentName.isBlank() || agentName.equals(agentId)) {
            return byId;
        }
        return pending(agentName, limit);
    }

    public boolean acknowledgeFor(String agentId, String agentName, String messageId) {
        if (acknowledge(agentId, messageId)) {
            return true;
        }
        if (agentName == null || agentName.isBlank() || agentName.equals(agentId)) {
            return false;
        }
        return acknowledge(agentName, messageId);
    }

    public int acknowledgeBatchFor(String agentId, String agentName, List<String> messageIds) {
        int removed = acknowledgeBatch(agentId, messageIds);
        if (removed > 0 || agentName == null || agentName.isBlank() || agentName.equals(agentId)) {
            return removed;
        }
        return acknowledgeBatch(agentName, messageIds);
    }

    public int expireAll() {
        long nowMs = clock.millis();
        synchronized (writeLock) {
            lastSweptAtMs = nowMs;
            try (Connection c = database.openConnection();
                 PreparedStatement ps = c.prepareStatement("DELETE FROM relay_queue WHERE expires_at_ms<=?")) {
                ps.setLong(1, nowMs);
                int removed = ps.executeUpdate();
                if (removed > 0) {
                    LOG.info("Expired {} relay queue entries", removed);
                }
                return removed;
            } catch (SQLException e) {
                throw new AmpStorageException("Failed to expire relay queue entries", e);
            }
        }
    }

    private void maybeSweep(long nowMs) {
        if (nowMs - lastSweptAtMs < sweepIntervalMs) {
            return;
        }
        try {
            expireAll();
        } catch (AmpStorageException e) {
            LOG.warn("Lazy relay queue sweep failed", e);
        }
    }

    private int countLive(Connection c, String recipientKey, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT COUNT(*) FROM relay_queue WHERE recipient_key=? AND expires_at_ms>?")) {
            ps.setString(1, recipientKey);
            ps.setLong(2, nowMs);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        }
    }

    private RelayEntry mapEntry(ResultSet rs) throws SQLException {
        return new RelayEntry(
                rs.getString("message_id"),
                Jsons.fromJson(rs.getString("envelope_json"), Envelope.class),
                Jsons.fromJson(rs.getString("payload_json"), Payload.class),
                rs.getString("sender_public_key"),
                rs.getString("recipient_key"),
                Instant.ofEpochMilli(rs.getLong("queued_at_ms")).toString(),
                Instant.ofEpochMilli(rs.getLong("expires_at_ms")).toString(),
                rs.getInt("attempts")
        );
    }

    public static int clampLimit(int limit) {
        if (limit <= 0) {
            return AmpRelayConfig.DEFAULT_PENDING_LIMIT;
        }
        return Math.min(limit, AmpRelayConfig.MAX_PENDING_LIMIT);
    }

    private static Set<String> normalizeBatch(List<String> messageIds) {
        if (messageIds == null || messageIds.isEmpty()) {
            throw new IllegalArgumentException("ids must contain between 1 and " + AmpRelayConfig.MAX_ACK_BATCH + " entries");
        }
        if (messageIds.size() > AmpRelayConfig.MAX_ACK_BATCH) {
            throw new IllegalArgumentException("Cannot acknowledge more than " + AmpRelayConfig.MAX_ACK_BATCH + " messages at once");
        }
        Set<String> out = new LinkedHashSet<>();
        for (String id : messageIds) {
            if (id != null && !id.isBlank()) {
                out.add(id.trim());
            }
        }
        return out;
    }

    private static void requireKey(String recipientKey) {
        if (recipientKey == null || recipientKey.isBlank()) {
            throw new IllegalArgumentException("recipientKey must not be blank");
        }
    }

    public record PendingMessages(List<RelayEntry> messages, int count, int remaining) {
        public PendingMessages {
            messages = messages == null ? List.of() : List.copyOf(messages);
        }
    }
}
