package io.amprelay.storage;

import io.amprelay.config.AmpRelayConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;

/**
 * Durable record of federated message ids seen within the replay window.
 *
 * <p>Storage failures fail open: the message is allowed through and a warning
 * is logged, so a broken disk degrades replay protection instead of halting
 * federation.
 */
public final class ReplayGuard {
    private static final Logger LOG = LoggerFactory.getLogger(ReplayGuard.class);

    private final Database database;
    private final Clock clock;
    private final long windowMs;
    private final long sweepIntervalMs;
    private final Object writeLock = new Object();
    private volatile long lastSweptAtMs;

    public ReplayGuard(Database database, Clock clock) {
        this(database, clock, AmpRelayConfig.REPLAY_WINDOW_MS, AmpRelayConfig.REPLAY_SWEEP_INTERVAL_MS);
    }

    public ReplayGuard(Database database, Clock clock, long windowMs, long sweepIntervalMs) {
        this.database = database;
        this.clock = clock;
        this.windowMs = windowMs;
        this.sweepIntervalMs = sweepIntervalMs;
        this.lastSweptAtMs = clock.millis();
    }

    public boolean seen(String messageId) {
        long nowMs = clock.millis();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT 1 FROM replay_seen WHERE message_id=? AND first_seen_at_ms>=? LIMIT 1")) {
            ps.setString(1, messageId);
            ps.setLong(2, nowMs - windowMs);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            LOG.warn("Replay lookup failed for message {}; treating as unseen", messageId, e);
            return false;
        }
    }

    public void record(String messageId) {
        checkAndRecord(messageId);
    }

    /**
     * Records the id and reports whether this is its first sighting inside the
     * window. Returns {@code false} for a replay.
     */
    public boolean checkAndRecord(String messageId) {
        long nowMs = clock.millis();
        maybeSweep(nowMs);
        synchronized (writeLock) {
            try (Connection c = database.openConnection()) {
                try (PreparedStatement stale = c.prepareStatement(
                        "DELETE FROM replay_seen WHERE message_id=? AND first_seen_at_ms<?")) {
                    stale.setString(1, messageId);
                    stale.setLong(2, nowMs - windowMs);
                    stale.executeUpdate();
                }
                try (PreparedStatement ps = c.prepareStatement(
                        "INSERT OR IGNORE INTO replay_seen(message_id,first_seen_at_ms) VALUES(?,?)")) {
                    ps.setString(1, messageId);
                    ps.setLong(2, nowMs);
                    return ps.executeUpdate() == 1;
                }
            } catch (SQLException e) {
                LOG.warn("Replay guard storage failed for message {}; accepting without replay protection", messageId, e);
                return true;
            }
        }
    }

    public int sweep() {
        long nowMs = clock.millis();
        synchronized (writeLock) {
            lastSweptAtMs = nowMs;
            try (Connection c = database.openConnection();
                 PreparedStatement ps = c.prepareStatement("DELETE FROM replay_seen WHERE first_seen_at_ms<?")) {
                ps.setLong(1, nowMs - windowMs);
                int removed = ps.executeUpdate();
                if (removed > 0) {
                    LOG.debug("Swept {} replay entries", removed);
                }
                return removed;
            } catch (SQLException e) {
                LOG.warn("Replay sweep failed", e);
                return 0;
            }
        }
    }

    public long lastSweptAtMs() {
        return lastSweptAtMs;
    }

    private void maybeSweep(long nowMs) {
        if (nowMs - lastSweptAtMs < sweepIntervalMs) {
            return;
        }
        sweep();
    }
}
