package io.amprelay.storage;

import io.amprelay.config.AmpRelayConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;

public final class PropagationLedger {
    private static final Logger LOG = LoggerFactory.getLogger(PropagationLedger.class);

    private final Database database;
    private final Clock clock;
    private final long windowMs;
    private final long sweepIntervalMs;
    private final Object writeLock = new Object();
    private volatile long lastSweptAtMs;

    public PropagationLedger(Database database, Clock clock) {
        this(database, clock, AmpRelayConfig.PROPAGATION_WINDOW_MS, AmpRelayConfig.PROPAGATION_SWEEP_INTERVAL_MS);
    }

    public PropagationLedger(Database database, Clock clock, long windowMs, long sweepIntervalMs) {
        this.database = database;
        this.clock = clock;
        this.windowMs = windowMs;
        this.sweepIntervalMs = sweepIntervalMs;
        this.lastSweptAtMs = clock.millis();
    }

    public boolean seen(String propagationId) {
        long nowMs = clock.millis();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT 1 FROM propagation_seen WHERE propagation_id=? AND seen_at_ms>=? LIMIT 1")) {
            ps.setString(1, propagationId);
            ps.setLong(2, nowMs - windowMs);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new AmpStorageException("Failed to query propagation id: " + propagationId, e);
        }
    }

    /**
     * Returns {@code true} when the id was not seen inside the window and has
     * now been recorded.
     */
    public boolean markIfNew(String propagationId) {
        long nowMs = clock.millis();
        maybeSweep(nowMs);
        synchronized (writeLock) {
            try (Connection c = database.openConnection()) {
                try (PreparedStatement stale = c.prepareStatement(
                        "DELETE FROM propagation_seen WHERE propagation_id=? AND seen_at_ms<?")) {
                    stale.setString(1, propagationId);
                    stale.setLong(2, nowMs - windowMs);
                    stale.executeUpdate();
                }
                try (PreparedStatement ps = c.prepareStatement(
                        "INSERT OR IGNORE INTO propagation_seen(propagation_id,seen_at_ms) VALUES(?,?)")) {
                    ps.setString(1, propagationId);
                    ps.setLong(2, nowMs);
                    return ps.executeUpdate() == 1;
                }
            } catch (SQLException e) {
                throw new AmpStorageException("Failed to record propagation id: " + propagationId, e);
            }
        }
    }

    public int sweep() {
        long nowMs = clock.millis();
        synchronized (writeLock) {
            lastSweptAtMs = nowMs;
            try (Connection c = database.openConnection();
                 PreparedStatement ps = c.prepareStatement("DELETE FROM propagation_seen WHERE seen_at_ms<?")) {
                ps.setLong(1, nowMs - windowMs);
                return ps.executeUpdate();
            } catch (SQLException e) {
                LOG.warn("Propagation ledger sweep failed", e);
                return 0;
            }
        }
    }

    private void maybeSweep(long nowMs) {
        if (nowMs - lastSweptAtMs < sweepIntervalMs) {
            return;
        }
        sweep();
    }
}
