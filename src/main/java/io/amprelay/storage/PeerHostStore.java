package io.amprelay.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import io.amprelay.model.PeerHost;
import io.amprelay.util.Jsons;

import java.net.URI;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

public final class PeerHostStore {
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final Database database;
    private final Clock clock;
    private final Object writeLock = new Object();

    public PeerHostStore(Database database, Clock clock) {
        this.database = database;
        this.clock = clock;
    }

    /**
     * Stores a new host. Returns {@code false} without touching the row when
     * the id is already present.
     */
    public boolean add(PeerHost host) {
        synchronized (writeLock) {
            try (Connection c = database.openConnection();
                 PreparedStatement ps = c.prepareStatement("""
                         INSERT OR IGNORE INTO peer_hosts(
                             host_id,name,url,aliases_json,description,enabled,synced_at_ms,sync_source,created_at_ms
                         ) VALUES(?,?,?,?,?,?,?,?,?)
                         """)) {
                ps.setString(1, host.id());
                ps.setString(2, host.name());
                ps.setString(3, host.url());
                ps.setString(4, Jsons.toCompactJson(host.aliases()));
                ps.setString(5, host.description() == null ? "" : host.description());
                ps.setInt(6, host.enabled() == null || host.enabled() ? 1 : 0);
                if (host.syncedAt() == null) {
                    ps.setNull(7, Types.INTEGER);
                } else {
                    ps.setLong(7, Instant.parse(host.syncedAt()).toEpochMilli());
                }
                ps.setString(8, host.syncSource());
                ps.setLong(9, clock.millis());
                return ps.executeUpdate() > 0;
            } catch (SQLException e) {
                throw new AmpStorageException("Failed to add peer host: " + host.id(), e);
            }
        }
    }

    public Optional<PeerHost> get(String hostId) {
        if (hostId == null || hostId.isBlank()) {
            return Optional.empty();
        }
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT * FROM peer_hosts WHERE host_id=?")) {
            ps.setString(1, hostId.trim());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new AmpStorageException("Failed to load peer host: " + hostId, e);
        }
    }

    public List<PeerHost> list() {
        List<PeerHost> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT * FROM peer_hosts ORDER BY created_at_ms ASC, host_id ASC");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(map(rs));
            }
            return out;
        } catch (SQLException e) {
            throw new AmpStorageException("Failed to list peer hosts", e);
        }
    }

    /**
     * First stored host sharing any identifier with {@code candidate}: id,
     * url, url host name or alias, compared case-insensitively.
     */
    public Optional<PeerHost> findByAnyIdentifier(PeerHost candidate) {
        Set<String> wanted = identifiers(candidate);
        if (wanted.isEmpty()) {
            return Optional.empty();
        }
        for (PeerHost known : list()) {
            for (String id : identifiers(known)) {
                if (wanted.contains(id)) {
                    return Optional.of(known);
                }
            }
        }
        return Optional.empty();
    }

    public static Set<String> identifiers(PeerHost host) {
        Set<String> out = new LinkedHashSet<>();
        addIdentifier(out, host.id());
        if (host.url() != null && !host.url().isBlank()) {
            addIdentifier(out, normalizeUrl(host.url()));
            addIdentifier(out, urlHost(host.url()));
        }
        for (String alias : host.aliases()) {
            addIdentifier(out, alias);
        }
        return out;
    }

    public static String normalizeUrl(String url) {
        String value = url.trim().toLowerCase(Locale.ROOT);
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }

    static String urlHost(String url) {
        try {
            return URI.create(url.trim()).getHost();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static void addIdentifier(Set<String> out, String raw) {
        if (raw != null && !raw.isBlank()) {
            out.add(raw.trim().toLowerCase(Locale.ROOT));
        }
    }

    private static PeerHost map(ResultSet rs) throws SQLException {
        long syncedAt = rs.getLong("synced_at_ms");
        boolean hasSync = !rs.wasNull();
        List<String> aliases = Jsons.fromJson(rs.getString("aliases_json"), STRING_LIST);
        return new PeerHost(
                rs.getString("host_id"),
                rs.getString("name"),
                rs.getString("url"),
                aliases,
                rs.getString("description"),
                rs.getInt("enabled") == 1,
                hasSync ? Instant.ofEpochMilli(syncedAt).toString() : null,
                rs.getString("sync_source"),
                null,
                null,
                null
        );
    }
}
