package io.amprelay.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A host known to the peer directory. The same shape travels on the wire in
 * peer registration and exchange requests, where most fields are optional.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PeerHost(
        String id,
        String name,
        String url,
        List<String> aliases,
        String description,
        Boolean enabled,
        String syncedAt,
        String syncSource,
        String version,
        Boolean tailscale,
        @JsonProperty("isSelf") Boolean isSelf
) {
    public PeerHost {
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
    }

    public static PeerHost descriptor(String id, String name, String url, List<String> aliases, String description) {
        return new PeerHost(id, name, url, aliases, description, null, null, null, null, null, null);
    }

    public PeerHost synced(String at, String source) {
        return new PeerHost(id, name, url, aliases, description, true, at, source, null, null, null);
    }

    /**
     * Projection shared with other hosts: identity fields only.
     */
    public PeerHost identity() {
        return new PeerHost(id, name, url, aliases.isEmpty() ? null : aliases, description, null, null, null, version, null, null);
    }
}
