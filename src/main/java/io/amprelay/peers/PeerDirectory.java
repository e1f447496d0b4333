package io.amprelay.peers;

import io.amprelay.config.AmpRelayConfig;
import io.amprelay.config.AmpSettings;
import io.amprelay.model.PeerHost;
import io.amprelay.observability.AuditLogger;
import io.amprelay.storage.PeerHostStore;
import io.amprelay.storage.PropagationLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Inbound side of host-to-host discovery: peer registration, peer list
 * exchange and this host's own identity.
 *
 * <p>Propagated registrations are bounded twice: by a hop counter with a
 * fixed ceiling and by a ledger of propagation ids already processed.
 */
public final class PeerDirectory {
    private static final Logger LOG = LoggerFactory.getLogger(PeerDirectory.class);
    static final int MAX_DESCRIPTION_LENGTH = 500;

    private final AmpSettings settings;
    private final PeerHostStore hosts;
    private final PropagationLedger ledger;
    private final PeerClient client;
    private final ExecutorService probeExecutor;
    private final AuditLogger auditLogger;
    private final Clock clock;

    public PeerDirectory(
            AmpSettings settings,
            PeerHostStore hosts,
            PropagationLedger ledger,
            PeerClient client,
            ExecutorService probeExecutor,
            AuditLogger auditLogger,
            Clock clock
    ) {
        this.settings = settings;
        this.hosts = hosts;
        this.ledger = ledger;
        this.client = client;
        this.probeExecutor = probeExecutor;
        this.auditLogger = auditLogger;
        this.clock = clock;
    }

    public PeerRegistrationResponse registerPeer(PeerRegistrationRequest request) {
        PeerHost self = identity(null, null);
        PeerHost candidate = request == null ? null : request.host();
        if (candidate == null || isBlank(candidate.id()) || isBlank(candidate.name()) || isBlank(candidate.url())) {
            return PeerRegistrationResponse.failure(self, "Missing required fields: host.id, host.name, host.url");
        }
        RegistrationSource source = request.source();
        int depth = source == null ? 0 : source.depth();
        if (depth > AmpRelayConfig.MAX_PROPAGATION_DEPTH) {
            LOG.info("Rejecting registration of {}: propagation depth {} exceeds {}",
                    candidate.id(), depth, AmpRelayConfig.MAX_PROPAGATION_DEPTH);
            audit("peer.register", candidate, "depth_exceeded", Map.of("depth", depth));
            return PeerRegistrationResponse.failure(self,
                    "Propagation depth " + depth + " exceeds maximum of " + AmpRelayConfig.MAX_PROPAGATION_DEPTH);
        }
        String propagationId = source == null ? null : source.propagationId();
        if (!isBlank(propagationId) && !ledger.markIfNew(propagationId)) {
            LOG.debug("Propagation {} already processed, skipping {}", propagationId, candidate.id());
            return new PeerRegistrationResponse(true, false, true, self, List.of(), null);
        }
        if (isSelf(candidate)) {
            audit("peer.register", candidate, "self", Map.of());
            return PeerRegistrationResponse.failure(self, "Cannot register this host as its own peer");
        }
        Optional<PeerHost> existing = hosts.get(candidate.id()).or(() -> hosts.findByAnyIdentifier(candidate));
        if (existing.isPresent()) {
            LOG.info("Peer {} already known as {}", candidate.id(), existing.get().id());
            return new PeerRegistrationResponse(true, false, true, self, knownHostIdentities(candidate.id()), null);
        }
        String initiator = source == null || isBlank(source.initiator()) ? null : source.initiator().trim();
        String description = sanitizeDescription(candidate.description(),
                "Peer registered from " + (initiator == null ? "unknown" : initiator));
        PeerHost stored = PeerHost.descriptor(
                candidate.id().trim(),
                candidate.name().trim(),
                PeerHostStore.normalizeUrl(candidate.url()),
                candidate.aliases(),
                description
        ).synced(Instant.now(clock).toString(), initiator == null ? "peer-registration" : initiator);
        if (!hosts.add(stored)) {
            return new PeerRegistrationResponse(true, false, true, self, knownHostIdentities(candidate.id()), null);
        }
        LOG.info("Registered peer {} ({}) depth={}", stored.name(), stored.id(), depth);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("url", stored.url());
        details.put("depth", depth);
        details.put("sync_source", stored.syncSource());
        audit("peer.register", stored, "registered", details);
        return new PeerRegistrationResponse(true, true, false, self, knownHostIdentities(candidate.id()), null);
    }

    public PeerExchangeResponse exchangePeers(PeerExchangeRequest request) {
        if (request == null || request.fromHost() == null || isBlank(request.fromHost().id()) || request.knownHosts() == null) {
            return new PeerExchangeResponse(false, List.of(), List.of(), List.of(),
                    "Missing required fields: fromHost, knownHosts");
        }
        String propagationId = request.propagationId();
        if (!isBlank(propagationId) && !ledger.markIfNew(propagationId)) {
            return PeerExchangeResponse.empty();
        }
        PeerHost from = request.fromHost();
        Map<String, PeerHost> unique = new LinkedHashMap<>();
        for (PeerHost host : request.knownHosts()) {
            if (host != null && !isBlank(host.id()) && !isBlank(host.url())) {
                unique.putIfAbsent(host.id().trim(), host);
            }
        }
        List<String> alreadyKnown = new ArrayList<>();
        List<PeerHost> candidates = new ArrayList<>();
        List<PeerHost> known = hosts.list();
        for (PeerHost host : unique.values()) {
            if (isSelf(host) || host.id().equalsIgnoreCase(from.id())) {
                continue;
            }
            String url = PeerHostStore.normalizeUrl(host.url());
            boolean sameUrl = known.stream().anyMatch(k -> PeerHostStore.normalizeUrl(k.url()).equals(url));
            if (hosts.get(host.id()).isPresent() || sameUrl) {
                alreadyKnown.add(host.id());
                continue;
            }
            candidates.add(host);
        }

        Map<String, CompletableFuture<Boolean>> probes = new LinkedHashMap<>();
        for (PeerHost host : candidates) {
            probes.put(host.id(), CompletableFuture.supplyAsync(() -> client.probe(host.url()), probeExecutor)
                    .exceptionally(e -> false));
        }
        List<String> newlyAdded = new ArrayList<>();
        List<String> unreachable = new ArrayList<>();
        String fromName = isBlank(from.name()) ? from.id() : from.name();
        for (PeerHost host : candidates) {
            if (!probes.get(host.id()).join()) {
                LOG.info("Peer {} ({}) is unreachable, skipping", host.id(), host.url());
                unreachable.add(host.id());
                continue;
            }
            PeerHost stored = PeerHost.descriptor(
                    host.id().trim(),
                    isBlank(host.name()) ? host.id().trim() : host.name().trim(),
                    PeerHostStore.normalizeUrl(host.url()),
                    host.aliases(),
                    sanitizeDescription(host.description(), "Discovered via peer exchange from " + fromName)
            ).synced(Instant.now(clock).toString(), "peer-exchange:" + from.id());
            if (hosts.add(stored)) {
                newlyAdded.add(stored.id());
            } else {
                alreadyKnown.add(stored.id());
            }
        }
        LOG.info("Peer exchange from {}: +{} new, {} known, {} unreachable",
                fromName, newlyAdded.size(), alreadyKnown.size(), unreachable.size());
        if (!newlyAdded.isEmpty()) {
            audit("peer.exchange", from, "merged", Map.of("newly_added", newlyAdded));
        }
        return new PeerExchangeResponse(true, newlyAdded, alreadyKnown, unreachable, null);
    }

    /**
     * This host as seen by peers. Forwarded host and protocol headers, when
     * present, replace the configured url.
     */
    public PeerHost identity(String forwardedHost, String forwardedProto) {
        String url = settings.hostUrl();
        if (!isBlank(forwardedHost)) {
            String proto = isBlank(forwardedProto) ? "http" : forwardedProto.split(",")[0].trim();
            url = proto + "://" + forwardedHost.split(",")[0].trim();
        }
        boolean tailscale = NetworkIdentity.urlIsTailscale(url) || NetworkIdentity.localTailscaleAddress().isPresent();
        return new PeerHost(
                settings.hostId(),
                settings.hostName(),
                url,
                settings.hostAliases(),
                settings.hostDescription(),
                null,
                null,
                null,
                settings.version(),
                tailscale,
                true
        );
    }

    public List<PeerHost> knownHostIdentities(String excludeId) {
        List<PeerHost> out = new ArrayList<>();
        for (PeerHost host : hosts.list()) {
            if (Boolean.FALSE.equals(host.enabled())) {
                continue;
            }
            if (excludeId != null && host.id().equalsIgnoreCase(excludeId.trim())) {
                continue;
            }
            out.add(host.identity());
        }
        return out;
    }

    public boolean isSelf(PeerHost host) {
        if (host == null) {
            return false;
        }
        if (matchesSelf(host.id())) {
            return true;
        }
        for (String alias : host.aliases()) {
            if (matchesSelf(alias)) {
                return true;
            }
        }
        return !isBlank(host.url())
                && PeerHostStore.normalizeUrl(host.url()).equals(PeerHostStore.normalizeUrl(settings.hostUrl()));
    }

    private boolean matchesSelf(String identifier) {
        if (isBlank(identifier)) {
            return false;
        }
        String value = identifier.trim().toLowerCase(Locale.ROOT);
        if (value.equals(settings.hostId().toLowerCase(Locale.ROOT))) {
            return true;
        }
        for (String alias : settings.hostAliases()) {
            if (value.equals(alias.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    static String sanitizeDescription(String raw, String fallback) {
        String value = isBlank(raw) ? fallback : raw;
        String cleaned = value.replaceAll("[\\x00-\\x1F\\x7F]", "");
        return cleaned.length() > MAX_DESCRIPTION_LENGTH ? cleaned.substring(0, MAX_DESCRIPTION_LENGTH) : cleaned;
    }

    private void audit(String action, PeerHost host, String result, Map<String, Object> details) {
        auditLogger.log(AuditLogger.AuditEvent.of(action, host.id(), "hosts/" + host.id(), result, null, details));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
