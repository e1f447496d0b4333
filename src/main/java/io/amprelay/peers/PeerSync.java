package io.amprelay.peers;

import io.amprelay.config.AmpRelayConfig;
import io.amprelay.model.PeerHost;
import io.amprelay.storage.PeerHostStore;
import io.amprelay.storage.PropagationLedger;
import io.amprelay.util.Ids;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

public final class PeerSync {
    private static final Logger LOG = LoggerFactory.getLogger(PeerSync.class);

    private final PeerDirectory directory;
    private final PeerHostStore hosts;
    private final PropagationLedger ledger;
    private final PeerClient client;
    private final Clock clock;

    public PeerSync(PeerDirectory directory, PeerHostStore hosts, PropagationLedger ledger, PeerClient client, Clock clock) {
        this.directory = directory;
        this.hosts = hosts;
        this.ledger = ledger;
        this.client = client;
        this.clock = clock;
    }

    public SyncResult addHostWithSync(PeerHost host) {
        List<String> errors = new ArrayList<>();
        if (host == null || host.id() == null || host.id().isBlank() || host.url() == null || host.url().isBlank()) {
            return new SyncResult(false, false, false, 0, 0, List.of("Host id and url are required"));
        }
        if (directory.isSelf(host)) {
            return new SyncResult(false, false, false, 0, 0, List.of("Cannot add this host as its own peer"));
        }
        PeerHost self = directory.identity(null, null);
        String url = PeerHostStore.normalizeUrl(host.url());
        PeerHost stored = PeerHost.descriptor(
                host.id().trim(),
                host.name() == null || host.name().isBlank() ? host.id().trim() : host.name().trim(),
                url,
                host.aliases(),
                PeerDirectory.sanitizeDescription(host.description(), "Added manually")
        ).synced(Instant.now(clock).toString(), "manual");
        boolean localAdd = hosts.add(stored);

        boolean backRegistered = false;
        int peersExchanged = 0;
        try {
            PeerRegistrationResponse registration = client.register(url, new PeerRegistrationRequest(
                    self.identity(),
                    new RegistrationSource(self.id(), Instant.now(clock).toString(), null, null)));
            backRegistered = registration.success();
            if (!registration.success()) {
                errors.add("Back-registration failed: " + registration.error());
            } else {
                peersExchanged = learnPeers(registration.knownHosts(), stored.id(), errors);
                shareKnownHosts(url, self, stored.id());
            }
        } catch (IOException e) {
            errors.add("Back-registration error: " + e.getMessage());
            LOG.warn("Back-registration with {} failed", url, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            errors.add("Back-registration interrupted");
        }

        int peersShared = 0;
        if (localAdd) {
            String propagationId = Ids.newPropagationId();
            ledger.markIfNew(propagationId);
            peersShared = propagate(stored, propagationId, 1, Set.of(stored.id()));
        }
        return new SyncResult(true, localAdd, backRegistered, peersExchanged, peersShared, errors);
    }

    /**
     * Registers {@code newHost} with every known enabled peer except those
     * in {@code excludeIds}. Returns how many peers newly registered it.
     */
    public int propagate(PeerHost newHost, String propagationId, int depth, Set<String> excludeIds) {
        if (depth > AmpRelayConfig.MAX_PROPAGATION_DEPTH) {
            return 0;
        }
        PeerHost self = directory.identity(null, null);
        PeerRegistrationRequest request = new PeerRegistrationRequest(
                PeerHost.descriptor(newHost.id(), newHost.name(), newHost.url(), newHost.aliases(), newHost.description()),
                new RegistrationSource(self.id(), Instant.now(clock).toString(), propagationId, depth));
        int shared = 0;
        for (PeerHost peer : hosts.list()) {
            if (Boolean.FALSE.equals(peer.enabled()) || excludeIds.contains(peer.id()) || peer.id().equals(newHost.id())) {
                continue;
            }
            try {
                PeerRegistrationResponse response = client.register(peer.url(), request);
                if (response.registered()) {
                    shared++;
                }
            } catch (IOException e) {
                LOG.warn("Failed to propagate {} to {}: {}", newHost.id(), peer.id(), e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        LOG.info("Propagated {} to {} peer(s) at depth {}", newHost.id(), shared, depth);
        return shared;
    }

    public SyncAllResult syncWithAllPeers() {
        PeerHost self = directory.identity(null, null);
        List<String> synced = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (PeerHost peer : hosts.list()) {
            if (Boolean.FALSE.equals(peer.enabled())) {
                continue;
            }
            try {
                PeerRegistrationResponse response = client.register(peer.url(), new PeerRegistrationRequest(
                        self.identity(),
                        new RegistrationSource(self.id(), Instant.now(clock).toString(), null, null)));
                if (!response.success()) {
                    failed.add(peer.id());
                    continue;
                }
                synced.add(peer.id());
                if (!response.knownHosts().isEmpty()) {
                    learnPeers(response.knownHosts(), peer.id(), new ArrayList<>());
                }
            } catch (IOException e) {
                LOG.warn("Sync with {} failed: {}", peer.id(), e.getMessage());
                failed.add(peer.id());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                failed.add(peer.id());
                break;
            }
        }
        return new SyncAllResult(synced, failed);
    }

    private int learnPeers(List<PeerHost> remoteHosts, String viaHostId, List<String> errors) {
        int added = 0;
        for (PeerHost remote : remoteHosts) {
            if (remote == null || remote.id() == null || remote.url() == null || directory.isSelf(remote)) {
                continue;
            }
            if (hosts.get(remote.id()).isPresent()) {
                continue;
            }
            if (!client.probe(remote.url())) {
                LOG.info("Peer {} is unreachable, skipping", remote.id());
                continue;
            }
            boolean stored = hosts.add(PeerHost.descriptor(
                    remote.id(),
                    remote.name() == null ? remote.id() : remote.name(),
                    PeerHostStore.normalizeUrl(remote.url()),
                    remote.aliases(),
                    PeerDirectory.sanitizeDescription(remote.description(), "Discovered via peer exchange")
            ).synced(Instant.now(clock).toString(), "peer-exchange:" + viaHostId));
            if (stored) {
                added++;
            } else {
                errors.add("Failed to add " + remote.id());
            }
        }
        return added;
    }

    private void shareKnownHosts(String peerUrl, PeerHost self, String peerId) {
        List<PeerHost> ours = directory.knownHostIdentities(peerId);
        if (ours.isEmpty()) {
            return;
        }
        try {
            client.exchange(peerUrl, new PeerExchangeRequest(self.identity(), ours, null));
        } catch (IOException e) {
            LOG.warn("Failed to share peers with {}: {}", peerUrl, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public record SyncResult(
            boolean success,
            boolean localAdd,
            boolean backRegistered,
            int peersExchanged,
            int peersShared,
            List<String> errors
    ) {
        public SyncResult {
            errors = errors == null ? List.of() : List.copyOf(errors);
        }
    }

    public record SyncAllResult(List<String> synced, List<String> failed) {
        public SyncAllResult {
            synced = List.copyOf(synced);
            failed = List.copyOf(failed);
        }
    }
}
