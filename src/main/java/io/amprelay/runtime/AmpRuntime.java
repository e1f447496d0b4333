package io.amprelay.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.amprelay.agent.AgentRecord;
import io.amprelay.config.AmpRelayConfig;
import io.amprelay.config.AmpSettings;
import io.amprelay.federation.FederationGateway;
import io.amprelay.federation.FederationRequest;
import io.amprelay.federation.FederationTransport;
import io.amprelay.federation.HttpFederationTransport;
import io.amprelay.federation.ProviderRateLimiter;
import io.amprelay.model.PeerHost;
import io.amprelay.model.RouteOutcome;
import io.amprelay.observability.AuditLogger;
import io.amprelay.peers.HttpPeerClient;
import io.amprelay.peers.PeerClient;
import io.amprelay.peers.PeerDirectory;
import io.amprelay.peers.PeerExchangeRequest;
import io.amprelay.peers.PeerExchangeResponse;
import io.amprelay.peers.PeerRegistrationRequest;
import io.amprelay.peers.PeerRegistrationResponse;
import io.amprelay.peers.PeerSync;
import io.amprelay.routing.DeliveryNotifier;
import io.amprelay.routing.InboxDelivery;
import io.amprelay.routing.LocalDelivery;
import io.amprelay.routing.LoggingDeliveryNotifier;
import io.amprelay.routing.NotificationDispatcher;
import io.amprelay.routing.RecipientResolverChain;
import io.amprelay.routing.RecipientResolvers;
import io.amprelay.routing.RouteRequest;
import io.amprelay.routing.RoutingEngine;
import io.amprelay.security.AgentKeyStore;
import io.amprelay.security.ApiKeys;
import io.amprelay.storage.AgentStore;
import io.amprelay.storage.ApiKeyStore;
import io.amprelay.storage.Database;
import io.amprelay.storage.PeerHostStore;
import io.amprelay.storage.PropagationLedger;
import io.amprelay.storage.RelayQueueStore;
import io.amprelay.storage.ReplayGuard;
import io.amprelay.util.Ids;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

public final class AmpRuntime implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(AmpRuntime.class);
    private static final Pattern AGENT_NAME = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9._-]{0,63}$");

    private final AmpRelayConfig config;
    private final AmpSettings settings;
    private final Clock clock;
    private final Database database;
    private final AgentStore agents;
    private final ApiKeyStore apiKeys;
    private final RelayQueueStore relayQueue;
    private final ReplayGuard replayGuard;
    private final PropagationLedger propagationLedger;
    private final PeerHostStore peerHosts;
    private final AgentKeyStore keyStore;
    private final AuditLogger auditLogger;
    private final InboxDelivery inbox;
    private final NotificationDispatcher notifications;
    private final ExecutorService deliveryExecutor;
    private final ExecutorService probeExecutor;
    private final RoutingEngine routingEngine;
    private final FederationGateway federationGateway;
    private final PeerDirectory peerDirectory;
    private final PeerSync peerSync;

    public AmpRuntime(AmpRelayConfig config) {
        this(config, Clock.systemUTC(), null, null, null, Map.of());
    }

    /**
     * Null collaborators fall back to the inbox-file delivery, the logging
     * notifier and the HTTP peer client. {@code extraTransports} are added on
     * top of the transports configured in the settings file.
     */
    public AmpRuntime(
            AmpRelayConfig config,
            Clock clock,
            LocalDelivery localDelivery,
            DeliveryNotifier notifier,
            PeerClient peerClient,
            Map<String, FederationTransport> extraTransports
    ) {
        this.config = config;
        this.clock = clock;
        this.settings = AmpSettings.load(config);
        this.database = new Database(config);
        this.agents = new AgentStore(database, clock);
        this.apiKeys = new ApiKeyStore(database, clock);
        this.relayQueue = new RelayQueueStore(database, clock, settings.relayTtlMs(), AmpRelayConfig.RELAY_SWEEP_INTERVAL_MS);
        this.replayGuard = new ReplayGuard(database, clock);
        this.propagationLedger = new PropagationLedger(database, clock);
        this.peerHosts = new PeerHostStore(database, clock);
        this.keyStore = new AgentKeyStore(config.keysRoot());
        this.auditLogger = new AuditLogger(
                config.auditFile(),
                settings.hostId(),
                loadOrCreateAuditSigningSecret(config.auditSigningKeyFile()),
                clock
        );
        this.inbox = new InboxDelivery(config.inboxRoot(), clock);
        this.notifications = new NotificationDispatcher(notifier == null ? new LoggingDeliveryNotifier() : notifier);
        this.deliveryExecutor = Executors.newCachedThreadPool(daemonThreads("amprelay-delivery-"));
        this.probeExecutor = Executors.newFixedThreadPool(4, daemonThreads("amprelay-probe-"));

        Duration federationTimeout = Duration.ofMillis(settings.federationTimeoutMs());
        Map<String, FederationTransport> transports = new LinkedHashMap<>();
        settings.federationTransports().forEach((provider, url) ->
                transports.put(provider, new HttpFederationTransport(url, settings.provider(), federationTimeout)));
        if (extraTransports != null) {
            transports.putAll(extraTransports);
        }
        this.routingEngine = new RoutingEngine(
                settings,
                new RecipientResolverChain(agents, RecipientResolvers.defaults()),
                relayQueue,
                localDelivery == null ? inbox : localDelivery,
                notifications,
                transports,
                keyStore,
                auditLogger,
                deliveryExecutor,
                clock
        );
        this.federationGateway = new FederationGateway(
                new ProviderRateLimiter(settings.rateLimitPerWindow(), settings.rateLimitWindowMs(), clock),
                replayGuard,
                routingEngine,
                auditLogger
        );
        PeerClient client = peerClient == null
                ? new HttpPeerClient(federationTimeout, Duration.ofMillis(AmpRelayConfig.PEER_PROBE_TIMEOUT_MS))
                : peerClient;
        this.peerDirectory = new PeerDirectory(settings, peerHosts, propagationLedger, client, probeExecutor, auditLogger, clock);
        this.peerSync = new PeerSync(peerDirectory, peerHosts, propagationLedger, client, clock);
    }

    public void init() {
        database.init();
        LOG.info("AMP relay {} ready: provider={} root={}", settings.hostId(), settings.provider(), config.rootDir());
    }

    public AmpRelayConfig config() {
        return config;
    }

    public AmpSettings settings() {
        return settings;
    }

    public AgentRegistration registerAgent(String name, String alias, String sessionName, boolean online) {
        if (name == null || !AGENT_NAME.matcher(name.trim()).matches()) {
            throw new IllegalArgumentException("Invalid agent name: " + name);
        }
        String cleanName = name.trim();
        if (agents.findByName(cleanName).isPresent()) {
            throw new IllegalArgumentException("Agent already exists: " + cleanName);
        }
        AgentRecord agent = agents.insert(new AgentRecord(
                Ids.newAgentId(),
                cleanName,
                blankToNull(alias),
                blankToNull(sessionName),
                settings.organization(),
                online,
                clock.millis()
        ));
        String address = agent.address(settings.provider());
        String apiKey = ApiKeys.generate(true);
        apiKeys.insert(ApiKeys.hash(apiKey), agent.id(), address);
        String publicKey = keyStore.loadOrCreate(agent.id()).publicKeyHex();
        auditLogger.log(AuditLogger.AuditEvent.of("agent.register", "cli", agent.id(), "ok", null,
                Map.of("address", address)));
        LOG.info("Registered agent {} as {}", agent.id(), address);
        return new AgentRegistration(agent, address, apiKey, publicKey);
    }

    /**
     * Revokes every key of the named agent and issues a new one.
     */
    public String rotateApiKey(String agentName, boolean live) {
        AgentRecord agent = requireAgent(agentName);
        int revoked = apiKeys.revokeAll(agent.id());
        String apiKey = ApiKeys.generate(live);
        apiKeys.insert(ApiKeys.hash(apiKey), agent.id(), agent.address(settings.provider()));
        auditLogger.log(AuditLogger.AuditEvent.of("agent.key.rotate", "cli", agent.id(), "ok", null,
                Map.of("revoked", revoked)));
        return apiKey;
    }

    public Optional<AgentRecord> authenticate(String authorizationHeader) {
        String key = ApiKeys.extractFromHeader(authorizationHeader);
        if (key == null) {
            return Optional.empty();
        }
        return apiKeys.findActive(ApiKeys.hash(key)).flatMap(row -> agents.get(row.agentId()));
    }

    public AgentRecord setOnline(String agentName, boolean online) {
        AgentRecord agent = requireAgent(agentName);
        agents.setOnline(agent.id(), online);
        return agents.get(agent.id()).orElseThrow();
    }

    public Optional<AgentRecord> findAgent(String name) {
        return agents.findByName(name);
    }

    public List<AgentRecord> listAgents() {
        return agents.list();
    }

    public RouteOutcome route(AgentRecord sender, RouteRequest request) {
        return routingEngine.route(sender, request);
    }

    public RouteOutcome federationDeliver(String providerHeader, FederationRequest request) {
        return federationGateway.receive(providerHeader, request);
    }

    public Optional<RouteOutcome> federationAdmit(String providerHeader) {
        return federationGateway.admit(providerHeader);
    }

    public RouteOutcome federationAccept(String providerHeader, FederationRequest request) {
        return federationGateway.accept(providerHeader, request);
    }

    public RelayQueueStore.PendingMessages pending(AgentRecord agent, int limit) {
        return relayQueue.pendingFor(agent.id(), agent.name(), limit);
    }

    public boolean acknowledge(AgentRecord agent, String messageId) {
        return relayQueue.acknowledgeFor(agent.id(), agent.name(), messageId);
    }

    public int acknowledgeBatch(AgentRecord agent, List<String> messageIds) {
        return relayQueue.acknowledgeBatchFor(agent.id(), agent.name(), messageIds);
    }

    public int expireRelay() {
        return relayQueue.expireAll();
    }

    public List<JsonNode> inbox(String agentName) {
        return inbox.read(requireAgent(agentName).id());
    }

    public PeerRegistrationResponse registerPeer(PeerRegistrationRequest request) {
        return peerDirectory.registerPeer(request);
    }

    public PeerExchangeResponse exchangePeers(PeerExchangeRequest request) {
        return peerDirectory.exchangePeers(request);
    }

    public PeerHost identity(String forwardedHost, String forwardedProto) {
        return peerDirectory.identity(forwardedHost, forwardedProto);
    }

    public List<PeerHost> listPeers() {
        return peerHosts.list();
    }

    public PeerSync.SyncResult addPeerWithSync(PeerHost host) {
        return peerSync.addHostWithSync(host);
    }

    public PeerSync.SyncAllResult syncPeers() {
        return peerSync.syncWithAllPeers();
    }

    public List<Database.SchemaMigrationRow> schemaMigrations() {
        return database.listSchemaMigrations();
    }

    public List<String> auditTail(int limit) {
        return auditLogger.tail(limit);
    }

    @Override
    public void close() {
        notifications.close();
        deliveryExecutor.shutdownNow();
        probeExecutor.shutdown();
        try {
            if (!probeExecutor.awaitTermination(2, TimeUnit.SECONDS)) {
                probeExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            probeExecutor.shutdownNow();
        }
    }

    private AgentRecord requireAgent(String agentName) {
        return agents.findByName(agentName == null ? "" : agentName.trim())
                .orElseThrow(() -> new IllegalArgumentException("Unknown agent: " + agentName));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static String loadOrCreateAuditSigningSecret(Path keyFile) {
        try {
            if (keyFile.getParent() != null) {
                Files.createDirectories(keyFile.getParent());
            }
            if (Files.exists(keyFile)) {
                String existing = Files.readString(keyFile, StandardCharsets.UTF_8).trim();
                if (!existing.isBlank()) {
                    return existing;
                }
            }
            byte[] random = new byte[32];
            new SecureRandom().nextBytes(random);
            String generated = Base64.getEncoder().encodeToString(random);
            Files.writeString(keyFile, generated, StandardCharsets.UTF_8);
            return generated;
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit signing secret: " + keyFile, e);
        }
    }

    public record AgentRegistration(AgentRecord agent, String address, String apiKey, String publicKey) {
    }
}
