package io.amprelay.routing;

import io.amprelay.agent.AgentRecord;
import io.amprelay.config.AmpSettings;
import io.amprelay.federation.FederationReceipt;
import io.amprelay.federation.FederationRequest;
import io.amprelay.federation.FederationTransport;
import io.amprelay.model.AmpAddress;
import io.amprelay.model.AmpError;
import io.amprelay.model.Envelope;
import io.amprelay.model.ErrorKind;
import io.amprelay.model.Payload;
import io.amprelay.model.RelayEntry;
import io.amprelay.model.RouteOutcome;
import io.amprelay.model.TrustLevel;
import io.amprelay.observability.AuditLogger;
import io.amprelay.security.AgentKeyStore;
import io.amprelay.security.EnvelopeSigner;
import io.amprelay.storage.RelayQueueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Decides for every outgoing message whether it is delivered locally, held in
 * the relay queue, forwarded to a foreign provider, or rejected.
 *
 * <p>Local delivery is bounded by a timeout; a delivery that fails or times
 * out is queued instead, so a message accepted here is never lost.
 */
public final class RoutingEngine {
    private static final Logger LOG = LoggerFactory.getLogger(RoutingEngine.class);
    static final long CANCEL_GRACE_MS = 1_000L;

    private final AmpSettings settings;
    private final RecipientResolverChain resolvers;
    private final RelayQueueStore relayQueue;
    private final LocalDelivery localDelivery;
    private final NotificationDispatcher notifications;
    private final Map<String, FederationTransport> transports;
    private final AgentKeyStore keyStore;
    private final AuditLogger auditLogger;
    private final ExecutorService deliveryExecutor;
    private final Clock clock;

    public RoutingEngine(
            AmpSettings settings,
            RecipientResolverChain resolvers,
            RelayQueueStore relayQueue,
            LocalDelivery localDelivery,
            NotificationDispatcher notifications,
            Map<String, FederationTransport> transports,
            AgentKeyStore keyStore,
            AuditLogger auditLogger,
            ExecutorService deliveryExecutor,
            Clock clock
    ) {
        this.settings = settings;
        this.resolvers = resolvers;
        this.relayQueue = relayQueue;
        this.localDelivery = localDelivery;
        this.notifications = notifications;
        this.transports = transports == null ? Map.of() : Map.copyOf(transports);
        this.keyStore = keyStore;
        this.auditLogger = auditLogger;
        this.deliveryExecutor = deliveryExecutor;
        this.clock = clock;
    }

    public RouteOutcome route(AgentRecord sender, RouteRequest request) {
        Optional<AmpError> invalid = validate(request);
        if (invalid.isPresent()) {
            return RouteOutcome.rejected(invalid.get());
        }
        Optional<AmpAddress> parsed = AmpAddress.parse(request.to());
        if (parsed.isEmpty()) {
            return RouteOutcome.rejected(AmpError.field(ErrorKind.INVALID_FIELD, "to",
                    "Invalid address '" + request.to() + "': expected name@organization.provider"));
        }
        AmpAddress to = parsed.get();
        AgentKeyStore.AgentKeys senderKeys = keyStore.loadOrCreate(sender.id());
        Envelope unsigned = Envelope.create(
                sender.address(settings.provider()),
                to.toString(),
                request.subject().trim(),
                request.priority(),
                request.inReplyTo(),
                clock
        );
        Envelope envelope = unsigned.withSignature(EnvelopeSigner.sign(unsigned, request.payload(), senderKeys.privateKey()));
        String senderPublicKey = senderKeys.publicKeyHex();

        if (to.isLocalTo(settings.provider())) {
            return routeLocal(to, envelope, request.payload(), senderPublicKey);
        }
        return routeFederated(to, envelope, request.payload(), senderPublicKey);
    }

    public Optional<AgentRecord> resolveRecipient(String identifier) {
        return resolvers.resolve(identifier);
    }

    /**
     * Delivers to a resolved local agent, or queues under the agent's stable
     * id when it is offline or the delivery attempt fails.
     */
    public RouteOutcome deliverOrQueue(AgentRecord recipient, Envelope envelope, Payload payload,
                                       String senderPublicKey, TrustLevel trust) {
        if (!recipient.online()) {
            return queue(recipient.id(), envelope, payload, senderPublicKey, trust, "recipient_offline");
        }
        AtomicBoolean started = new AtomicBoolean();
        CountDownLatch finished = new CountDownLatch(1);
        Future<?> attempt = deliveryExecutor.submit(() -> {
            started.set(true);
            try {
                localDelivery.deliver(recipient, envelope, payload, senderPublicKey);
                return null;
            } finally {
                finished.countDown();
            }
        });
        try {
            try {
                attempt.get(settings.deliveryTimeoutMs(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                attempt.cancel(true);
                // A running attempt sees the interrupt before it commits; wait for it to settle.
                if (started.get()) {
                    finished.await(CANCEL_GRACE_MS, TimeUnit.MILLISECONDS);
                }
                if (!localDelivery.isDelivered(recipient, envelope.id())) {
                    throw e;
                }
                LOG.info("Local delivery of {} to {} completed after its timeout", envelope.id(), recipient.name());
            }
        } catch (TimeoutException e) {
            LOG.warn("Local delivery of {} to {} timed out after {} ms; queueing",
                    envelope.id(), recipient.name(), settings.deliveryTimeoutMs());
            return queue(recipient.id(), envelope, payload, senderPublicKey, trust, "delivery_timeout");
        } catch (ExecutionException e) {
            LOG.warn("Local delivery of {} to {} failed; queueing", envelope.id(), recipient.name(), e.getCause());
            return queue(recipient.id(), envelope, payload, senderPublicKey, trust, "delivery_failed");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            attempt.cancel(true);
            return queue(recipient.id(), envelope, payload, senderPublicKey, trust, "delivery_interrupted");
        }
        String deliveredAt = Instant.now(clock).toString();
        notifications.dispatch(new DeliveryNotice(
                recipient.id(),
                recipient.name(),
                recipient.sessionName(),
                envelope.id(),
                envelope.from(),
                envelope.subject(),
                envelope.priority()
        ));
        audit("route.deliver", envelope, "delivered", Map.of("recipient_id", recipient.id(), "trust", trust.wireName()));
        return RouteOutcome.delivered(envelope.id(), "local", deliveredAt, trust);
    }

    private RouteOutcome routeLocal(AmpAddress to, Envelope envelope, Payload payload, String senderPublicKey) {
        Optional<AgentRecord> recipient = resolvers.resolve(to.name());
        if (recipient.isEmpty()) {
            return queue(to.name(), envelope, payload, senderPublicKey, TrustLevel.LOCAL, "recipient_unresolved");
        }
        return deliverOrQueue(recipient.get(), envelope, payload, senderPublicKey, TrustLevel.LOCAL);
    }

    private RouteOutcome routeFederated(AmpAddress to, Envelope envelope, Payload payload, String senderPublicKey) {
        String provider = to.provider().toLowerCase(Locale.ROOT);
        FederationTransport transport = transports.get(provider);
        if (transport == null) {
            audit("route.federate", envelope, "forbidden", Map.of("provider", provider));
            return RouteOutcome.rejected(AmpError.of(ErrorKind.FORBIDDEN,
                    "Federation to external provider " + to.provider() + " is not yet supported"));
        }
        try {
            FederationReceipt receipt = transport.send(new FederationRequest(envelope, payload, senderPublicKey));
            if (!receipt.accepted()) {
                LOG.warn("Provider {} refused message {}: {} {}", provider, envelope.id(), receipt.httpStatus(), receipt.error());
                audit("route.federate", envelope, "refused", Map.of(
                        "provider", provider,
                        "http_status", receipt.httpStatus(),
                        "error", receipt.error() == null ? "" : receipt.error()));
                return RouteOutcome.rejected(AmpError.of(ErrorKind.FORBIDDEN,
                        "Provider " + to.provider() + " refused the message"));
            }
            audit("route.federate", envelope, "forwarded", Map.of("provider", provider));
            return RouteOutcome.delivered(envelope.id(), "federated",
                    receipt.deliveredAt() == null ? Instant.now(clock).toString() : receipt.deliveredAt(), null);
        } catch (IOException e) {
            LOG.warn("Federation to {} failed for message {}", provider, envelope.id(), e);
            audit("route.federate", envelope, "failed", Map.of("provider", provider));
            return RouteOutcome.rejected(AmpError.of(ErrorKind.INTERNAL_ERROR, "Federation delivery failed"));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return RouteOutcome.rejected(AmpError.of(ErrorKind.INTERNAL_ERROR, "Federation delivery interrupted"));
        }
    }

    private RouteOutcome queue(String recipientKey, Envelope envelope, Payload payload, String senderPublicKey,
                               TrustLevel trust, String reason) {
        RelayEntry entry = relayQueue.enqueue(recipientKey, envelope, payload, senderPublicKey);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("recipient_key", recipientKey);
        details.put("reason", reason);
        audit("route.queue", envelope, "queued", details);
        LOG.debug("Queued {} for {} ({})", envelope.id(), recipientKey, reason);
        return RouteOutcome.queued(envelope.id(), entry == null ? Instant.now(clock).toString() : entry.queuedAt(), trust);
    }

    static Optional<AmpError> validate(RouteRequest request) {
        if (request == null) {
            return Optional.of(AmpError.of(ErrorKind.INVALID_REQUEST, "Request body is required"));
        }
        if (request.to() == null || request.to().isBlank()) {
            return Optional.of(AmpError.field(ErrorKind.MISSING_FIELD, "to", "Recipient address is required"));
        }
        if (request.subject() == null || request.subject().isBlank()) {
            return Optional.of(AmpError.field(ErrorKind.MISSING_FIELD, "subject", "Subject is required"));
        }
        if (request.payload() == null) {
            return Optional.of(AmpError.field(ErrorKind.MISSING_FIELD, "payload", "Payload is required"));
        }
        if (request.payload().type() == null) {
            return Optional.of(AmpError.field(ErrorKind.INVALID_FIELD, "payload.type", "Payload type is required"));
        }
        if (request.payload().message() == null) {
            return Optional.of(AmpError.field(ErrorKind.INVALID_FIELD, "payload.message", "Payload message is required"));
        }
        return Optional.empty();
    }

    private void audit(String action, Envelope envelope, String result, Map<String, Object> details) {
        auditLogger.log(AuditLogger.AuditEvent.of(action, envelope.from(), envelope.to(), result, envelope.id(), details));
    }
}
