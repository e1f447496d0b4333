package io.amprelay.federation;

import io.amprelay.agent.AgentRecord;
import io.amprelay.model.AmpAddress;
import io.amprelay.model.AmpError;
import io.amprelay.model.Envelope;
import io.amprelay.model.ErrorKind;
import io.amprelay.model.Payload;
import io.amprelay.model.RouteOutcome;
import io.amprelay.model.TrustLevel;
import io.amprelay.observability.AuditLogger;
import io.amprelay.routing.RoutingEngine;
import io.amprelay.security.ContentTrust;
import io.amprelay.security.EnvelopeSigner;
import io.amprelay.storage.ReplayGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Entry point for messages arriving from foreign providers.
 *
 * <p>Gates run in a fixed order: provider header, rate limit, request shape,
 * replay, then signature. Content is trust-wrapped once, before the recipient
 * is resolved; the local delivery path never wraps again.
 */
public final class FederationGateway {
    private static final Logger LOG = LoggerFactory.getLogger(FederationGateway.class);
    static final Pattern MESSAGE_ID = Pattern.compile("^[A-Za-z0-9_:-][A-Za-z0-9._:-]{0,127}$");

    private final ProviderRateLimiter rateLimiter;
    private final ReplayGuard replayGuard;
    private final RoutingEngine routingEngine;
    private final AuditLogger auditLogger;

    public FederationGateway(
            ProviderRateLimiter rateLimiter,
            ReplayGuard replayGuard,
            RoutingEngine routingEngine,
            AuditLogger auditLogger
    ) {
        this.rateLimiter = rateLimiter;
        this.replayGuard = replayGuard;
        this.routingEngine = routingEngine;
        this.auditLogger = auditLogger;
    }

    public RouteOutcome receive(String providerIdentity, FederationRequest request) {
        Optional<RouteOutcome> refused = admit(providerIdentity);
        if (refused.isPresent()) {
            return refused.get();
        }
        return accept(providerIdentity, request);
    }

    /**
     * Header and rate-limit gates. Counts the request against the provider's
     * window whether or not its body turns out to be valid. Empty when the
     * request may proceed to {@link #accept}.
     */
    public Optional<RouteOutcome> admit(String providerIdentity) {
        if (providerIdentity == null || providerIdentity.isBlank()) {
            return Optional.of(RouteOutcome.rejected(AmpError.of(ErrorKind.MISSING_HEADER,
                    "Missing " + HttpFederationTransport.PROVIDER_HEADER + " header")));
        }
        String provider = providerIdentity.trim();
        ProviderRateLimiter.Decision decision = rateLimiter.tryAcquire(provider);
        if (!decision.allowed()) {
            LOG.warn("Rate limit exceeded for provider {}", provider);
            audit("federation.receive", provider, null, "rate_limited", Map.of("retry_after_s", decision.retryAfterSeconds()));
            return Optional.of(RouteOutcome.rateLimited("Too many requests from provider " + provider,
                    decision.retryAfterSeconds()));
        }
        return Optional.empty();
    }

    /**
     * Remaining gates and delivery for a request already admitted.
     */
    public RouteOutcome accept(String providerIdentity, FederationRequest request) {
        String provider = providerIdentity.trim();
        Optional<AmpError> invalid = validate(request);
        if (invalid.isPresent()) {
            return RouteOutcome.rejected(invalid.get());
        }
        Envelope envelope = request.envelope();
        Payload payload = request.payload();
        if (!replayGuard.checkAndRecord(envelope.id())) {
            audit("federation.receive", provider, envelope, "duplicate", Map.of());
            return RouteOutcome.rejected(AmpError.of(ErrorKind.DUPLICATE_MESSAGE,
                    "Message " + envelope.id() + " was already received"));
        }
        TrustLevel trust = EnvelopeSigner.trustLevel(envelope, payload, envelope.signature(), request.senderPublicKey());
        Optional<AmpAddress> from = AmpAddress.parse(envelope.from());
        Payload wrapped = ContentTrust.wrapPayload(
                payload,
                from.map(AmpAddress::name).orElse(envelope.from()),
                from.map(a -> a.organization() + "." + a.provider()).orElse(provider),
                trust
        );
        if (!wrapped.security().injectionFlags().isEmpty()) {
            LOG.warn("Message {} from {} flagged: {}", envelope.id(), envelope.from(), wrapped.security().injectionFlags());
        }

        String recipientName = AmpAddress.parse(envelope.to()).map(AmpAddress::name).orElse(envelope.to());
        Optional<AgentRecord> recipient = routingEngine.resolveRecipient(recipientName);
        if (recipient.isEmpty()) {
            audit("federation.receive", provider, envelope, "not_found", Map.of("trust", trust.wireName()));
            return RouteOutcome.rejected(AmpError.of(ErrorKind.NOT_FOUND, "Recipient not found"));
        }
        RouteOutcome outcome = routingEngine.deliverOrQueue(recipient.get(), envelope, wrapped, request.senderPublicKey(), trust);
        audit("federation.receive", provider, envelope, outcome.status().wireName(), Map.of(
                "trust", trust.wireName(),
                "injection_flags", wrapped.security().injectionFlags()));
        return outcome;
    }

    static Optional<AmpError> validate(FederationRequest request) {
        if (request == null || request.envelope() == null || request.payload() == null) {
            return Optional.of(AmpError.of(ErrorKind.INVALID_REQUEST, "Missing envelope or payload"));
        }
        Envelope envelope = request.envelope();
        if (isBlank(envelope.id()) || isBlank(envelope.from()) || isBlank(envelope.to())) {
            return Optional.of(AmpError.of(ErrorKind.INVALID_REQUEST, "Envelope requires id, from and to"));
        }
        if (!MESSAGE_ID.matcher(envelope.id()).matches()) {
            return Optional.of(AmpError.field(ErrorKind.INVALID_FIELD, "envelope.id",
                    "Message id must be 1-128 letters, digits, '.', '_', ':' or '-' and not start with '.'"));
        }
        if (request.payload().type() == null || request.payload().message() == null) {
            return Optional.of(AmpError.of(ErrorKind.INVALID_REQUEST, "Payload requires type and message"));
        }
        return Optional.empty();
    }

    private void audit(String action, String provider, Envelope envelope, String result, Map<String, Object> details) {
        auditLogger.log(AuditLogger.AuditEvent.of(
                action,
                provider,
                envelope == null ? null : envelope.to(),
                result,
                envelope == null ? null : envelope.id(),
                details
        ));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
