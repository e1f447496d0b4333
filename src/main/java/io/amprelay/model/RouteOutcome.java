package io.amprelay.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of routing or receiving one message.
 *
 * <p>{@code method} is {@code local}, {@code relay} or {@code federated};
 * {@code error} is only set when the status is {@link RouteStatus#REJECTED}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RouteOutcome(
        String id,
        RouteStatus status,
        String method,
        @JsonProperty("delivered_at") String deliveredAt,
        @JsonProperty("queued_at") String queuedAt,
        TrustLevel trust,
        @JsonIgnore AmpError error,
        @JsonIgnore Long retryAfterSeconds
) {
    public static RouteOutcome delivered(String id, String method, String at, TrustLevel trust) {
        return new RouteOutcome(id, RouteStatus.DELIVERED, method, at, null, trust, null, null);
    }

    public static RouteOutcome queued(String id, String at, TrustLevel trust) {
        return new RouteOutcome(id, RouteStatus.QUEUED, "relay", null, at, trust, null, null);
    }

    public static RouteOutcome rejected(AmpError error) {
        return new RouteOutcome(null, RouteStatus.REJECTED, null, null, null, null, error, null);
    }

    public static RouteOutcome rateLimited(String message, long retryAfterSeconds) {
        return new RouteOutcome(null, RouteStatus.REJECTED, null, null, null, null,
                AmpError.of(ErrorKind.RATE_LIMITED, message), retryAfterSeconds);
    }

    @JsonIgnore
    public boolean isRejected() {
        return status == RouteStatus.REJECTED;
    }

    @JsonIgnore
    public ErrorKind errorKind() {
        return error == null ? null : error.error();
    }
}
