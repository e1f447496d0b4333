package io.amprelay.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One message held for a recipient that had no active delivery channel.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RelayEntry(
        String id,
        Envelope envelope,
        Payload payload,
        @JsonProperty("sender_public_key") String senderPublicKey,
        @JsonProperty("recipient_key") String recipientKey,
        @JsonProperty("queued_at") String queuedAt,
        @JsonProperty("expires_at") String expiresAt,
        int attempts
) {
}
