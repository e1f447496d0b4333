package io.amprelay.federation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.amprelay.model.Envelope;
import io.amprelay.model.Payload;

/**
 * Body of {@code POST /federation/deliver}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FederationRequest(
        Envelope envelope,
        Payload payload,
        @JsonProperty("sender_public_key") String senderPublicKey
) {
}
