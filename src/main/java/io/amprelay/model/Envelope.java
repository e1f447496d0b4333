package io.amprelay.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.amprelay.util.Ids;

import java.time.Clock;
import java.time.Instant;

/**
 * Routing header of one message. Instances are immutable; the signature is
 * attached through {@link #withSignature(String)} after the envelope is built.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Envelope(
        String id,
        String from,
        String to,
        String subject,
        Priority priority,
        String timestamp,
        String signature,
        @JsonProperty("in_reply_to") String inReplyTo
) {
    public Envelope {
        priority = priority == null ? Priority.NORMAL : priority;
    }

    public static Envelope create(String from, String to, String subject, Priority priority, String inReplyTo) {
        return create(from, to, subject, priority, inReplyTo, Clock.systemUTC());
    }

    public static Envelope create(String from, String to, String subject, Priority priority, String inReplyTo, Clock clock) {
        return new Envelope(
                Ids.newMessageId(clock),
                from,
                to,
                subject,
                priority,
                Instant.now(clock).toString(),
                null,
                inReplyTo == null || inReplyTo.isBlank() ? null : inReplyTo.trim()
        );
    }

    public Envelope withSignature(String value) {
        return new Envelope(id, from, to, subject, priority, timestamp, value, inReplyTo);
    }

    public boolean signed() {
        return signature != null && !signature.isBlank();
    }
}
