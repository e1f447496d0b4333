package io.amprelay.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Body of a message. {@code context} is carried through untouched;
 * {@code security} is filled in when the message is trust-wrapped.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Payload(
        PayloadType type,
        String message,
        JsonNode context,
        List<Attachment> attachments,
        SecurityMetadata security
) {
    public static Payload of(PayloadType type, String message) {
        return new Payload(type, message, null, null, null);
    }

    public Payload withMessage(String value, SecurityMetadata securityMetadata) {
        return new Payload(type, value, context, attachments, securityMetadata);
    }
}
