package io.amprelay.routing;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.amprelay.model.Payload;
import io.amprelay.model.Priority;

public record RouteRequest(
        String to,
        String subject,
        Payload payload,
        Priority priority,
        @JsonProperty("in_reply_to") String inReplyTo
) {
}
