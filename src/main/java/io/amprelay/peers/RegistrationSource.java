package io.amprelay.peers;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Who started a registration and, for propagated ones, the broadcast id and
 * how many hops it has travelled.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RegistrationSource(
        String initiator,
        String timestamp,
        String propagationId,
        Integer propagationDepth
) {
    public int depth() {
        return propagationDepth == null ? 0 : propagationDepth;
    }
}
