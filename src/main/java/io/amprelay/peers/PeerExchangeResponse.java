package io.amprelay.peers;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Host ids sorted into what the exchange did with them.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PeerExchangeResponse(
        boolean success,
        List<String> newlyAdded,
        List<String> alreadyKnown,
        List<String> unreachable,
        String error
) {
    public PeerExchangeResponse {
        newlyAdded = newlyAdded == null ? List.of() : List.copyOf(newlyAdded);
        alreadyKnown = alreadyKnown == null ? List.of() : List.copyOf(alreadyKnown);
        unreachable = unreachable == null ? List.of() : List.copyOf(unreachable);
    }

    static PeerExchangeResponse empty() {
        return new PeerExchangeResponse(true, List.of(), List.of(), List.of(), null);
    }
}
