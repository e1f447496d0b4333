package io.amprelay.peers;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.amprelay.model.PeerHost;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PeerRegistrationResponse(
        boolean success,
        boolean registered,
        boolean alreadyKnown,
        PeerHost host,
        List<PeerHost> knownHosts,
        String error
) {
    public PeerRegistrationResponse {
        knownHosts = knownHosts == null ? List.of() : List.copyOf(knownHosts);
    }

    static PeerRegistrationResponse failure(PeerHost self, String error) {
        return new PeerRegistrationResponse(false, false, false, self, List.of(), error);
    }
}
