package io.amprelay.peers;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.amprelay.model.PeerHost;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PeerRegistrationRequest(PeerHost host, RegistrationSource source) {
}
