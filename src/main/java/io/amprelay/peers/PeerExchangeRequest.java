package io.amprelay.peers;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.amprelay.model.PeerHost;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PeerExchangeRequest(PeerHost fromHost, List<PeerHost> knownHosts, String propagationId) {
}
