package io.amprelay.peers;

import java.io.IOException;

public interface PeerClient {
    PeerRegistrationResponse register(String peerUrl, PeerRegistrationRequest request) throws IOException, InterruptedException;

    PeerExchangeResponse exchange(String peerUrl, PeerExchangeRequest request) throws IOException, InterruptedException;

    /**
     * Reachability check; never throws.
     */
    boolean probe(String peerUrl);
}
