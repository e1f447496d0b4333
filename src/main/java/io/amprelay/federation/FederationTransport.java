package io.amprelay.federation;

import java.io.IOException;

public interface FederationTransport {
    FederationReceipt send(FederationRequest request) throws IOException, InterruptedException;
}
