package io.amprelay.peers;

import io.amprelay.model.PeerHost;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory peer client: answers registrations with a fixed host list and
 * records every outbound call.
 */
final class RecordingPeerClient implements PeerClient {
    final List<Call<PeerRegistrationRequest>> registrations = new CopyOnWriteArrayList<>();
    final List<Call<PeerExchangeRequest>> exchanges = new CopyOnWriteArrayList<>();
    final Set<String> reachable = ConcurrentHashMap.newKeySet();
    final Set<String> failing = ConcurrentHashMap.newKeySet();
    final Map<String, List<PeerHost>> knownHostsByUrl = new ConcurrentHashMap<>();

    @Override
    public PeerRegistrationResponse register(String peerUrl, PeerRegistrationRequest request) throws IOException {
        registrations.add(new Call<>(peerUrl, request));
        if (failing.contains(peerUrl)) {
            throw new IOException("connection refused: " + peerUrl);
        }
        return new PeerRegistrationResponse(true, true, false, null, knownHostsByUrl.getOrDefault(peerUrl, List.of()), null);
    }

    @Override
    public PeerExchangeResponse exchange(String peerUrl, PeerExchangeRequest request) throws IOException {
        exchanges.add(new Call<>(peerUrl, request));
        if (failing.contains(peerUrl)) {
            throw new IOException("connection refused: " + peerUrl);
        }
        return PeerExchangeResponse.empty();
    }

    @Override
    public boolean probe(String peerUrl) {
        return reachable.contains(peerUrl);
    }

    record Call<T>(String url, T request) {
    }
}
