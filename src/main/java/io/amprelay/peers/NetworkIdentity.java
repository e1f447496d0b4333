package io.amprelay.peers;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.net.URI;
import java.util.Collections;
import java.util.Enumeration;
import java.util.Optional;

/**
 * Tailscale addresses live in the CGNAT range 100.64.0.0/10.
 */
final class NetworkIdentity {
    private NetworkIdentity() {
    }

    static boolean isTailscaleAddress(String host) {
        if (host == null) {
            return false;
        }
        String[] parts = host.split("\\.");
        if (parts.length != 4 || !"100".equals(parts[0])) {
            return false;
        }
        try {
            int second = Integer.parseInt(parts[1]);
            return second >= 64 && second <= 127;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    static boolean urlIsTailscale(String url) {
        try {
            return isTailscaleAddress(URI.create(url).getHost());
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    static Optional<String> localTailscaleAddress() {
        try {
            Enumeration<NetworkInterface> nics = NetworkInterface.getNetworkInterfaces();
            if (nics == null) {
                return Optional.empty();
            }
            for (NetworkInterface nic : Collections.list(nics)) {
                if (!nic.isUp() || nic.isLoopback()) {
                    continue;
                }
                for (InetAddress address : Collections.list(nic.getInetAddresses())) {
                    if (address instanceof Inet4Address && isTailscaleAddress(address.getHostAddress())) {
                        return Optional.of(address.getHostAddress());
                    }
                }
            }
        } catch (SocketException e) {
            return Optional.empty();
        }
        return Optional.empty();
    }
}
