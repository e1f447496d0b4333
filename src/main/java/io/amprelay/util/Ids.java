package io.amprelay.util;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.UUID;

public final class Ids {
    private static final SecureRandom RANDOM = new SecureRandom();
    private static final char[] BASE36 = "0123456789abcdefghijklmnopqrstuvwxyz".toCharArray();

    private Ids() {
    }

    /**
     * Message ids sort by creation time: {@code msg_<epochMillis>_<7 random base36 chars>}.
     */
    public static String newMessageId(Clock clock) {
        StringBuilder sb = new StringBuilder("msg_").append(clock.millis()).append('_');
        for (int i = 0; i < 7; i++) {
            sb.append(BASE36[RANDOM.nextInt(BASE36.length)]);
        }
        return sb.toString();
    }

    public static String newAgentId() {
        return UUID.randomUUID().toString();
    }

    public static String newPropagationId() {
        return "prop_" + UUID.randomUUID();
    }

    public static String randomHex(int bytes) {
        byte[] raw = new byte[bytes];
        RANDOM.nextBytes(raw);
        return Hashing.toHex(raw);
    }
}
