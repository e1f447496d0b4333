package io.amprelay.security;

import io.amprelay.util.Hashing;
import io.amprelay.util.Ids;

import java.util.regex.Pattern;

public final class ApiKeys {
    public static final String LIVE_PREFIX = "amp_live_sk_";
    public static final String TEST_PREFIX = "amp_test_sk_";
    private static final Pattern FORMAT = Pattern.compile("^amp_(live|test)_sk_[0-9a-f]{64}$");

    private ApiKeys() {
    }

    public static String generate(boolean live) {
        return (live ? LIVE_PREFIX : TEST_PREFIX) + Ids.randomHex(32);
    }

    public static boolean isValidFormat(String key) {
        return key != null && FORMAT.matcher(key).matches();
    }

    public static String hash(String key) {
        return "sha256:" + Hashing.sha256Hex(key);
    }

    /**
     * Accepts {@code Bearer <key>} or a bare key. Returns {@code null} for
     * anything that is not a well-formed key.
     */
    public static String extractFromHeader(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        String value = header.trim();
        if (value.regionMatches(true, 0, "Bearer ", 0, 7)) {
            value = value.substring(7).trim();
        }
        return isValidFormat(value) ? value : null;
    }
}
