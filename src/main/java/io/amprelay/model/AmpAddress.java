package io.amprelay.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Parsed form of {@code name@organization[.scope].provider}.
 *
 * <p>The provider is always the final two dot-segments of the domain. Of the
 * leading segments the first is the organization and the remainder, when
 * present, is the scope.
 */
public record AmpAddress(String name, String organization, String scope, String provider) {

    public static Optional<AmpAddress> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String value = raw.trim();
        int at = value.indexOf('@');
        if (at <= 0 || at != value.lastIndexOf('@')) {
            return Optional.empty();
        }
        String name = value.substring(0, at);
        String domain = value.substring(at + 1);
        if (name.isBlank() || domain.isBlank() || containsWhitespace(name)) {
            return Optional.empty();
        }
        String[] parts = domain.split("\\.", -1);
        if (parts.length < 3) {
            return Optional.empty();
        }
        for (String part : parts) {
            if (part.isEmpty() || containsWhitespace(part)) {
                return Optional.empty();
            }
        }
        String provider = parts[parts.length - 2] + "." + parts[parts.length - 1];
        String organization = parts[0];
        String scope = null;
        if (parts.length > 3) {
            scope = String.join(".", Arrays.copyOfRange(parts, 1, parts.length - 2));
        }
        return Optional.of(new AmpAddress(name, organization, scope, provider));
    }

    public static boolean isValid(String raw) {
        return parse(raw).isPresent();
    }

    public boolean isLocalTo(String ownProvider) {
        String normalized = provider.toLowerCase(Locale.ROOT);
        if (normalized.endsWith(".local")) {
            return true;
        }
        return ownProvider != null && normalized.equals(ownProvider.trim().toLowerCase(Locale.ROOT));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name).append('@').append(organization);
        if (scope != null && !scope.isEmpty()) {
            sb.append('.').append(scope);
        }
        return sb.append('.').append(provider).toString();
    }

    private static boolean containsWhitespace(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (Character.isWhitespace(value.charAt(i))) {
                return true;
            }
        }
        return false;
    }
}
