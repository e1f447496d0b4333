package io.amprelay.config;

import io.amprelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public record AmpSettings(
        String hostId,
        String hostName,
        String hostUrl,
        List<String> hostAliases,
        String hostDescription,
        String provider,
        String organization,
        int rateLimitPerWindow,
        long rateLimitWindowMs,
        long relayTtlMs,
        long deliveryTimeoutMs,
        long federationTimeoutMs,
        Map<String, String> federationTransports,
        String version
) {
    private static final Logger LOG = LoggerFactory.getLogger(AmpSettings.class);
    public static final String DEFAULT_PROVIDER = "aimaestro.local";
    public static final String DEFAULT_ORGANIZATION = "default";
    public static final String VERSION = "0.1.0";

    public AmpSettings {
        hostAliases = hostAliases == null ? List.of() : List.copyOf(hostAliases);
        federationTransports = federationTransports == null ? Map.of() : Map.copyOf(federationTransports);
    }

    public static AmpSettings defaults() {
        String host = localHostName();
        return new AmpSettings(
                host,
                host,
                "http://localhost:" + AmpRelayConfig.DEFAULT_HTTP_PORT,
                List.of(),
                "",
                DEFAULT_PROVIDER,
                DEFAULT_ORGANIZATION,
                AmpRelayConfig.RATE_LIMIT_PER_WINDOW,
                AmpRelayConfig.RATE_LIMIT_WINDOW_MS,
                AmpRelayConfig.RELAY_TTL_MS,
                AmpRelayConfig.DELIVERY_TIMEOUT_MS,
                AmpRelayConfig.FEDERATION_TIMEOUT_MS,
                Map.of(),
                VERSION
        );
    }

    public static AmpSettings load(AmpRelayConfig config) {
        AmpSettings defaults = defaults();
        Path file = config.settingsFile();
        if (!Files.exists(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read settings file: " + file, e);
        }
    }

    static AmpSettings fromFile(SettingsFile file, AmpSettings defaults) {
        if (file == null) {
            return defaults;
        }
        String hostId = sanitizeId(file.hostId(), defaults.hostId());
        Map<String, String> transports = new LinkedHashMap<>();
        if (file.federationTransports() != null) {
            file.federationTransports().forEach((provider, url) -> {
                if (provider == null || provider.isBlank() || url == null || url.isBlank()) {
                    LOG.warn("Ignoring incomplete federation transport entry provider={} url={}", provider, url);
                    return;
                }
                transports.put(provider.trim().toLowerCase(Locale.ROOT), stripTrailingSlash(url.trim()));
            });
        }
        List<String> aliases = new ArrayList<>();
        if (file.hostAliases() != null) {
            for (String alias : file.hostAliases()) {
                if (alias != null && !alias.isBlank()) {
                    aliases.add(alias.trim());
                }
            }
        }
        return new AmpSettings(
                hostId,
                sanitizeText(file.hostName(), hostId),
                stripTrailingSlash(sanitizeText(file.hostUrl(), defaults.hostUrl())),
                aliases,
                sanitizeText(file.hostDescription(), defaults.hostDescription()),
                sanitizeText(file.provider(), defaults.provider()).toLowerCase(Locale.ROOT),
                sanitizeText(file.organization(), defaults.organization()),
                sanitizeInt(file.rateLimitPerWindow(), defaults.rateLimitPerWindow(), 1),
                sanitizeLong(file.rateLimitWindowMs(), defaults.rateLimitWindowMs(), 1_000L),
                sanitizeLong(file.relayTtlMs(), defaults.relayTtlMs(), 60_000L),
                sanitizeLong(file.deliveryTimeoutMs(), defaults.deliveryTimeoutMs(), 100L),
                sanitizeLong(file.federationTimeoutMs(), defaults.federationTimeoutMs(), 100L),
                transports,
                defaults.version()
        );
    }

    public String federationTransportUrl(String provider) {
        if (provider == null) {
            return null;
        }
        return federationTransports.get(provider.toLowerCase(Locale.ROOT));
    }

    private static String localHostName() {
        try {
            return sanitizeId(InetAddress.getLocalHost().getHostName(), "localhost");
        } catch (IOException e) {
            return "localhost";
        }
    }

    private static String sanitizeId(String raw, String fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        int dot = value.indexOf('.');
        return dot > 0 ? value.substring(0, dot) : value;
    }

    private static String sanitizeText(String raw, String fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return raw.trim();
    }

    private static String stripTrailingSlash(String url) {
        String value = url;
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    record SettingsFile(
            String hostId,
            String hostName,
            String hostUrl,
            List<String> hostAliases,
            String hostDescription,
            String provider,
            String organization,
            Integer rateLimitPerWindow,
            Long rateLimitWindowMs,
            Long relayTtlMs,
            Long deliveryTimeoutMs,
            Long federationTimeoutMs,
            Map<String, String> federationTransports
    ) {
    }
}
