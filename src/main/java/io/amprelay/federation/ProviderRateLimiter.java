package io.amprelay.federation;

import io.amprelay.config.AmpRelayConfig;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

public final class ProviderRateLimiter {
    private final int limitPerWindow;
    private final long windowMs;
    private final Clock clock;
    private final ConcurrentMap<String, WindowCounter> counters;
    private final AtomicLong lastCleanupMs;

    public ProviderRateLimiter(Clock clock) {
        this(AmpRelayConfig.RATE_LIMIT_PER_WINDOW, AmpRelayConfig.RATE_LIMIT_WINDOW_MS, clock);
    }

    public ProviderRateLimiter(int limitPerWindow, long windowMs, Clock clock) {
        this.limitPerWindow = Math.max(1, limitPerWindow);
        this.windowMs = Math.max(1L, windowMs);
        this.clock = clock;
        this.counters = new ConcurrentHashMap<>();
        this.lastCleanupMs = new AtomicLong(clock.millis());
    }

    public Decision tryAcquire(String provider) {
        long nowMs = clock.millis();
        WindowCounter current = counters.compute(provider, (k, existing) -> {
            if (existing == null || nowMs >= existing.windowStartMs + windowMs) {
                return new WindowCounter(nowMs, 1);
            }
            return new WindowCounter(existing.windowStartMs, existing.count + 1);
        });
        cleanup(nowMs);
        if (current.count <= limitPerWindow) {
            return new Decision(true, limitPerWindow - current.count, 0L);
        }
        long remainingMs = current.windowStartMs + windowMs - nowMs;
        return new Decision(false, 0, Math.max(1L, (remainingMs + 999L) / 1000L));
    }

    public int trackedProviders() {
        return counters.size();
    }

    private void cleanup(long nowMs) {
        long prev = lastCleanupMs.get();
        if (nowMs - prev < windowMs) {
            return;
        }
        if (!lastCleanupMs.compareAndSet(prev, nowMs)) {
            return;
        }
        counters.entrySet().removeIf(e -> nowMs >= e.getValue().windowStartMs + windowMs);
    }

    public record Decision(boolean allowed, int remaining, long retryAfterSeconds) {
    }

    private static final class WindowCounter {
        private final long windowStartMs;
        private final int count;

        private WindowCounter(long windowStartMs, int count) {
            this.windowStartMs = windowStartMs;
            this.count = count;
        }
    }
}
