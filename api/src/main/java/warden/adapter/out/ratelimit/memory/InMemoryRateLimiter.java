package warden.adapter.out.ratelimit.memory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

import io.smallrye.mutiny.Uni;

import warden.core.model.ratelimit.RateLimitDecision;
import warden.core.model.ratelimit.RateLimitKey;
import warden.core.port.out.RateLimiter;

/**
 * In-memory fixed-window rate limiter for single-instance deployments.
 *
 * <p>Counters for windows older than the current one are discarded as new
 * windows are opened.
 */
public final class InMemoryRateLimiter implements RateLimiter {

    private final ConcurrentMap<String, WindowCounter> counters = new ConcurrentHashMap<>();
    private final boolean enabled;
    private final Clock clock;

    public InMemoryRateLimiter(boolean enabled, Clock clock) {
        this.enabled = enabled;
        this.clock = clock;
    }

    @Override
    public Uni<RateLimitDecision> checkAndIncrement(RateLimitKey key, long limit, Duration window) {
        if (!enabled) {
            return Uni.createFrom().item(RateLimitDecision.allow());
        }

        return Uni.createFrom().item(() -> {
            final var now = clock.instant();
            final var cacheKey = key.toCacheKey();
            var counter = counters.get(cacheKey);
            if (counter == null) {
                evictStaleWindows(key);
                counter = counters.computeIfAbsent(cacheKey, k -> new WindowCounter(key.windowId()));
            }
            final var count = counter.count().incrementAndGet();
            return RateLimitDecision.fromCount(count, limit, window.toSeconds(), key.windowEnd(window), now);
        });
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Number of live counters (for testing).
     */
    public int counterCount() {
        return counters.size();
    }

    private void evictStaleWindows(RateLimitKey current) {
        final var prefix = RateLimitKey.PREFIX + current.clientId() + ":" + current.endpointClass().key() + ":";
        counters.entrySet()
                .removeIf(entry -> entry.getKey().startsWith(prefix)
                        && entry.getValue().windowId() < current.windowId());
    }

    private record WindowCounter(long windowId, AtomicLong count) {

        WindowCounter(long windowId) {
            this(windowId, new AtomicLong());
        }
    }
}
