package warden.adapter.out.ratelimit.redis;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.adapter.out.storage.redis.RedisTimeoutHelper;
import warden.core.model.ratelimit.RateLimitDecision;
import warden.core.model.ratelimit.RateLimitKey;
import warden.core.port.out.Metrics;
import warden.core.port.out.RateLimiter;

/**
 * Redis-based fixed-window rate limiter for multi-instance deployments.
 *
 * <p>Each window has its own key, so counters roll over by key name and the
 * key expiry only cleans up. Increment and expiry are applied atomically in a
 * Lua script.
 *
 * <p>Redis failures allow the request. The endpoints being limited fail
 * closed on their own store access, so an unreachable Redis cannot be used
 * to bypass credential checks.
 *
 * <p>Key format: {@code ratelimit:{client}:{endpoint_class}:{window_id}}
 */
public final class RedisRateLimiter implements RateLimiter {

    private static final Logger LOG = Logger.getLogger(RedisRateLimiter.class);

    /**
     * Lua script for an atomic fixed-window counter.
     *
     * <p>Arguments:
     * <ol>
     *   <li>KEYS[1] - the window key</li>
     *   <li>ARGV[1] - window duration in milliseconds (for TTL)</li>
     * </ol>
     *
     * <p>Returns array: [request_count, ttl_ms]
     */
    private static final String FIXED_WINDOW_SCRIPT =
            """
            local current = redis.call('INCR', KEYS[1])
            if current == 1 then
                redis.call('PEXPIRE', KEYS[1], ARGV[1])
            end
            return {current, redis.call('PTTL', KEYS[1])}
            """;

    private final ReactiveRedisDataSource redisDataSource;
    private final RedisTimeoutHelper timeoutHelper;
    private final Clock clock;
    private final boolean enabled;

    public RedisRateLimiter(
            ReactiveRedisDataSource redisDataSource, boolean enabled, Duration timeout, Metrics metrics, Clock clock) {
        this.redisDataSource = redisDataSource;
        this.enabled = enabled;
        this.clock = clock;
        this.timeoutHelper = new RedisTimeoutHelper(timeout, metrics, "RedisRateLimiter");
    }

    @Override
    public Uni<RateLimitDecision> checkAndIncrement(RateLimitKey key, long limit, Duration window) {
        if (!enabled) {
            return Uni.createFrom().item(RateLimitDecision.allow());
        }

        final var operation = executeScript(key.toCacheKey(), window)
                .map(result -> RateLimitDecision.fromCount(
                        result.get(0), limit, window.toSeconds(), key.windowEnd(window), clock.instant()));

        return timeoutHelper.withTimeoutFallback(operation, "checkAndIncrement", () -> {
            LOG.warnv("Redis rate limit check failed for {0}, allowing request", key.endpointClass());
            return RateLimitDecision.allow();
        });
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    private Uni<List<Long>> executeScript(String key, Duration window) {
        // EVAL script numkeys key [key...] arg [arg...]
        return redisDataSource
                .execute(
                        "EVAL",
                        FIXED_WINDOW_SCRIPT,
                        "1", // numkeys
                        key, // KEYS[1]
                        String.valueOf(window.toMillis()) // ARGV[1]
                        )
                .map(this::parseArrayResponse);
    }

    private List<Long> parseArrayResponse(io.vertx.mutiny.redis.client.Response response) {
        if (response == null) {
            throw new IllegalStateException("Null response from Redis");
        }

        // [request_count, ttl_ms]
        final var result = new ArrayList<Long>(2);
        for (var i = 0; i < response.size(); i++) {
            result.add(response.get(i).toLong());
        }
        return result;
    }
}
