package warden.adapter.out.ratelimit;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.jboss.logging.Logger;

import warden.adapter.out.ratelimit.memory.InMemoryRateLimiter;
import warden.adapter.out.ratelimit.redis.RedisRateLimiter;
import warden.core.config.RateLimitConfig;
import warden.core.config.ResiliencyConfig;
import warden.core.config.StorageConfig;
import warden.core.port.out.Metrics;
import warden.core.port.out.RateLimiter;

/**
 * CDI producer for the rate limiter.
 *
 * <p>Uses Redis when the registry storage is Redis and a data source is
 * available, and falls back to the in-memory limiter otherwise.
 */
@ApplicationScoped
public class RateLimiterProviderLoader {

    private static final Logger LOG = Logger.getLogger(RateLimiterProviderLoader.class);

    private final RateLimitConfig config;
    private final StorageConfig storageConfig;
    private final ResiliencyConfig resiliencyConfig;
    private final Instance<ReactiveRedisDataSource> redisDataSource;
    private final Metrics metrics;
    private final Clock clock;

    @Inject
    public RateLimiterProviderLoader(
            RateLimitConfig config,
            StorageConfig storageConfig,
            ResiliencyConfig resiliencyConfig,
            Instance<ReactiveRedisDataSource> redisDataSource,
            Metrics metrics,
            Clock clock) {
        this.config = config;
        this.storageConfig = storageConfig;
        this.resiliencyConfig = resiliencyConfig;
        this.redisDataSource = redisDataSource;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Produces the rate limiter instance for CDI injection.
     *
     * @return the configured rate limiter
     */
    @Produces
    @ApplicationScoped
    public RateLimiter produceRateLimiter() {
        if (!config.enabled()) {
            LOG.info("Rate limiting is disabled");
            return new InMemoryRateLimiter(false, clock);
        }

        if ("redis".equalsIgnoreCase(storageConfig.registry()) && redisDataSource.isResolvable()) {
            LOG.infov(
                    "Using Redis rate limiter (login {0}/{1}, default {2}/{3})",
                    config.login().requests(), config.login().window(),
                    config.defaults().requests(), config.defaults().window());
            return new RedisRateLimiter(
                    redisDataSource.get(), true, resiliencyConfig.redis().operationTimeout(), metrics, clock);
        }

        LOG.warn("Using in-memory rate limiter; counters are per instance");
        return new InMemoryRateLimiter(true, clock);
    }
}
