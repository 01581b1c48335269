package warden.adapter.out.ratelimit;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;

import jakarta.enterprise.inject.Instance;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import warden.adapter.out.ratelimit.memory.InMemoryRateLimiter;
import warden.adapter.out.ratelimit.redis.RedisRateLimiter;
import warden.core.config.RateLimitConfig;
import warden.core.config.ResiliencyConfig;
import warden.core.config.StorageConfig;
import warden.core.port.out.Metrics;
import warden.mock.TestConfigs;

@DisplayName("RateLimiterProviderLoader")
class RateLimiterProviderLoaderTest {

    private StorageConfig storageConfig;
    private ResiliencyConfig resiliencyConfig;
    private Instance<ReactiveRedisDataSource> redisDataSource;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        storageConfig = mock(StorageConfig.class);
        resiliencyConfig = mock(ResiliencyConfig.class);
        final var redisConfig = mock(ResiliencyConfig.RedisConfig.class);
        when(resiliencyConfig.redis()).thenReturn(redisConfig);
        when(redisConfig.operationTimeout()).thenReturn(Duration.ofSeconds(1));
        redisDataSource = mock(Instance.class);
    }

    private RateLimiterProviderLoader loader(RateLimitConfig config) {
        return new RateLimiterProviderLoader(
                config, storageConfig, resiliencyConfig, redisDataSource, mock(Metrics.class), Clock.systemUTC());
    }

    @Test
    @DisplayName("should produce a disabled limiter when rate limiting is off")
    void shouldProduceDisabledLimiter() {
        final var config = mock(RateLimitConfig.class);
        when(config.enabled()).thenReturn(false);

        final var limiter = loader(config).produceRateLimiter();

        assertInstanceOf(InMemoryRateLimiter.class, limiter);
        assertFalse(limiter.isEnabled());
    }

    @Test
    @DisplayName("should use Redis when registry storage is Redis and a data source exists")
    void shouldUseRedis() {
        when(storageConfig.registry()).thenReturn("redis");
        when(redisDataSource.isResolvable()).thenReturn(true);
        when(redisDataSource.get()).thenReturn(mock(ReactiveRedisDataSource.class));

        final var limiter = loader(TestConfigs.rateLimit(5, 100, Duration.ofSeconds(60))).produceRateLimiter();

        assertInstanceOf(RedisRateLimiter.class, limiter);
        assertTrue(limiter.isEnabled());
    }

    @Test
    @DisplayName("should fall back to the in-memory limiter without a Redis data source")
    void shouldFallBackToMemory() {
        when(storageConfig.registry()).thenReturn("redis");
        when(redisDataSource.isResolvable()).thenReturn(false);

        final var limiter = loader(TestConfigs.rateLimit(5, 100, Duration.ofSeconds(60))).produceRateLimiter();

        assertInstanceOf(InMemoryRateLimiter.class, limiter);
        assertTrue(limiter.isEnabled());
    }
}
