package warden.adapter.out.ratelimit.redis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Duration;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.redis.client.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.core.model.ratelimit.EndpointClass;
import warden.core.model.ratelimit.RateLimitKey;
import warden.core.port.out.Metrics;
import warden.mock.MutableClock;

@DisplayName("RedisRateLimiter")
class RedisRateLimiterTest {

    private static final Duration WAIT = Duration.ofSeconds(5);
    private static final Duration WINDOW = Duration.ofSeconds(60);

    private MutableClock clock;
    private ReactiveRedisDataSource redis;
    private Metrics metrics;
    private RedisRateLimiter limiter;
    private RateLimitKey key;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-05-01T10:00:30Z");
        redis = mock(ReactiveRedisDataSource.class);
        metrics = mock(Metrics.class);
        limiter = new RedisRateLimiter(redis, true, Duration.ofMillis(200), metrics, clock);
        key = RateLimitKey.forWindow("0123456789abcdef", EndpointClass.LOGIN, WINDOW, clock.instant());
    }

    private static Response scriptResult(long count, long ttlMillis) {
        var countItem = mock(Response.class);
        when(countItem.toLong()).thenReturn(count);
        var ttlItem = mock(Response.class);
        when(ttlItem.toLong()).thenReturn(ttlMillis);
        var response = mock(Response.class);
        when(response.size()).thenReturn(2);
        when(response.get(0)).thenReturn(countItem);
        when(response.get(1)).thenReturn(ttlItem);
        return response;
    }

    private void givenScriptReturns(Uni<Response> result) {
        when(redis.execute(eq("EVAL"), anyString(), eq("1"), anyString(), anyString())).thenReturn(result);
    }

    @Nested
    @DisplayName("checkAndIncrement()")
    class CheckTests {

        @Test
        @DisplayName("should run the counter script against the window key with the window in milliseconds")
        void shouldEvalScriptWithKeySchema() {
            givenScriptReturns(Uni.createFrom().item(scriptResult(1, 60_000)));

            limiter.checkAndIncrement(key, 5, WINDOW).await().atMost(WAIT);

            assertEquals("ratelimit:0123456789abcdef:login:" + key.windowId(), key.toCacheKey());
            verify(redis)
                    .execute(
                            eq("EVAL"),
                            contains("INCR"),
                            eq("1"),
                            eq("ratelimit:0123456789abcdef:login:" + key.windowId()),
                            eq("60000"));
        }

        @Test
        @DisplayName("should allow while the count is within the limit")
        void shouldAllowWithinLimit() {
            givenScriptReturns(Uni.createFrom().item(scriptResult(3, 30_000)));

            var decision = limiter.checkAndIncrement(key, 5, WINDOW).await().atMost(WAIT);

            assertTrue(decision.allowed());
            assertEquals(2, decision.remaining());
            assertEquals(3, decision.requestCount());
        }

        @Test
        @DisplayName("should reject past the limit with the time left in the window")
        void shouldRejectPastLimit() {
            givenScriptReturns(Uni.createFrom().item(scriptResult(6, 30_000)));

            var decision = limiter.checkAndIncrement(key, 5, WINDOW).await().atMost(WAIT);

            assertFalse(decision.allowed());
            assertEquals(0, decision.remaining());
            assertEquals(30, decision.retryAfterSeconds());
        }

        @Test
        @DisplayName("should allow the request when Redis fails")
        void shouldFailOpen() {
            givenScriptReturns(Uni.createFrom().failure(new IllegalStateException("connection refused")));

            var decision = limiter.checkAndIncrement(key, 5, WINDOW).await().atMost(WAIT);

            assertTrue(decision.allowed());
            verify(metrics).recordStoreFailure("RedisRateLimiter", "checkAndIncrement");
        }

        @Test
        @DisplayName("should allow the request when Redis does not answer in time")
        void shouldFailOpenOnTimeout() {
            givenScriptReturns(Uni.createFrom().nothing());

            var decision = limiter.checkAndIncrement(key, 5, WINDOW).await().atMost(WAIT);

            assertTrue(decision.allowed());
            verify(metrics).recordStoreTimeout("RedisRateLimiter", "checkAndIncrement");
        }
    }

    @Test
    @DisplayName("should not touch Redis when disabled")
    void shouldSkipRedisWhenDisabled() {
        var disabled = new RedisRateLimiter(redis, false, Duration.ofMillis(200), metrics, clock);

        assertTrue(disabled.checkAndIncrement(key, 5, WINDOW).await().atMost(WAIT).allowed());
        assertFalse(disabled.isEnabled());
        verifyNoInteractions(redis);
    }
}
