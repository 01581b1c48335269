package warden.adapter.out.storage.redis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.core.model.common.StoreUnavailableException;
import warden.core.port.out.FailedLoginRepository.FailureState;
import warden.core.port.out.Metrics;

@DisplayName("RedisFailedLoginRepository")
class RedisFailedLoginRepositoryTest {

    private static final Duration WAIT = Duration.ofSeconds(5);
    private static final String KEY = "failed_login:alice@example.com";

    private ReactiveValueCommands<String, String> valueCommands;
    private ReactiveKeyCommands<String> keyCommands;
    private Metrics metrics;
    private RedisFailedLoginRepository repository;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        var redis = mock(ReactiveRedisDataSource.class);
        valueCommands = mock(ReactiveValueCommands.class);
        keyCommands = mock(ReactiveKeyCommands.class);
        metrics = mock(Metrics.class);
        when(redis.value(String.class, String.class)).thenReturn(valueCommands);
        when(redis.key(String.class)).thenReturn(keyCommands);
        repository = new RedisFailedLoginRepository(redis, Duration.ofMillis(200), metrics);
    }

    @Nested
    @DisplayName("get()")
    class GetTests {

        @Test
        @DisplayName("should read the counter and its remaining lifetime")
        void shouldReadCounterAndTtl() {
            when(valueCommands.get(KEY)).thenReturn(Uni.createFrom().item("3"));
            when(keyCommands.pttl(KEY)).thenReturn(Uni.createFrom().item(42_000L));

            var state = repository.get("alice@example.com").await().atMost(WAIT);

            assertEquals(3, state.count());
            assertEquals(Duration.ofSeconds(42), state.remaining());
        }

        @Test
        @DisplayName("should answer no failures for a missing counter")
        void shouldAnswerNoneWhenMissing() {
            when(valueCommands.get(KEY)).thenReturn(Uni.createFrom().nullItem());
            when(keyCommands.pttl(KEY)).thenReturn(Uni.createFrom().item(-2L));

            assertEquals(FailureState.none(), repository.get("alice@example.com").await().atMost(WAIT));
        }

        @Test
        @DisplayName("should report no remaining time for a counter without expiry")
        void shouldHandleCounterWithoutExpiry() {
            when(valueCommands.get(KEY)).thenReturn(Uni.createFrom().item("1"));
            when(keyCommands.pttl(KEY)).thenReturn(Uni.createFrom().item(-1L));

            assertEquals(Duration.ZERO, repository.get("alice@example.com").await().atMost(WAIT).remaining());
        }

        @Test
        @DisplayName("should fail with a store error when Redis fails")
        void shouldFailClosed() {
            when(valueCommands.get(KEY)).thenReturn(Uni.createFrom().failure(new IllegalStateException("down")));
            when(keyCommands.pttl(KEY)).thenReturn(Uni.createFrom().item(1L));

            assertThrows(
                    StoreUnavailableException.class,
                    () -> repository.get("alice@example.com").await().atMost(WAIT));
            verify(metrics).recordStoreFailure("RedisFailedLoginRepository", "get");
        }
    }

    @Nested
    @DisplayName("recordFailure() and clear()")
    class WriteTests {

        @Test
        @DisplayName("should INCR the counter and push its expiry to the lockout window")
        void shouldIncrementAndExpire() {
            when(valueCommands.incr(KEY)).thenReturn(Uni.createFrom().item(4L));
            when(keyCommands.expire(KEY, 900L)).thenReturn(Uni.createFrom().item(true));

            var count = repository.recordFailure("alice@example.com", Duration.ofMinutes(15))
                    .await()
                    .atMost(WAIT);

            assertEquals(4L, count);
            verify(keyCommands).expire(KEY, 900L);
        }

        @Test
        @DisplayName("should expire after at least one second for sub-second windows")
        void shouldClampExpiry() {
            when(valueCommands.incr(KEY)).thenReturn(Uni.createFrom().item(1L));
            when(keyCommands.expire(KEY, 1L)).thenReturn(Uni.createFrom().item(true));

            repository.recordFailure("alice@example.com", Duration.ofMillis(10)).await().atMost(WAIT);

            verify(keyCommands).expire(KEY, 1L);
        }

        @Test
        @DisplayName("should delete the counter on clear")
        void shouldDeleteOnClear() {
            when(keyCommands.del(KEY)).thenReturn(Uni.createFrom().item(1));

            repository.clear("alice@example.com").await().atMost(WAIT);

            verify(keyCommands).del(KEY);
        }
    }
}
