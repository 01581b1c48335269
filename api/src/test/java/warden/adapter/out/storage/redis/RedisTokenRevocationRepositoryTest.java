package warden.adapter.out.storage.redis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.Set;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.set.ReactiveSetCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.core.model.common.StoreUnavailableException;
import warden.core.port.out.Metrics;

@DisplayName("RedisTokenRevocationRepository")
class RedisTokenRevocationRepositoryTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private ReactiveValueCommands<String, String> valueCommands;
    private ReactiveSetCommands<String, String> setCommands;
    private ReactiveKeyCommands<String> keyCommands;
    private Metrics metrics;
    private RedisTokenRevocationRepository repository;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        var redis = mock(ReactiveRedisDataSource.class);
        valueCommands = mock(ReactiveValueCommands.class);
        setCommands = mock(ReactiveSetCommands.class);
        keyCommands = mock(ReactiveKeyCommands.class);
        metrics = mock(Metrics.class);
        when(redis.value(String.class, String.class)).thenReturn(valueCommands);
        when(redis.set(String.class, String.class)).thenReturn(setCommands);
        when(redis.key(String.class)).thenReturn(keyCommands);
        repository = new RedisTokenRevocationRepository(redis, Duration.ofMillis(200), metrics);
    }

    @Nested
    @DisplayName("ceilSeconds()")
    class CeilSecondsTests {

        @Test
        @DisplayName("should round a partial second up")
        void shouldRoundUp() {
            assertEquals(2, RedisTokenRevocationRepository.ceilSeconds(Duration.ofMillis(1001)));
            assertEquals(1, RedisTokenRevocationRepository.ceilSeconds(Duration.ofNanos(1)));
        }

        @Test
        @DisplayName("should keep whole seconds unchanged")
        void shouldKeepWholeSeconds() {
            assertEquals(900, RedisTokenRevocationRepository.ceilSeconds(Duration.ofMinutes(15)));
        }

        @Test
        @DisplayName("should answer zero for zero and negative durations")
        void shouldAnswerZeroForExpired() {
            assertEquals(0, RedisTokenRevocationRepository.ceilSeconds(Duration.ZERO));
            assertEquals(0, RedisTokenRevocationRepository.ceilSeconds(Duration.ofSeconds(-5)));
        }
    }

    @Nested
    @DisplayName("blacklist()")
    class BlacklistTests {

        @Test
        @DisplayName("should SETEX blacklist:{jti} for the remaining lifetime rounded up")
        void shouldSetWithRemainingLifetime() {
            when(valueCommands.setex("blacklist:jti-1", 61L, "1")).thenReturn(Uni.createFrom().voidItem());

            repository.blacklist("jti-1", Duration.ofMillis(60_500)).await().atMost(WAIT);

            verify(valueCommands).setex("blacklist:jti-1", 61L, "1");
        }

        @Test
        @DisplayName("should skip tokens that have already expired")
        void shouldSkipExpiredTokens() {
            repository.blacklist("jti-1", Duration.ZERO).await().atMost(WAIT);
            repository.blacklist("jti-2", Duration.ofSeconds(-1)).await().atMost(WAIT);

            verify(valueCommands, never()).setex(anyString(), anyLong(), anyString());
        }

        @Test
        @DisplayName("should fail with a store error when the write times out")
        void shouldFailOnTimeout() {
            when(valueCommands.setex("blacklist:jti-1", 60L, "1")).thenReturn(Uni.createFrom().nothing());

            assertThrows(
                    StoreUnavailableException.class,
                    () -> repository.blacklist("jti-1", Duration.ofSeconds(60)).await().atMost(WAIT));
            verify(metrics).recordStoreTimeout("RedisTokenRevocationRepository", "blacklist");
        }
    }

    @Nested
    @DisplayName("isBlacklisted()")
    class IsBlacklistedTests {

        @Test
        @DisplayName("should check for blacklist:{jti}")
        void shouldCheckKey() {
            when(keyCommands.exists("blacklist:jti-1")).thenReturn(Uni.createFrom().item(true));

            assertTrue(repository.isBlacklisted("jti-1").await().atMost(WAIT));
        }

        @Test
        @DisplayName("should never answer 'not blacklisted' when Redis fails")
        void shouldFailClosed() {
            when(keyCommands.exists("blacklist:jti-1"))
                    .thenReturn(Uni.createFrom().failure(new IllegalStateException("connection refused")));

            assertThrows(
                    StoreUnavailableException.class,
                    () -> repository.isBlacklisted("jti-1").await().atMost(WAIT));
            verify(metrics).recordStoreFailure("RedisTokenRevocationRepository", "isBlacklisted");
        }
    }

    @Nested
    @DisplayName("Active token set")
    class ActiveSetTests {

        @Test
        @DisplayName("should SADD the jti and then EXPIRE the set")
        void shouldAddThenExpire() {
            when(setCommands.sadd("active_tokens:user-1", "jti-1")).thenReturn(Uni.createFrom().item(1));
            when(keyCommands.expire("active_tokens:user-1", 1800L)).thenReturn(Uni.createFrom().item(true));

            repository.registerActive("user-1", "jti-1", Duration.ofMinutes(30)).await().atMost(WAIT);

            var order = inOrder(setCommands, keyCommands);
            order.verify(setCommands).sadd("active_tokens:user-1", "jti-1");
            order.verify(keyCommands).expire("active_tokens:user-1", 1800L);
        }

        @Test
        @DisplayName("should list, remove and clear under active_tokens:{subject}")
        void shouldUseSubjectKey() {
            when(setCommands.smembers("active_tokens:user-1")).thenReturn(Uni.createFrom().item(Set.of("a", "b")));
            when(setCommands.srem("active_tokens:user-1", "a")).thenReturn(Uni.createFrom().item(1));
            when(keyCommands.del("active_tokens:user-1")).thenReturn(Uni.createFrom().item(1));

            assertEquals(Set.of("a", "b"), repository.activeJtis("user-1").await().atMost(WAIT));
            repository.unregisterActive("user-1", "a").await().atMost(WAIT);
            repository.clearActive("user-1").await().atMost(WAIT);

            verify(setCommands).srem("active_tokens:user-1", "a");
            verify(keyCommands).del("active_tokens:user-1");
            verifyNoInteractions(metrics);
        }
    }
}
