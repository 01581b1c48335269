package warden.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.adapter.out.storage.memory.InMemoryRefreshTokenRepository;
import warden.adapter.out.storage.memory.InMemoryTokenRevocationRepository;
import warden.core.model.auth.AccessTokenClaims;
import warden.core.model.auth.AuthErrorCode;
import warden.core.model.auth.AuthException;
import warden.core.model.common.SecurityEvent;
import warden.core.model.common.StoreUnavailableException;
import warden.core.port.out.TokenRevocationRepository;
import warden.core.service.common.StoreRetry;
import warden.mock.MutableClock;
import warden.mock.RecordingSecurityMonitoring;
import warden.mock.TestConfigs;

@DisplayName("TokenRevocationService")
class TokenRevocationServiceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private MutableClock clock;
    private InMemoryTokenRevocationRepository registry;
    private RecordingSecurityMonitoring monitoring;
    private StoreRetry storeRetry;
    private TokenRevocationService service;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-05-01T10:00:00Z");
        registry = new InMemoryTokenRevocationRepository(clock);
        monitoring = new RecordingSecurityMonitoring();
        storeRetry = new StoreRetry(2, Duration.ofMillis(1), Duration.ofMillis(5));
        service = new TokenRevocationService(
                registry, new InMemoryRefreshTokenRepository(), TestConfigs.token(), storeRetry, monitoring, clock);
    }

    private AccessTokenClaims claims(String subject, String jti) {
        final var now = clock.instant();
        return new AccessTokenClaims(subject, List.of(), List.of(), jti, now, now.plus(Duration.ofMinutes(30)));
    }

    @Nested
    @DisplayName("revokeToken()")
    class RevokeTokenTests {

        @Test
        @DisplayName("should blacklist the jti for the token's remaining lifetime")
        void shouldBlacklistForRemainingLifetime() {
            final var claims = claims("user-1", "jti-1");
            service.registerActive("user-1", "jti-1").await().atMost(TIMEOUT);
            clock.advance(Duration.ofMinutes(10));

            service.revokeToken(claims).await().atMost(TIMEOUT);

            assertTrue(service.isRevoked("jti-1").await().atMost(TIMEOUT));
            assertFalse(registry.activeJtis("user-1").await().atMost(TIMEOUT).contains("jti-1"));

            clock.advance(Duration.ofMinutes(20));
            assertFalse(service.isRevoked("jti-1").await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should not affect other tokens")
        void shouldNotAffectOtherTokens() {
            service.revokeToken(claims("user-1", "jti-1")).await().atMost(TIMEOUT);

            assertFalse(service.isRevoked("jti-2").await().atMost(TIMEOUT));
        }
    }

    @Nested
    @DisplayName("revokeAll()")
    class RevokeAllTests {

        @Test
        @DisplayName("should blacklist every active jti and clear the active set")
        void shouldBlacklistEveryActiveJti() {
            service.registerActive("user-1", "jti-1").await().atMost(TIMEOUT);
            service.registerActive("user-1", "jti-2").await().atMost(TIMEOUT);
            service.registerActive("user-2", "jti-3").await().atMost(TIMEOUT);

            final var result = service.revokeAll("user-1").await().atMost(TIMEOUT);

            assertEquals(2, result.revokedTokens());
            assertEquals(0, result.revokedSessions());
            assertTrue(service.isRevoked("jti-1").await().atMost(TIMEOUT));
            assertTrue(service.isRevoked("jti-2").await().atMost(TIMEOUT));
            assertFalse(service.isRevoked("jti-3").await().atMost(TIMEOUT));
            assertTrue(registry.activeJtis("user-1").await().atMost(TIMEOUT).isEmpty());

            final var events = monitoring.eventsOfType(SecurityEvent.SessionsRevoked.class);
            assertEquals(1, events.size());
            assertEquals("user-1", events.get(0).subjectId());
        }

        @Test
        @DisplayName("should leave tokens registered afterwards valid")
        void shouldLeaveLaterTokensValid() {
            service.registerActive("user-1", "jti-1").await().atMost(TIMEOUT);
            service.revokeAll("user-1").await().atMost(TIMEOUT);

            service.registerActive("user-1", "jti-2").await().atMost(TIMEOUT);

            assertFalse(service.isRevoked("jti-2").await().atMost(TIMEOUT));
            assertEquals(1, registry.activeJtis("user-1").await().atMost(TIMEOUT).size());
        }
    }

    @Nested
    @DisplayName("when the registry is unavailable")
    class UnavailableRegistryTests {

        @Test
        @DisplayName("isRevoked should fail closed after retrying")
        void isRevokedShouldFailClosed() {
            final var failing = mock(TokenRevocationRepository.class);
            when(failing.isBlacklisted(anyString()))
                    .thenReturn(Uni.createFrom().failure(new StoreUnavailableException("registry", "down")));
            service = new TokenRevocationService(
                    failing, new InMemoryRefreshTokenRepository(), TestConfigs.token(), storeRetry, monitoring, clock);

            final var error =
                    assertThrows(AuthException.class, () -> service.isRevoked("jti-1").await().atMost(TIMEOUT));

            assertEquals(AuthErrorCode.STORE_UNAVAILABLE, error.code());
            assertEquals(1, error.retryAfterSeconds());
            verify(failing, times(3)).isBlacklisted("jti-1");
        }

        @Test
        @DisplayName("isRevoked should succeed once a retry reaches the registry")
        void isRevokedShouldRecoverOnRetry() {
            final var flaky = mock(TokenRevocationRepository.class);
            when(flaky.isBlacklisted("jti-1"))
                    .thenReturn(Uni.createFrom().failure(new StoreUnavailableException("registry", "blip")))
                    .thenReturn(Uni.createFrom().item(true));
            service = new TokenRevocationService(
                    flaky, new InMemoryRefreshTokenRepository(), TestConfigs.token(), storeRetry, monitoring, clock);

            assertTrue(service.isRevoked("jti-1").await().atMost(TIMEOUT));
        }
    }
}
