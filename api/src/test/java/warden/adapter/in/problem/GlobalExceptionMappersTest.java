package warden.adapter.in.problem;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;

import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import warden.core.model.auth.AuthErrorCode;
import warden.core.model.auth.AuthException;
import warden.core.model.common.StoreUnavailableException;
import warden.core.model.ratelimit.RateLimitDecision;

@DisplayName("GlobalExceptionMappers")
class GlobalExceptionMappersTest {

    private final GlobalExceptionMappers mappers = new GlobalExceptionMappers();

    @Nested
    @DisplayName("AuthException")
    class AuthExceptionTests {

        @Test
        @DisplayName("should map invalid credentials to 401 without Retry-After")
        void shouldMapInvalidCredentials() {
            final var response = mappers.mapAuthException(new AuthException(AuthErrorCode.INVALID_CREDENTIALS));

            assertEquals(401, response.getStatus());
            assertEquals("application/problem+json", response.getMediaType().toString());
            assertNull(response.getHeaderString("Retry-After"));
            final var problem = assertInstanceOf(HttpProblem.class, response.getEntity());
            assertEquals("INVALID_CREDENTIALS", problem.getParameters().get(AuthProblem.CODE));
        }

        @Test
        @DisplayName("should map a lockout to 423 with Retry-After")
        void shouldMapLockout() {
            final var response = mappers.mapAuthException(
                    new AuthException(AuthErrorCode.ACCOUNT_LOCKED, Duration.ofMinutes(15)));

            assertEquals(423, response.getStatus());
            assertEquals("900", response.getHeaderString("Retry-After"));
            final var problem = (HttpProblem) response.getEntity();
            assertEquals(900L, problem.getParameters().get(AuthProblem.RETRY_AFTER));
            assertEquals("Locked", problem.getTitle());
        }

        @Test
        @DisplayName("should round a sub-second Retry-After up to one second")
        void shouldRoundRetryAfterUp() {
            final var response = mappers.mapAuthException(
                    new AuthException(AuthErrorCode.QUEUE_TIMEOUT, Duration.ofMillis(200)));

            assertEquals(503, response.getStatus());
            assertEquals("1", response.getHeaderString("Retry-After"));
        }

        @Test
        @DisplayName("should not leak the cause into the problem detail")
        void shouldNotLeakCause() {
            final var cause = new IllegalStateException("jdbc:postgresql://db.internal:5432");
            final var response = mappers.mapAuthException(
                    new AuthException(AuthErrorCode.STORE_UNAVAILABLE, Duration.ofSeconds(1), cause));

            final var problem = (HttpProblem) response.getEntity();
            assertFalse(problem.getDetail().contains("db.internal"));
        }
    }

    @Test
    @DisplayName("StoreUnavailableException should become a 503 with Retry-After")
    void storeUnavailableShouldBe503() {
        final var response = mappers.mapStoreUnavailable(new StoreUnavailableException("registry", "down"));

        assertEquals(503, response.getStatus());
        assertEquals("1", response.getHeaderString("Retry-After"));
        final var problem = (HttpProblem) response.getEntity();
        assertEquals("STORE_UNAVAILABLE", problem.getParameters().get(AuthProblem.CODE));
    }

    @Test
    @DisplayName("unexpected exceptions should become a generic 500")
    void unexpectedShouldBe500() {
        final var response = mappers.mapUnexpected(new IllegalStateException("secret internals"));

        assertEquals(500, response.getStatus());
        final var problem = (HttpProblem) response.getEntity();
        assertEquals("INTERNAL", problem.getParameters().get(AuthProblem.CODE));
        assertFalse(problem.getDetail().contains("secret internals"));
    }

    @Test
    @DisplayName("WebApplicationException should keep its own response")
    void webApplicationExceptionShouldPassThrough() {
        final var notFound = new NotFoundException();

        final Response response = mappers.mapUnexpected(notFound);

        assertSame(notFound.getResponse(), response);
        assertEquals(404, response.getStatus());
    }

    @ParameterizedTest
    @EnumSource(AuthErrorCode.class)
    @DisplayName("every error code should map to an error status")
    void everyCodeShouldHaveErrorStatus(AuthErrorCode code) {
        final var response = mappers.mapAuthException(new AuthException(code));

        assertTrue(response.getStatus() >= 400, code + " -> " + response.getStatus());
        assertEquals(AuthProblem.statusFor(code).getStatusCode(), response.getStatus());
    }

    @Test
    @DisplayName("tooManyRequests should carry the budget of the rejected decision")
    void tooManyRequestsShouldCarryBudget() {
        final var now = Instant.parse("2024-05-01T10:00:20Z");
        final var decision = RateLimitDecision.fromCount(6, 5, 60, Instant.parse("2024-05-01T10:01:00Z"), now);

        final var problem = AuthProblem.tooManyRequests(decision);

        assertEquals(429, problem.getStatus().getStatusCode());
        assertEquals(40L, problem.getParameters().get(AuthProblem.RETRY_AFTER));
        assertEquals(5L, problem.getParameters().get("limit"));
        assertEquals(60L, problem.getParameters().get("window"));
        assertEquals("RATE_LIMITED", problem.getParameters().get(AuthProblem.CODE));
    }
}
