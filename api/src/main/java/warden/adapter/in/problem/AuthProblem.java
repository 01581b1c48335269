package warden.adapter.in.problem;

import java.util.List;

import jakarta.ws.rs.core.Response.Status;
import jakarta.ws.rs.core.Response.Status.Family;
import jakarta.ws.rs.core.Response.StatusType;

import io.quarkiverse.resteasy.problem.HttpProblem;

import warden.core.model.auth.AuthErrorCode;
import warden.core.model.auth.AuthException;
import warden.core.model.ratelimit.RateLimitDecision;

/**
 * Factory for RFC 7807 Problem Details responses.
 *
 * <p>Every problem carries a stable {@code code} extension so that clients can
 * branch on the failure without parsing the detail text.
 */
public final class AuthProblem {

    public static final String CODE = "code";
    public static final String RETRY_AFTER = "retryAfter";
    public static final String VIOLATIONS = "violations";
    public static final String INVALID_REQUEST = "INVALID_REQUEST";

    /** 423 Locked (RFC 4918), absent from {@link Status}. */
    static final StatusType LOCKED = new StatusType() {
        @Override
        public int getStatusCode() {
            return 423;
        }

        @Override
        public Family getFamily() {
            return Family.CLIENT_ERROR;
        }

        @Override
        public String getReasonPhrase() {
            return "Locked";
        }
    };

    private AuthProblem() {}

    /**
     * Build the problem for a typed authentication failure.
     *
     * @param e the failure
     * @return problem with status, title and code set from the error code
     */
    public static HttpProblem from(AuthException e) {
        final var code = e.code();
        final var builder = HttpProblem.builder()
                .withTitle(titleFor(code))
                .withStatus(statusFor(code))
                .withDetail(code.message())
                .with(CODE, code.name());
        if (e.retryAfter().isPresent()) {
            builder.with(RETRY_AFTER, e.retryAfterSeconds());
        }
        return builder.build();
    }

    // ========== Rate Limiting ==========

    /**
     * Create a 429 Too Many Requests problem from a rejected decision.
     *
     * @param decision the rejected decision
     * @return rate limit problem
     */
    public static HttpProblem tooManyRequests(RateLimitDecision decision) {
        return HttpProblem.builder()
                .withTitle("Too Many Requests")
                .withStatus(Status.TOO_MANY_REQUESTS)
                .withDetail("Rate limit exceeded. Retry after %d seconds.".formatted(decision.retryAfterSeconds()))
                .with(CODE, AuthErrorCode.RATE_LIMITED.name())
                .with(RETRY_AFTER, decision.retryAfterSeconds())
                .with("limit", decision.limit())
                .with("window", decision.windowSeconds())
                .build();
    }

    // ========== Request Errors ==========

    /**
     * 400 for a request body that failed bean validation.
     *
     * @param violations one {@code field: message} entry per violated constraint
     */
    public static HttpProblem invalidRequest(List<String> violations) {
        return HttpProblem.builder()
                .withTitle("Bad Request")
                .withStatus(Status.BAD_REQUEST)
                .withDetail("Request validation failed")
                .with(CODE, INVALID_REQUEST)
                .with(VIOLATIONS, violations)
                .build();
    }

    public static HttpProblem unauthorized(String detail) {
        return HttpProblem.builder()
                .withTitle("Unauthorized")
                .withStatus(Status.UNAUTHORIZED)
                .withDetail(detail)
                .with(CODE, AuthErrorCode.MALFORMED.name())
                .build();
    }

    // ========== Server Errors ==========

    public static HttpProblem internalError() {
        return HttpProblem.builder()
                .withTitle("Internal Server Error")
                .withStatus(Status.INTERNAL_SERVER_ERROR)
                .withDetail(AuthErrorCode.INTERNAL.message())
                .with(CODE, AuthErrorCode.INTERNAL.name())
                .build();
    }

    static StatusType statusFor(AuthErrorCode code) {
        return switch (code) {
            case INVALID_CREDENTIALS,
                    TOKEN_EXPIRED,
                    TOKEN_REVOKED,
                    TOKEN_NOT_FOUND,
                    INVALID_SIGNATURE,
                    MALFORMED -> Status.UNAUTHORIZED;
            case ACCOUNT_DISABLED -> Status.FORBIDDEN;
            case ACCOUNT_LOCKED -> LOCKED;
            case RATE_LIMITED -> Status.TOO_MANY_REQUESTS;
            case OVERLOADED, QUEUE_TIMEOUT, STORE_UNAVAILABLE -> Status.SERVICE_UNAVAILABLE;
            case SYSTEM_ROLE_PROTECTED -> Status.CONFLICT;
            case INTERNAL -> Status.INTERNAL_SERVER_ERROR;
        };
    }

    private static String titleFor(AuthErrorCode code) {
        return switch (code) {
            case ACCOUNT_DISABLED -> "Forbidden";
            case ACCOUNT_LOCKED -> "Locked";
            case RATE_LIMITED -> "Too Many Requests";
            case OVERLOADED, QUEUE_TIMEOUT, STORE_UNAVAILABLE -> "Service Unavailable";
            case SYSTEM_ROLE_PROTECTED -> "Conflict";
            case INTERNAL -> "Internal Server Error";
            default -> "Unauthorized";
        };
    }
}
