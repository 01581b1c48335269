package warden.core.model.auth;

import java.time.Duration;
import java.util.Optional;

/**
 * Typed failure of a credential, token, rate-limit or admission decision.
 *
 * <p>These are deterministic business outcomes. They are never retried
 * automatically; retryable codes carry a suggested delay.
 */
public class AuthException extends RuntimeException {

    private final AuthErrorCode code;
    private final Duration retryAfter;

    public AuthException(AuthErrorCode code) {
        this(code, null, null);
    }

    public AuthException(AuthErrorCode code, Duration retryAfter) {
        this(code, retryAfter, null);
    }

    public AuthException(AuthErrorCode code, Duration retryAfter, Throwable cause) {
        super(code.message(), cause);
        this.code = code;
        this.retryAfter = retryAfter;
    }

    public static AuthException of(AuthErrorCode code) {
        return new AuthException(code);
    }

    public static AuthException retryAfter(AuthErrorCode code, Duration retryAfter) {
        return new AuthException(code, retryAfter);
    }

    public AuthErrorCode code() {
        return code;
    }

    public Optional<Duration> retryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    /**
     * Return the retry hint in whole seconds, rounded up and at least one.
     *
     * @return seconds, or 0 when no hint is present
     */
    public long retryAfterSeconds() {
        if (retryAfter == null) {
            return 0;
        }
        final var seconds = retryAfter.toSeconds() + (retryAfter.toNanosPart() > 0 ? 1 : 0);
        return Math.max(1, seconds);
    }
}
