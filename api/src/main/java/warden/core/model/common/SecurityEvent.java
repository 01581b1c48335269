package warden.core.model.common;

import java.time.Instant;

/**
 * Security-relevant events emitted by the credential lifecycle.
 *
 * <p>Events never carry raw tokens, password material or unhashed client
 * addresses.
 */
public sealed interface SecurityEvent {

    Instant timestamp();

    Severity severity();

    enum Severity {
        INFO,
        WARNING,
        CRITICAL
    }

    /**
     * A login attempt failed.
     *
     * @param timestamp    when the attempt happened
     * @param clientHash   hashed client address
     * @param identityHash hashed login identifier
     * @param reason       failure code name
     * @param failureCount consecutive failures for the identifier
     */
    record LoginFailed(Instant timestamp, String clientHash, String identityHash, String reason, long failureCount)
            implements SecurityEvent {

        @Override
        public Severity severity() {
            return failureCount >= 3 ? Severity.WARNING : Severity.INFO;
        }
    }

    /**
     * A login was refused because the identifier is locked out.
     *
     * @param timestamp         when the attempt happened
     * @param clientHash        hashed client address
     * @param identityHash      hashed login identifier
     * @param retryAfterSeconds remaining lockout
     */
    record LoginLocked(Instant timestamp, String clientHash, String identityHash, long retryAfterSeconds)
            implements SecurityEvent {

        @Override
        public Severity severity() {
            return Severity.WARNING;
        }
    }

    /**
     * A refresh token that had already been rotated or revoked was presented again.
     *
     * @param timestamp    when the reuse was detected
     * @param subjectId    owning subject
     * @param chainId      session chain of the reused token
     * @param chainRevoked whether the whole chain was revoked in response
     */
    record RefreshTokenReuse(Instant timestamp, String subjectId, String chainId, boolean chainRevoked)
            implements SecurityEvent {

        @Override
        public Severity severity() {
            return Severity.CRITICAL;
        }
    }

    /**
     * Every session of a subject was revoked.
     *
     * @param timestamp       when the revocation completed
     * @param subjectId       the subject
     * @param revokedSessions refresh records revoked
     * @param revokedTokens   access tokens blacklisted
     */
    record SessionsRevoked(Instant timestamp, String subjectId, int revokedSessions, int revokedTokens)
            implements SecurityEvent {

        @Override
        public Severity severity() {
            return Severity.INFO;
        }
    }

    /**
     * A client exceeded an endpoint rate limit.
     *
     * @param timestamp     when the limit was hit
     * @param clientHash    hashed client address
     * @param endpointClass endpoint class key
     * @param requestCount  requests counted in the window
     * @param limit         the configured limit
     */
    record RateLimitExceeded(Instant timestamp, String clientHash, String endpointClass, long requestCount, long limit)
            implements SecurityEvent {

        @Override
        public Severity severity() {
            return requestCount > limit * 2 ? Severity.WARNING : Severity.INFO;
        }
    }
}
