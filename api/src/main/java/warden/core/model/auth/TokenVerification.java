package warden.core.model.auth;

/**
 * Outcome of verifying an access token's signature and expiry.
 */
public sealed interface TokenVerification {

    /**
     * Signature and expiry are valid.
     *
     * @param claims the decoded claims
     */
    record Verified(AccessTokenClaims claims) implements TokenVerification {}

    /**
     * The token was rejected.
     *
     * @param reason one of {@code INVALID_SIGNATURE}, {@code TOKEN_EXPIRED} or {@code MALFORMED}
     * @param detail diagnostic detail for logs, never shown to callers
     */
    record Rejected(AuthErrorCode reason, String detail) implements TokenVerification {}

    default boolean isVerified() {
        return this instanceof Verified;
    }
}
