package warden.core.port.out;

import java.time.Duration;

import warden.core.model.auth.IssuedAccessToken;
import warden.core.model.auth.SubjectAuthorization;
import warden.core.model.auth.TokenVerification;

/**
 * Creates and verifies signed access tokens and mints opaque refresh secrets.
 *
 * <p>Stateless: verification checks signature, issuer and expiry only. Whether a
 * verified token has been revoked is the caller's question to the revocation
 * registry.
 */
public interface TokenCodec {

    /**
     * Sign an access token for a subject with a fresh jti.
     *
     * @param subjectId     the subject
     * @param authorization roles and permissions to embed
     * @param ttl           token lifetime
     * @return the signed token and its claims
     */
    IssuedAccessToken issueAccessToken(String subjectId, SubjectAuthorization authorization, Duration ttl);

    /**
     * Generate a cryptographically random refresh secret. Refresh secrets are
     * never signed; they are checked against their stored hash.
     *
     * @return the secret
     */
    String issueRefreshToken();

    /**
     * Verify signature, issuer and expiry.
     *
     * @param token compact JWS
     * @return verified claims, or the rejection reason
     */
    TokenVerification verifyAccessToken(String token);

    /**
     * Verify signature and issuer, accepting expired tokens.
     *
     * <p>Used by logout, where an expired token must still identify its session.
     *
     * @param token compact JWS
     * @return claims, or the rejection reason
     */
    TokenVerification decodeAccessToken(String token);

    /**
     * Public JWK set for other services to verify tokens with.
     *
     * @return JWK set JSON without private parameters
     */
    String publicKeySetJson();
}
