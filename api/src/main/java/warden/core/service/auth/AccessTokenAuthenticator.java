package warden.core.service.auth;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.auth.AccessTokenClaims;
import warden.core.model.auth.AuthErrorCode;
import warden.core.model.auth.AuthException;
import warden.core.model.auth.TokenVerification;
import warden.core.port.out.TokenCodec;

/**
 * Authenticates bearer access tokens: signature, expiry and issuer through
 * the codec, then the revocation registry.
 */
@ApplicationScoped
public class AccessTokenAuthenticator {

    private static final Logger LOG = Logger.getLogger(AccessTokenAuthenticator.class);

    private final TokenCodec tokenCodec;
    private final TokenRevocationService revocationService;

    public AccessTokenAuthenticator(TokenCodec tokenCodec, TokenRevocationService revocationService) {
        this.tokenCodec = tokenCodec;
        this.revocationService = revocationService;
    }

    /**
     * Authenticate an access token.
     *
     * @param token the compact JWS
     * @return Uni with the verified claims; fails with {@link AuthException}
     */
    public Uni<AccessTokenClaims> authenticate(String token) {
        final var verification = tokenCodec.verifyAccessToken(token);
        if (verification instanceof TokenVerification.Rejected rejected) {
            LOG.debugf("Access token rejected: %s (%s)", rejected.reason(), rejected.detail());
            return Uni.createFrom().failure(new AuthException(rejected.reason()));
        }

        final var claims = ((TokenVerification.Verified) verification).claims();
        return revocationService.isRevoked(claims.jti()).chain(revoked -> {
            if (revoked) {
                LOG.debugf("Access token %s is revoked", claims.jti());
                return Uni.createFrom().failure(new AuthException(AuthErrorCode.TOKEN_REVOKED));
            }
            return Uni.createFrom().item(claims);
        });
    }
}
