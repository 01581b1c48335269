package warden.core.model.auth;

/**
 * A freshly signed access token together with its claims.
 *
 * @param token  the compact JWS serialization
 * @param claims the claims embedded in the token
 */
public record IssuedAccessToken(String token, AccessTokenClaims claims) {

    public String jti() {
        return claims.jti();
    }
}
