package warden.core.model.auth;

import java.time.Duration;

/**
 * Access and refresh token returned by login and refresh.
 *
 * @param accessToken  the signed access token
 * @param refreshToken the opaque refresh secret (raw, shown to the client once)
 * @param expiresIn    access token lifetime
 */
public record TokenPair(IssuedAccessToken accessToken, String refreshToken, Duration expiresIn) {

    public static final String TOKEN_TYPE = "bearer";
}
