package warden.adapter.in.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import warden.core.model.auth.TokenPair;

/**
 * Token pair returned by login and refresh.
 *
 * @param accessToken  signed access token
 * @param refreshToken opaque refresh secret
 * @param tokenType    always {@code bearer}
 * @param expiresIn    access token lifetime in seconds
 */
public record TokenResponse(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("refresh_token") String refreshToken,
        @JsonProperty("token_type") String tokenType,
        @JsonProperty("expires_in") long expiresIn) {

    public static TokenResponse from(TokenPair pair) {
        return new TokenResponse(
                pair.accessToken().token(),
                pair.refreshToken(),
                TokenPair.TOKEN_TYPE,
                pair.expiresIn().toSeconds());
    }
}
