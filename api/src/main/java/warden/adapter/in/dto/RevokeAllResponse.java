package warden.adapter.in.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import warden.core.model.session.RevokeAllResult;

public record RevokeAllResponse(
        @JsonProperty("revoked_sessions") int revokedSessions, @JsonProperty("revoked_tokens") int revokedTokens) {

    public static RevokeAllResponse from(RevokeAllResult result) {
        return new RevokeAllResponse(result.revokedSessions(), result.revokedTokens());
    }
}
