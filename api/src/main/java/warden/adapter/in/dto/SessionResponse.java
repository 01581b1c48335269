package warden.adapter.in.dto;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonProperty;

import warden.core.model.session.RefreshTokenRecord;

/**
 * One active session of the caller.
 *
 * <p>Never exposes the token hash.
 *
 * @param id         refresh token record id
 * @param deviceInfo device metadata recorded at login
 * @param createdAt  when the current refresh token was issued
 * @param expiresAt  when the current refresh token expires
 */
public record SessionResponse(
        UUID id,
        @JsonProperty("device_info") Map<String, Object> deviceInfo,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("expires_at") Instant expiresAt) {

    public static SessionResponse from(RefreshTokenRecord record) {
        return new SessionResponse(record.id(), record.deviceInfo(), record.createdAt(), record.expiresAt());
    }
}
