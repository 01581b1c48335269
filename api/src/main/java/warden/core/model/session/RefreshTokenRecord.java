package warden.core.model.session;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Durable refresh-token record.
 *
 * <p>Only the SHA-256 hash of the refresh secret is held. Records are never
 * updated except to set {@code revokedAt}.
 *
 * @param id         record id
 * @param subjectId  owning subject
 * @param chainId    id of the login this record descends from; shared by every rotation
 * @param tokenHash  SHA-256 hex of the refresh secret
 * @param accessJti  jti of the access token issued together with this refresh token
 * @param deviceInfo client-supplied device metadata
 * @param createdAt  issuance time
 * @param expiresAt  expiry time
 * @param revokedAt  revocation time, null while unrevoked
 */
public record RefreshTokenRecord(
        UUID id,
        String subjectId,
        UUID chainId,
        String tokenHash,
        String accessJti,
        Map<String, Object> deviceInfo,
        Instant createdAt,
        Instant expiresAt,
        Instant revokedAt) {

    public RefreshTokenRecord {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(subjectId, "subjectId cannot be null");
        Objects.requireNonNull(chainId, "chainId cannot be null");
        Objects.requireNonNull(tokenHash, "tokenHash cannot be null");
        Objects.requireNonNull(createdAt, "createdAt cannot be null");
        Objects.requireNonNull(expiresAt, "expiresAt cannot be null");
        deviceInfo = deviceInfo == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(deviceInfo));
    }

    /**
     * Create the first record of a new session chain.
     */
    public static RefreshTokenRecord issue(
            String subjectId,
            String tokenHash,
            String accessJti,
            Map<String, Object> deviceInfo,
            Instant now,
            Instant expiresAt) {
        return new RefreshTokenRecord(
                UUID.randomUUID(), subjectId, UUID.randomUUID(), tokenHash, accessJti, deviceInfo, now, expiresAt, null);
    }

    /**
     * Create the successor of this record in the same chain.
     */
    public RefreshTokenRecord successor(String newTokenHash, String newAccessJti, Instant now, Instant newExpiresAt) {
        return new RefreshTokenRecord(
                UUID.randomUUID(), subjectId, chainId, newTokenHash, newAccessJti, deviceInfo, now, newExpiresAt, null);
    }

    public RefreshTokenRecord withRevokedAt(Instant revokedAt) {
        return new RefreshTokenRecord(
                id, subjectId, chainId, tokenHash, accessJti, deviceInfo, createdAt, expiresAt, revokedAt);
    }

    public boolean isRevoked() {
        return revokedAt != null;
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    /**
     * Lifecycle state of this token instance at {@code now}.
     */
    public SessionState state(Instant now) {
        if (isRevoked()) {
            return SessionState.REVOKED;
        }
        if (isExpired(now)) {
            return SessionState.EXPIRED;
        }
        return SessionState.ACTIVE;
    }
}
