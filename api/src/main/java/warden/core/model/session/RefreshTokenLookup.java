package warden.core.model.session;

import java.time.Instant;
import java.util.Optional;

/**
 * Outcome of looking up a presented refresh token.
 *
 * <p>Not found, revoked and expired are distinct outcomes the caller must
 * branch on.
 */
public sealed interface RefreshTokenLookup {

    /**
     * Classify a stored record at {@code now}. Revocation takes precedence over expiry.
     */
    static RefreshTokenLookup of(Optional<RefreshTokenRecord> found, Instant now) {
        if (found.isEmpty()) {
            return new NotFound();
        }
        final var record = found.get();
        if (record.isRevoked()) {
            return new Revoked(record);
        }
        if (record.isExpired(now)) {
            return new Expired(record);
        }
        return new Active(record);
    }

    record Active(RefreshTokenRecord record) implements RefreshTokenLookup {}

    record NotFound() implements RefreshTokenLookup {}

    record Revoked(RefreshTokenRecord record) implements RefreshTokenLookup {}

    record Expired(RefreshTokenRecord record) implements RefreshTokenLookup {}
}
