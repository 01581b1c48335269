package warden.core.model.auth;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Claims carried by a signed access token.
 *
 * <p>All fields are required. A token whose payload lacks any of them is
 * rejected as {@link AuthErrorCode#MALFORMED} rather than defaulted.
 *
 * @param subject     the subject id ({@code sub})
 * @param roles       role snapshot at issuance ({@code roles})
 * @param permissions permission snapshot at issuance ({@code permissions})
 * @param jti         unique token id, the revocation registry key ({@code jti})
 * @param issuedAt    issuance time ({@code iat})
 * @param expiresAt   expiry time ({@code exp})
 */
public record AccessTokenClaims(
        String subject, List<String> roles, List<String> permissions, String jti, Instant issuedAt, Instant expiresAt) {

    public AccessTokenClaims {
        Objects.requireNonNull(subject, "subject cannot be null");
        Objects.requireNonNull(jti, "jti cannot be null");
        Objects.requireNonNull(issuedAt, "issuedAt cannot be null");
        Objects.requireNonNull(expiresAt, "expiresAt cannot be null");
        roles = roles == null ? List.of() : List.copyOf(roles);
        permissions = permissions == null ? List.of() : List.copyOf(permissions);
    }

    /**
     * Return the lifetime left at {@code now}, never negative.
     *
     * @param now the reference time
     * @return remaining lifetime, or {@link Duration#ZERO} once expired
     */
    public Duration remainingLifetime(Instant now) {
        final var remaining = Duration.between(now, expiresAt);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
