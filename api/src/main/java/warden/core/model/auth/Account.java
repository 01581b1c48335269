package warden.core.model.auth;

import java.time.Instant;
import java.util.Objects;

/**
 * A subject's login record as stored relationally.
 *
 * @param subjectId    the subject id
 * @param email        login email (unique)
 * @param passwordHash encoded password hash, opaque outside the verifier
 * @param active       whether the account may log in
 * @param lastLoginAt  time of the last successful login, may be null
 */
public record Account(String subjectId, String email, String passwordHash, boolean active, Instant lastLoginAt) {

    public Account {
        Objects.requireNonNull(subjectId, "subjectId cannot be null");
        Objects.requireNonNull(email, "email cannot be null");
        Objects.requireNonNull(passwordHash, "passwordHash cannot be null");
    }
}
