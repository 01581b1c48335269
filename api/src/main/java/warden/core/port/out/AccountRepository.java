package warden.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import warden.core.model.auth.Account;

/**
 * Read access to login accounts.
 */
public interface AccountRepository {

    /**
     * Find a non-deleted account by email, case-insensitively.
     *
     * @param email login email
     * @return Uni with the account, or empty
     */
    Uni<Optional<Account>> findByEmail(String email);
}
