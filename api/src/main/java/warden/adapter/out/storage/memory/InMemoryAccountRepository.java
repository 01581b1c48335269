package warden.adapter.out.storage.memory;

import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.smallrye.mutiny.Uni;

import warden.core.model.auth.Account;
import warden.core.port.out.AccountRepository;

/**
 * In-memory account store for development and testing.
 */
public class InMemoryAccountRepository implements AccountRepository {

    private final ConcurrentMap<String, Account> accountsByEmail = new ConcurrentHashMap<>();

    @Override
    public Uni<Optional<Account>> findByEmail(String email) {
        return Uni.createFrom().item(() -> Optional.ofNullable(accountsByEmail.get(normalize(email))));
    }

    /**
     * Create or replace an account.
     */
    public void save(Account account) {
        accountsByEmail.put(normalize(account.email()), account);
    }

    void touchLastLogin(String subjectId, Instant loggedInAt) {
        accountsByEmail.replaceAll((email, account) -> account.subjectId().equals(subjectId)
                ? new Account(account.subjectId(), account.email(), account.passwordHash(), account.active(), loggedInAt)
                : account);
    }

    private static String normalize(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }
}
