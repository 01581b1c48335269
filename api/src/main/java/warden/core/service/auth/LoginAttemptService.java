package warden.core.service.auth;

import java.util.Locale;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.LockoutConfig;
import warden.core.model.auth.AuthErrorCode;
import warden.core.model.auth.AuthException;
import warden.core.port.out.FailedLoginRepository;
import warden.core.service.common.StoreRetry;

/**
 * Tracks consecutive failed logins per email and locks the email once the
 * configured threshold is reached.
 *
 * <p>Every failure pushes the counter's expiry back to the lockout duration,
 * so a lockout ends that long after the last failed attempt.
 */
@ApplicationScoped
public class LoginAttemptService {

    private static final Logger LOG = Logger.getLogger(LoginAttemptService.class);

    private final FailedLoginRepository repository;
    private final LockoutConfig config;
    private final StoreRetry storeRetry;

    public LoginAttemptService(FailedLoginRepository repository, LockoutConfig config, StoreRetry storeRetry) {
        this.repository = repository;
        this.config = config;
        this.storeRetry = storeRetry;
    }

    /**
     * Normalize an email for counter keys.
     */
    public static String normalize(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Fail with ACCOUNT_LOCKED when the identifier has reached the threshold.
     *
     * @param identifier normalized email
     * @return Uni completing when not locked
     */
    public Uni<Void> checkNotLocked(String identifier) {
        if (!config.enabled()) {
            return Uni.createFrom().voidItem();
        }

        return storeRetry.failClosed(() -> repository.get(identifier), "getFailedLogins").chain(state -> {
            if (state.count() < config.maxFailedAttempts()) {
                return Uni.createFrom().voidItem();
            }
            final var retryAfter = state.remaining().isZero() ? config.lockoutDuration() : state.remaining();
            LOG.debugf("Login locked for %s (failures: %d, remaining: %s)", identifier, state.count(), retryAfter);
            return Uni.createFrom().failure(new AuthException(AuthErrorCode.ACCOUNT_LOCKED, retryAfter));
        });
    }

    /**
     * Count a failed attempt.
     *
     * @param identifier normalized email
     * @return Uni with the consecutive failure count
     */
    public Uni<Long> recordFailure(String identifier) {
        if (!config.enabled()) {
            return Uni.createFrom().item(0L);
        }
        return storeRetry.failClosed(
                () -> repository.recordFailure(identifier, config.lockoutDuration()), "recordFailedLogin");
    }

    /**
     * Clear the counter after a successful login. Failures are logged and ignored.
     *
     * @param identifier normalized email
     * @return Uni completing once attempted
     */
    public Uni<Void> reset(String identifier) {
        if (!config.enabled()) {
            return Uni.createFrom().voidItem();
        }
        return repository.clear(identifier).onFailure().recoverWithItem(error -> {
            LOG.warnv("Failed to reset login failures for {0}: {1}", identifier, error.getMessage());
            return null;
        });
    }

    public long maxFailedAttempts() {
        return config.maxFailedAttempts();
    }
}
