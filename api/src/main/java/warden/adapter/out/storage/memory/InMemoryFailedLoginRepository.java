package warden.adapter.out.storage.memory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.port.out.FailedLoginRepository;

/**
 * In-memory implementation of failed login counters.
 *
 * <p><strong>Warning:</strong> Do not use in production with multiple instances;
 * an attacker could spread attempts across instances.
 */
public class InMemoryFailedLoginRepository implements FailedLoginRepository {

    private static final Logger LOG = Logger.getLogger(InMemoryFailedLoginRepository.class);

    private final ConcurrentMap<String, FailedAttemptEntry> failedAttempts = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryFailedLoginRepository(Clock clock) {
        this.clock = clock;
        LOG.info("Initialized in-memory failed login repository");
    }

    @Override
    public Uni<FailureState> get(String identifier) {
        return Uni.createFrom().item(() -> {
            final var entry = failedAttempts.get(identifier);
            final var now = clock.instant();
            if (entry == null) {
                return FailureState.none();
            }
            if (!now.isBefore(entry.expiresAt())) {
                failedAttempts.remove(identifier, entry);
                return FailureState.none();
            }
            return new FailureState(entry.count(), Duration.between(now, entry.expiresAt()));
        });
    }

    @Override
    public Uni<Long> recordFailure(String identifier, Duration window) {
        return Uni.createFrom().item(() -> {
            final var now = clock.instant();
            final var expiresAt = now.plus(window);

            final var entry = failedAttempts.compute(identifier, (k, existing) -> {
                if (existing == null || !now.isBefore(existing.expiresAt())) {
                    return new FailedAttemptEntry(1, expiresAt);
                }
                // Increment and extend expiry
                return new FailedAttemptEntry(existing.count() + 1, expiresAt);
            });

            LOG.debugf("Recorded failed login for %s: count=%d", identifier, entry.count());
            return entry.count();
        });
    }

    @Override
    public Uni<Void> clear(String identifier) {
        return Uni.createFrom().item(() -> {
            failedAttempts.remove(identifier);
            return null;
        });
    }

    private record FailedAttemptEntry(long count, Instant expiresAt) {}
}
