package warden.adapter.out.storage.memory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.port.out.TokenRevocationRepository;

/**
 * In-memory implementation of the revocation registry.
 *
 * <p>Intended for development and testing. Entries are not shared across
 * instances and are lost on restart. Expired entries are dropped when read.
 */
public class InMemoryTokenRevocationRepository implements TokenRevocationRepository {

    private static final Logger LOG = Logger.getLogger(InMemoryTokenRevocationRepository.class);

    private final ConcurrentMap<String, Instant> blacklist = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ActiveSet> activeSets = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryTokenRevocationRepository(Clock clock) {
        this.clock = clock;
        LOG.info("Initialized in-memory revocation registry");
    }

    @Override
    public Uni<Void> registerActive(String subjectId, String jti, Duration ttl) {
        return Uni.createFrom().item(() -> {
            final var now = clock.instant();
            activeSets.compute(subjectId, (k, existing) -> {
                final var jtis = existing == null || existing.isExpired(now) ? new HashSet<String>() : existing.jtis();
                jtis.add(jti);
                return new ActiveSet(jtis, now.plus(ttl));
            });
            return null;
        });
    }

    @Override
    public Uni<Void> unregisterActive(String subjectId, String jti) {
        return Uni.createFrom().item(() -> {
            activeSets.computeIfPresent(subjectId, (k, existing) -> {
                existing.jtis().remove(jti);
                return existing.jtis().isEmpty() ? null : existing;
            });
            return null;
        });
    }

    @Override
    public Uni<Boolean> isBlacklisted(String jti) {
        return Uni.createFrom().item(() -> {
            final var expiresAt = blacklist.get(jti);
            if (expiresAt == null) {
                return false;
            }
            if (!clock.instant().isBefore(expiresAt)) {
                blacklist.remove(jti, expiresAt);
                return false;
            }
            return true;
        });
    }

    @Override
    public Uni<Void> blacklist(String jti, Duration ttl) {
        return Uni.createFrom().item(() -> {
            if (ttl.isNegative() || ttl.isZero()) {
                LOG.debugf("Skipping blacklist for already-expired token: %s", jti);
                return null;
            }
            blacklist.merge(jti, clock.instant().plus(ttl), (a, b) -> a.isAfter(b) ? a : b);
            return null;
        });
    }

    @Override
    public Uni<Set<String>> activeJtis(String subjectId) {
        return Uni.createFrom().item(() -> {
            final var now = clock.instant();
            final var snapshot = new HashSet<String>();
            activeSets.computeIfPresent(subjectId, (k, existing) -> {
                if (existing.isExpired(now)) {
                    return null;
                }
                snapshot.addAll(existing.jtis());
                return existing;
            });
            return Set.copyOf(snapshot);
        });
    }

    @Override
    public Uni<Void> clearActive(String subjectId) {
        return Uni.createFrom().item(() -> {
            activeSets.remove(subjectId);
            return null;
        });
    }

    // Mutated only inside ConcurrentMap.compute for its key.
    private record ActiveSet(Set<String> jtis, Instant expiresAt) {

        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
