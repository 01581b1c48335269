package warden.adapter.out.storage.memory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.session.LoginRecord;
import warden.core.model.session.RefreshTokenRecord;
import warden.core.port.out.RefreshTokenRepository;

/**
 * In-memory refresh-token store.
 *
 * <p>Every method holds the instance monitor, which gives the conditional
 * rotation the same all-or-nothing behaviour as the relational transaction
 * within one process. Not suitable for more than one instance.
 */
public class InMemoryRefreshTokenRepository implements RefreshTokenRepository {

    private static final Logger LOG = Logger.getLogger(InMemoryRefreshTokenRepository.class);

    private final Map<UUID, RefreshTokenRecord> records = new LinkedHashMap<>();
    private final Map<String, UUID> idsByHash = new LinkedHashMap<>();
    private final List<LoginRecord> loginHistory = new ArrayList<>();
    private final InMemoryAccountRepository accounts;

    public InMemoryRefreshTokenRepository() {
        this(null);
    }

    /**
     * @param accounts account store whose last login time is updated on login, may be null
     */
    public InMemoryRefreshTokenRepository(InMemoryAccountRepository accounts) {
        this.accounts = accounts;
    }

    @Override
    public Uni<Optional<RefreshTokenRecord>> findByTokenHash(String tokenHash) {
        return Uni.createFrom().item(() -> {
            synchronized (this) {
                return Optional.ofNullable(idsByHash.get(tokenHash)).map(records::get);
            }
        });
    }

    @Override
    public Uni<Void> saveLogin(RefreshTokenRecord record, LoginRecord login) {
        return Uni.createFrom().item(() -> {
            synchronized (this) {
                insert(record);
                loginHistory.add(login);
                if (accounts != null) {
                    accounts.touchLastLogin(login.subjectId(), login.attemptedAt());
                }
            }
            return null;
        });
    }

    @Override
    public Uni<Void> recordFailedLogin(LoginRecord attempt) {
        return Uni.createFrom().item(() -> {
            synchronized (this) {
                loginHistory.add(attempt);
            }
            return null;
        });
    }

    @Override
    public Uni<Boolean> rotate(UUID currentId, RefreshTokenRecord successor, Instant now) {
        return Uni.createFrom().item(() -> {
            synchronized (this) {
                final var current = records.get(currentId);
                if (current == null || current.isRevoked()) {
                    LOG.debugf("Rotation of %s lost: record already revoked", currentId);
                    return false;
                }
                records.put(currentId, current.withRevokedAt(now));
                insert(successor);
                return true;
            }
        });
    }

    @Override
    public Uni<Integer> revokeChainByAccessJti(String subjectId, String accessJti, Instant now) {
        return Uni.createFrom().item(() -> {
            synchronized (this) {
                final var chainIds = records.values().stream()
                        .filter(r -> r.subjectId().equals(subjectId) && accessJti.equals(r.accessJti()))
                        .map(RefreshTokenRecord::chainId)
                        .toList();
                return revokeWhere(r -> chainIds.contains(r.chainId()), now);
            }
        });
    }

    @Override
    public Uni<Integer> revokeChain(UUID chainId, Instant now) {
        return Uni.createFrom().item(() -> {
            synchronized (this) {
                return revokeWhere(r -> r.chainId().equals(chainId), now);
            }
        });
    }

    @Override
    public Uni<Integer> revokeAllForSubject(String subjectId, Instant now) {
        return Uni.createFrom().item(() -> {
            synchronized (this) {
                return revokeWhere(r -> r.subjectId().equals(subjectId), now);
            }
        });
    }

    @Override
    public Uni<List<RefreshTokenRecord>> findActiveBySubject(String subjectId, Instant now) {
        return Uni.createFrom().item(() -> {
            synchronized (this) {
                return records.values().stream()
                        .filter(r -> r.subjectId().equals(subjectId) && !r.isRevoked() && !r.isExpired(now))
                        .sorted(Comparator.comparing(RefreshTokenRecord::createdAt).reversed())
                        .toList();
            }
        });
    }

    /**
     * Login history rows in insertion order (for testing).
     */
    public synchronized List<LoginRecord> loginHistory() {
        return List.copyOf(loginHistory);
    }

    /**
     * Number of stored records, revoked ones included (for testing).
     */
    public synchronized int size() {
        return records.size();
    }

    private void insert(RefreshTokenRecord record) {
        if (idsByHash.containsKey(record.tokenHash())) {
            throw new IllegalStateException("Duplicate refresh token hash");
        }
        records.put(record.id(), record);
        idsByHash.put(record.tokenHash(), record.id());
    }

    private int revokeWhere(Predicate<RefreshTokenRecord> predicate, Instant now) {
        var count = 0;
        for (var entry : records.entrySet()) {
            final var record = entry.getValue();
            if (!record.isRevoked() && predicate.test(record)) {
                entry.setValue(record.withRevokedAt(now));
                count++;
            }
        }
        return count;
    }
}
