package warden.adapter.out.storage.memory;

import java.time.Duration;
import java.util.Optional;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import io.smallrye.mutiny.Uni;

import warden.core.model.auth.SubjectAuthorization;
import warden.core.port.out.PermissionCacheRepository;

/**
 * Caffeine-backed permission cache for a single instance.
 *
 * <p>Each entry carries its own TTL. The ticker is injectable so tests can
 * advance time.
 */
public class InMemoryPermissionCacheRepository implements PermissionCacheRepository {

    private final Cache<String, TimedEntry> cache;

    public InMemoryPermissionCacheRepository(long maxEntries) {
        this(maxEntries, Ticker.systemTicker());
    }

    public InMemoryPermissionCacheRepository(long maxEntries, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .ticker(ticker)
                .expireAfter(new PerEntryExpiry())
                .build();
    }

    @Override
    public Uni<Optional<SubjectAuthorization>> get(String subjectId) {
        return Uni.createFrom()
                .item(() -> Optional.ofNullable(cache.getIfPresent(subjectId)).map(TimedEntry::authorization));
    }

    @Override
    public Uni<Void> put(String subjectId, SubjectAuthorization authorization, Duration ttl) {
        return Uni.createFrom().item(() -> {
            cache.put(subjectId, new TimedEntry(authorization, ttl));
            return null;
        });
    }

    @Override
    public Uni<Boolean> invalidate(String subjectId) {
        return Uni.createFrom().item(() -> cache.asMap().remove(subjectId) != null);
    }

    @Override
    public Uni<Long> invalidateAll() {
        return Uni.createFrom().item(() -> {
            final long count = cache.asMap().size();
            cache.invalidateAll();
            return count;
        });
    }

    private record TimedEntry(SubjectAuthorization authorization, Duration ttl) {}

    private static final class PerEntryExpiry implements Expiry<String, TimedEntry> {

        @Override
        public long expireAfterCreate(String key, TimedEntry value, long currentTime) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, TimedEntry value, long currentTime, long currentDuration) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterRead(String key, TimedEntry value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
