package warden.adapter.out.storage.redis;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.KeyScanArgs;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.keys.ReactiveKeyScanCursor;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.auth.SubjectAuthorization;
import warden.core.port.out.Metrics;
import warden.core.port.out.PermissionCacheRepository;

/**
 * Redis implementation of the permission cache.
 *
 * <p>Key format: {@code permissions:{subject}} holding
 * {@code {"roles":[...],"permissions":[...]}}.
 *
 * <p>Reads degrade to a miss and writes are best-effort. Invalidations fail
 * fast so that a mutation is not reported as applied while a stale entry
 * survives.
 */
public class RedisPermissionCacheRepository implements PermissionCacheRepository {

    private static final Logger LOG = Logger.getLogger(RedisPermissionCacheRepository.class);

    static final String KEY_PREFIX = "permissions:";

    private final ReactiveValueCommands<String, String> valueCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final ObjectMapper objectMapper;
    private final RedisTimeoutHelper timeoutHelper;
    private final int scanBatchSize;

    public RedisPermissionCacheRepository(
            ReactiveRedisDataSource redisDataSource,
            ObjectMapper objectMapper,
            Duration timeout,
            int scanBatchSize,
            Metrics metrics) {
        this.valueCommands = redisDataSource.value(String.class, String.class);
        this.keyCommands = redisDataSource.key(String.class);
        this.objectMapper = objectMapper;
        this.scanBatchSize = scanBatchSize;
        this.timeoutHelper = new RedisTimeoutHelper(timeout, metrics, "RedisPermissionCacheRepository");
        LOG.info("Initialized Redis permission cache");
    }

    @Override
    public Uni<Optional<SubjectAuthorization>> get(String subjectId) {
        return timeoutHelper
                .withTimeoutGraceful(valueCommands.get(KEY_PREFIX + subjectId), "get")
                .map(json -> json.flatMap(value -> deserialize(subjectId, value)));
    }

    @Override
    public Uni<Void> put(String subjectId, SubjectAuthorization authorization, Duration ttl) {
        final String json;
        try {
            json = objectMapper.writeValueAsString(authorization);
        } catch (JsonProcessingException e) {
            LOG.warnv(e, "Failed to serialize authorization for {0}, not caching", subjectId);
            return Uni.createFrom().voidItem();
        }
        final var ttlSeconds = Math.max(1, ttl.toSeconds());
        return timeoutHelper.withTimeoutSilent(valueCommands.setex(KEY_PREFIX + subjectId, ttlSeconds, json), "put");
    }

    @Override
    public Uni<Boolean> invalidate(String subjectId) {
        return timeoutHelper.withTimeout(keyCommands.del(KEY_PREFIX + subjectId).map(deleted -> deleted > 0), "invalidate");
    }

    /**
     * Sweep every cached entry page by page. Each SCAN page and each DEL has its
     * own timeout, so the sweep may run longer than one operation timeout.
     */
    @Override
    public Uni<Long> invalidateAll() {
        final var scanArgs = new KeyScanArgs().match(KEY_PREFIX + "*").count(scanBatchSize);
        return sweep(keyCommands.scan(scanArgs), 0L)
                .invoke(count -> LOG.infof("Invalidated %d permission cache entries", count));
    }

    private Uni<Long> sweep(ReactiveKeyScanCursor<String> cursor, long deletedSoFar) {
        if (!cursor.hasNext()) {
            return Uni.createFrom().item(deletedSoFar);
        }
        return timeoutHelper
                .withTimeout(cursor.next(), "invalidateAll.scan")
                .chain(this::deleteBatch)
                .chain(deleted -> sweep(cursor, deletedSoFar + deleted));
    }

    private Uni<Long> deleteBatch(Set<String> keys) {
        if (keys == null || keys.isEmpty()) {
            return Uni.createFrom().item(0L);
        }
        return timeoutHelper
                .withTimeout(keyCommands.del(keys.toArray(new String[0])), "invalidateAll.del")
                .map(Integer::longValue);
    }

    private Optional<SubjectAuthorization> deserialize(String subjectId, String json) {
        try {
            return Optional.of(objectMapper.readValue(json, SubjectAuthorization.class));
        } catch (JsonProcessingException e) {
            LOG.warnv("Discarding unreadable permission cache entry for {0}: {1}", subjectId, e.getMessage());
            return Optional.empty();
        }
    }
}
