package warden.adapter.out.storage.redis;

import java.time.Duration;
import java.util.Set;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.set.ReactiveSetCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.port.out.Metrics;
import warden.core.port.out.TokenRevocationRepository;

/**
 * Redis implementation of the revocation registry.
 *
 * <p>Key format:
 * <ul>
 *   <li>Blacklisted jti: {@code blacklist:{jti}} (string, TTL = remaining token lifetime)</li>
 *   <li>Active jtis: {@code active_tokens:{subject}} (set, TTL = access-token lifetime)</li>
 * </ul>
 *
 * <p>Every command fails fast with a store failure on timeout; a lookup that
 * could not be answered is never treated as "not blacklisted".
 */
public class RedisTokenRevocationRepository implements TokenRevocationRepository {

    private static final Logger LOG = Logger.getLogger(RedisTokenRevocationRepository.class);

    static final String BLACKLIST_PREFIX = "blacklist:";
    static final String ACTIVE_PREFIX = "active_tokens:";
    private static final String BLACKLISTED_VALUE = "1";

    private final ReactiveValueCommands<String, String> valueCommands;
    private final ReactiveSetCommands<String, String> setCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final RedisTimeoutHelper timeoutHelper;

    public RedisTokenRevocationRepository(ReactiveRedisDataSource redisDataSource, Duration timeout, Metrics metrics) {
        this.valueCommands = redisDataSource.value(String.class, String.class);
        this.setCommands = redisDataSource.set(String.class, String.class);
        this.keyCommands = redisDataSource.key(String.class);
        this.timeoutHelper = new RedisTimeoutHelper(timeout, metrics, "RedisTokenRevocationRepository");
        LOG.info("Initialized Redis revocation registry");
    }

    @Override
    public Uni<Void> registerActive(String subjectId, String jti, Duration ttl) {
        final var key = ACTIVE_PREFIX + subjectId;
        final var ttlSeconds = ceilSeconds(ttl);

        final var operation = setCommands
                .sadd(key, jti)
                .flatMap(added -> keyCommands.expire(key, ttlSeconds))
                .replaceWithVoid()
                .invoke(() -> LOG.debugf("Registered active token %s for %s (TTL: %ds)", jti, subjectId, ttlSeconds));
        return timeoutHelper.withTimeout(operation, "registerActive");
    }

    @Override
    public Uni<Void> unregisterActive(String subjectId, String jti) {
        final var operation = setCommands.srem(ACTIVE_PREFIX + subjectId, jti).replaceWithVoid();
        return timeoutHelper.withTimeout(operation, "unregisterActive");
    }

    @Override
    public Uni<Boolean> isBlacklisted(String jti) {
        return timeoutHelper.withTimeout(keyCommands.exists(BLACKLIST_PREFIX + jti), "isBlacklisted");
    }

    @Override
    public Uni<Void> blacklist(String jti, Duration ttl) {
        final var ttlSeconds = ceilSeconds(ttl);
        if (ttlSeconds <= 0) {
            LOG.debugf("Skipping blacklist for already-expired token: %s", jti);
            return Uni.createFrom().voidItem();
        }

        final var operation = valueCommands
                .setex(BLACKLIST_PREFIX + jti, ttlSeconds, BLACKLISTED_VALUE)
                .invoke(() -> LOG.debugf("Blacklisted token in Redis: %s (TTL: %ds)", jti, ttlSeconds));
        return timeoutHelper.withTimeout(operation, "blacklist");
    }

    @Override
    public Uni<Set<String>> activeJtis(String subjectId) {
        return timeoutHelper.withTimeout(setCommands.smembers(ACTIVE_PREFIX + subjectId), "activeJtis");
    }

    @Override
    public Uni<Void> clearActive(String subjectId) {
        return timeoutHelper.withTimeout(keyCommands.del(ACTIVE_PREFIX + subjectId).replaceWithVoid(), "clearActive");
    }

    /**
     * Round up so an entry never expires before the token it describes.
     */
    static long ceilSeconds(Duration ttl) {
        if (ttl.isNegative() || ttl.isZero()) {
            return 0;
        }
        return ttl.toSeconds() + (ttl.toNanosPart() > 0 ? 1 : 0);
    }
}
