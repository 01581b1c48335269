package warden.adapter.out.storage.redis;

import java.time.Duration;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.port.out.FailedLoginRepository;
import warden.core.port.out.Metrics;

/**
 * Redis implementation of failed login counters.
 *
 * <p>Key format: {@code failed_login:{identifier}}, an integer counter whose
 * expiry is pushed back to the lockout duration on every failure.
 */
public class RedisFailedLoginRepository implements FailedLoginRepository {

    private static final Logger LOG = Logger.getLogger(RedisFailedLoginRepository.class);

    static final String KEY_PREFIX = "failed_login:";

    private final ReactiveValueCommands<String, String> counterCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final RedisTimeoutHelper timeoutHelper;

    public RedisFailedLoginRepository(ReactiveRedisDataSource redisDataSource, Duration timeout, Metrics metrics) {
        this.counterCommands = redisDataSource.value(String.class, String.class);
        this.keyCommands = redisDataSource.key(String.class);
        this.timeoutHelper = new RedisTimeoutHelper(timeout, metrics, "RedisFailedLoginRepository");
        LOG.info("Initialized Redis failed login repository");
    }

    @Override
    public Uni<FailureState> get(String identifier) {
        final var key = KEY_PREFIX + identifier;
        final var operation = Uni.combine()
                .all()
                .unis(counterCommands.get(key), keyCommands.pttl(key))
                .asTuple()
                .map(tuple -> {
                    final var value = tuple.getItem1();
                    if (value == null) {
                        return FailureState.none();
                    }
                    final var pttl = tuple.getItem2();
                    return new FailureState(Long.parseLong(value), pttl != null && pttl > 0 ? Duration.ofMillis(pttl) : Duration.ZERO);
                });
        return timeoutHelper.withTimeout(operation, "get");
    }

    @Override
    public Uni<Long> recordFailure(String identifier, Duration window) {
        final var key = KEY_PREFIX + identifier;
        final var operation = counterCommands
                .incr(key)
                .call(count -> keyCommands.expire(key, Math.max(1, window.toSeconds())))
                .invoke(count -> LOG.debugf("Recorded failed login for %s (count: %d)", identifier, count));
        return timeoutHelper.withTimeout(operation, "recordFailure");
    }

    @Override
    public Uni<Void> clear(String identifier) {
        return timeoutHelper.withTimeout(keyCommands.del(KEY_PREFIX + identifier).replaceWithVoid(), "clear");
    }
}
