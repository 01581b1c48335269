package warden.adapter.out.storage.redis;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.common.StoreUnavailableException;
import warden.core.port.out.Metrics;

/**
 * Applies timeouts and failure translation to Redis operations.
 *
 * <h2>Operation Modes</h2>
 * <ul>
 *   <li>{@link #withTimeout} - Fail-fast: timeouts and failures become
 *       {@link StoreUnavailableException}. Use for anything that decides whether
 *       a credential is accepted (blacklist, active set, failure counters).</li>
 *   <li>{@link #withTimeoutGraceful} - Fail-soft: returns empty Optional on timeout
 *       or failure. Use for permission cache reads, where a miss falls back to
 *       the relational store.</li>
 *   <li>{@link #withTimeoutFallback} - Fail-open: returns a fallback on timeout or
 *       failure. Use for rate limiting, where the gated endpoint fails closed
 *       on its own store calls.</li>
 *   <li>{@link #withTimeoutSilent} - Fire-and-forget: logs but ignores timeout or
 *       failure. Use for permission cache writes.</li>
 * </ul>
 *
 * <h2>Metrics</h2>
 * Records timeouts ({@code warden.store.timeouts.total}) and non-timeout failures
 * ({@code warden.store.failures.total}) separately.
 */
public class RedisTimeoutHelper {

    private static final Logger LOG = Logger.getLogger(RedisTimeoutHelper.class);

    private final Duration timeout;
    private final Metrics metrics;
    private final String repositoryName;

    /**
     * Create a new timeout helper.
     *
     * @param timeout the timeout duration for Redis operations
     * @param metrics the metrics instance for recording timeouts (may be null)
     * @param repositoryName the repository name for logs and metrics tagging
     */
    public RedisTimeoutHelper(Duration timeout, Metrics metrics, String repositoryName) {
        this.timeout = timeout;
        this.metrics = metrics;
        this.repositoryName = repositoryName;
    }

    /**
     * Apply timeout to an operation that must not be silently skipped.
     *
     * @param operation the Redis operation
     * @param operationName name for logging and metrics
     * @param <T> the result type
     * @return a Uni that fails with {@link StoreUnavailableException} on timeout or failure
     */
    public <T> Uni<T> withTimeout(Uni<T> operation, String operationName) {
        return operation
                .ifNoItem()
                .after(timeout)
                .failWith(() -> {
                    LOG.warnv("Redis operation timeout: {0} in {1} after {2}", operationName, repositoryName, timeout);
                    recordTimeout(operationName);
                    return new RedisTimeoutException(operationName, repositoryName);
                })
                .onFailure(error -> !(error instanceof StoreUnavailableException))
                .transform(error -> {
                    LOG.warnv("Redis operation failure: {0} in {1}: {2}", operationName, repositoryName, error.getMessage());
                    recordFailure(operationName);
                    return new StoreUnavailableException(
                            repositoryName, "Redis operation failed: " + operationName, error);
                });
    }

    /**
     * Apply timeout, degrading to an empty Optional when Redis is slow or down.
     *
     * @param operation the Redis operation
     * @param operationName name for logging and metrics
     * @param <T> the result type
     * @return a Uni that returns empty Optional on timeout or failure
     */
    public <T> Uni<Optional<T>> withTimeoutGraceful(Uni<T> operation, String operationName) {
        return degrade(operation.map(Optional::ofNullable), operationName, "graceful", Optional::empty);
    }

    /**
     * Apply timeout, substituting {@code fallback} when Redis is slow or down.
     *
     * @param operation the Redis operation
     * @param operationName name for logging and metrics
     * @param fallback supplier for fallback value on timeout or failure
     * @param <T> the result type
     * @return a Uni that returns fallback value on timeout or failure
     */
    public <T> Uni<T> withTimeoutFallback(Uni<T> operation, String operationName, Supplier<T> fallback) {
        return degrade(operation, operationName, "fallback", fallback);
    }

    /**
     * Apply timeout to a write whose loss is tolerable.
     *
     * @param operation the Redis operation
     * @param operationName name for logging and metrics
     * @return a Uni that completes with void on timeout or failure
     */
    public Uni<Void> withTimeoutSilent(Uni<Void> operation, String operationName) {
        return degrade(operation, operationName, "silent", () -> null);
    }

    private <T> Uni<T> degrade(Uni<T> operation, String operationName, String mode, Supplier<T> fallback) {
        return operation
                .ifNoItem()
                .after(timeout)
                .recoverWithItem(() -> {
                    LOG.warnv("Redis {0} timed out in {1} after {2} ({3})", operationName, repositoryName, timeout, mode);
                    recordTimeout(operationName);
                    return fallback.get();
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv("Redis {0} failed in {1}: {2} ({3})", operationName, repositoryName, error.getMessage(), mode);
                    recordFailure(operationName);
                    return fallback.get();
                });
    }

    private void recordTimeout(String operationName) {
        if (metrics != null) {
            metrics.recordStoreTimeout(repositoryName, operationName);
        }
    }

    private void recordFailure(String operationName) {
        if (metrics != null) {
            metrics.recordStoreFailure(repositoryName, operationName);
        }
    }

    /**
     * Exception indicating a Redis operation timeout.
     */
    public static class RedisTimeoutException extends StoreUnavailableException {
        private final String operation;

        public RedisTimeoutException(String operation, String repository) {
            super(repository, "Redis operation timeout: " + operation + " in " + repository);
            this.operation = operation;
        }

        /** Returns the name of the operation that timed out. */
        public String getOperation() {
            return operation;
        }

        /** Returns the repository where the timeout occurred. */
        public String getRepository() {
            return store();
        }
    }
}
