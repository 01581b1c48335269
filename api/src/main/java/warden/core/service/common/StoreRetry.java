package warden.core.service.common;

import java.time.Duration;
import java.util.function.Supplier;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.ResiliencyConfig;
import warden.core.model.auth.AuthErrorCode;
import warden.core.model.auth.AuthException;
import warden.core.model.common.StoreUnavailableException;

/**
 * Bounded retry with exponential backoff for store operations.
 *
 * <p>Only {@link StoreUnavailableException} is retried. Business failures
 * ({@link AuthException}) and programming errors pass through untouched. When
 * retries are exhausted the failure becomes {@link AuthErrorCode#STORE_UNAVAILABLE},
 * so callers deny rather than allow.
 */
@ApplicationScoped
public class StoreRetry {

    private static final Logger LOG = Logger.getLogger(StoreRetry.class);
    private static final Duration RETRY_AFTER = Duration.ofSeconds(1);

    private final int maxRetries;
    private final Duration initialBackoff;
    private final Duration maxBackoff;

    @Inject
    public StoreRetry(ResiliencyConfig config) {
        this(config.retry().maxRetries(), config.retry().initialBackoff(), config.retry().maxBackoff());
    }

    public StoreRetry(int maxRetries, Duration initialBackoff, Duration maxBackoff) {
        this.maxRetries = maxRetries;
        this.initialBackoff = initialBackoff;
        this.maxBackoff = maxBackoff;
    }

    /**
     * Subscribe to {@code operation}, re-subscribing on store failures, and fail
     * closed once retries run out.
     *
     * @param operation     supplier of the store call; invoked once per attempt
     * @param operationName name for logging
     * @param <T>           the result type
     * @return a Uni that fails with {@code STORE_UNAVAILABLE} after the last attempt fails
     */
    public <T> Uni<T> failClosed(Supplier<Uni<T>> operation, String operationName) {
        Uni<T> uni = Uni.createFrom().deferred(operation::get);
        if (maxRetries > 0) {
            uni = uni.onFailure(StoreUnavailableException.class)
                    .invoke(e -> LOG.debugv("Store operation {0} failed, retrying: {1}", operationName, e.getMessage()))
                    .onFailure(StoreUnavailableException.class)
                    .retry()
                    .withBackOff(initialBackoff, maxBackoff)
                    .atMost(maxRetries);
        }
        return uni.onFailure(StoreUnavailableException.class).transform(e -> {
            LOG.errorv(e, "Store operation {0} failed after {1} retries", operationName, maxRetries);
            return new AuthException(AuthErrorCode.STORE_UNAVAILABLE, RETRY_AFTER, e);
        });
    }

    public int maxRetries() {
        return maxRetries;
    }
}
