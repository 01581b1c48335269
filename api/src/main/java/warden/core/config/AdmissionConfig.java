package warden.core.config;

import java.time.Duration;
import java.util.List;
import java.util.OptionalInt;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for admission control (backpressure).
 *
 * <p>Configuration prefix: {@code warden.admission}
 *
 * <p>{@code max-concurrent} should stay below {@code quarkus.datasource.jdbc.max-size}
 * so that admission control reacts before the connection pool is exhausted.
 */
@ConfigMapping(prefix = "warden.admission")
public interface AdmissionConfig {

    /**
     * Enable or disable admission control.
     *
     * @return true if enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Requests allowed to execute concurrently.
     *
     * @return permit count (default: 50)
     */
    @WithDefault("50")
    int maxConcurrent();

    /**
     * Requests allowed to wait for a permit.
     *
     * @return queue capacity (default: 100)
     */
    @WithDefault("100")
    int queueCapacity();

    /**
     * Active plus queued requests at which new arrivals are rejected without queueing.
     *
     * @return reject threshold (default: max-concurrent + queue-capacity)
     */
    OptionalInt rejectThreshold();

    /**
     * Longest a request may wait for a permit.
     *
     * @return wait timeout (default: 3 seconds)
     */
    @WithDefault("PT3S")
    Duration waitTimeout();

    /**
     * Retry hint when rejected because the reject threshold was reached.
     *
     * @return retry-after (default: 5 seconds)
     */
    @WithDefault("PT5S")
    Duration overloadedRetryAfter();

    /**
     * Retry hint when rejected because the wait queue is full.
     *
     * @return retry-after (default: 1 second)
     */
    @WithDefault("PT1S")
    Duration queueFullRetryAfter();

    /**
     * Retry hint when the wait timeout elapsed.
     *
     * @return retry-after (default: 2 seconds)
     */
    @WithDefault("PT2S")
    Duration queueTimeoutRetryAfter();

    /**
     * Path prefixes that bypass admission control.
     *
     * @return bypass prefixes (default: health, metrics and JWKS)
     */
    @WithDefault("/q/health,/q/metrics,/.well-known/jwks.json")
    List<String> bypassPaths();
}
