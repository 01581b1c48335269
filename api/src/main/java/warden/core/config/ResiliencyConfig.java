package warden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for store timeouts and retry.
 *
 * <p>Configuration prefix: {@code warden.resiliency}
 *
 * <p>This configuration controls:
 * <ul>
 *   <li>Redis command timeouts (revocation registry, permission cache, counters)</li>
 *   <li>JDBC statement timeouts (relational session store)</li>
 *   <li>Bounded retry with backoff for transient store failures</li>
 * </ul>
 *
 * <p>Operations that decide whether a credential is accepted fail closed once
 * retries are exhausted.
 */
@ConfigMapping(prefix = "warden.resiliency")
public interface ResiliencyConfig {

    /**
     * Redis timeout configuration.
     */
    RedisConfig redis();

    /**
     * JDBC timeout configuration.
     */
    JdbcConfig jdbc();

    /**
     * Retry configuration for transient store failures.
     */
    RetryConfig retry();

    /**
     * Redis timeout settings.
     */
    interface RedisConfig {

        /**
         * Maximum time to wait for a Redis command.
         *
         * @return operation timeout (default: 1 second)
         */
        @WithDefault("PT1S")
        Duration operationTimeout();
    }

    /**
     * JDBC timeout settings.
     */
    interface JdbcConfig {

        /**
         * Statement timeout applied to every query.
         *
         * @return query timeout (default: 5 seconds)
         */
        @WithDefault("PT5S")
        Duration queryTimeout();
    }

    /**
     * Retry settings.
     */
    interface RetryConfig {

        /**
         * Retries after the first failed attempt.
         *
         * @return retry count (default: 2)
         */
        @WithDefault("2")
        int maxRetries();

        /**
         * Backoff before the first retry; doubles for every further retry.
         *
         * @return initial backoff (default: 50 milliseconds)
         */
        @WithDefault("PT0.05S")
        Duration initialBackoff();

        /**
         * Upper bound for the backoff.
         *
         * @return max backoff (default: 500 milliseconds)
         */
        @WithDefault("PT0.5S")
        Duration maxBackoff();
    }
}
