package warden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for login lockout (brute force protection).
 *
 * <p>Configuration prefix: {@code warden.lockout}
 */
@ConfigMapping(prefix = "warden.lockout")
public interface LockoutConfig {

    /**
     * Enable or disable login lockout.
     *
     * @return true if enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Failed attempts after which the login identifier is locked.
     *
     * @return threshold (default: 5)
     */
    @WithDefault("5")
    int maxFailedAttempts();

    /**
     * How long the failure counter lives. Each failure extends it, so this is
     * also the lockout duration once the threshold is reached.
     *
     * @return lockout duration (default: 15 minutes)
     */
    @WithDefault("PT15M")
    Duration lockoutDuration();
}
