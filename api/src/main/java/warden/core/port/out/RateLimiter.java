package warden.core.port.out;

import java.time.Duration;

import io.smallrye.mutiny.Uni;

import warden.core.model.ratelimit.RateLimitDecision;
import warden.core.model.ratelimit.RateLimitKey;

/**
 * Port interface for window-based rate limiting.
 *
 * <p>Implementations must increment and compare in one atomic step so that
 * concurrent requests cannot both observe "under limit" and both pass.
 */
public interface RateLimiter {

    /**
     * Count a request against {@code key} and decide whether it is allowed.
     *
     * @param key    counter key for the current window
     * @param limit  requests permitted per window
     * @param window window length
     * @return Uni with the decision
     */
    Uni<RateLimitDecision> checkAndIncrement(RateLimitKey key, long limit, Duration window);

    /**
     * Check if rate limiting is enabled.
     *
     * @return true if enabled
     */
    boolean isEnabled();
}
