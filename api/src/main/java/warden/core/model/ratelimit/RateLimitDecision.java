package warden.core.model.ratelimit;

import java.time.Instant;

/**
 * Result of a rate limit check.
 *
 * @param allowed           whether the request is allowed
 * @param limit             requests permitted per window
 * @param remaining         requests left in the current window
 * @param windowSeconds     window length in seconds
 * @param resetAt           when the current window ends
 * @param retryAfterSeconds seconds until a retry can succeed (only meaningful when rejected)
 * @param requestCount      requests counted in the current window, this one included
 */
public record RateLimitDecision(
        boolean allowed,
        long limit,
        long remaining,
        long windowSeconds,
        Instant resetAt,
        long retryAfterSeconds,
        long requestCount) {

    /**
     * Allowed decision used when limiting is disabled or the counter store is unreachable.
     *
     * @return an allowed decision
     */
    public static RateLimitDecision allow() {
        return new RateLimitDecision(true, Long.MAX_VALUE, Long.MAX_VALUE, 0, Instant.MAX, 0, 0);
    }

    public static RateLimitDecision fromCount(long count, long limit, long windowSeconds, Instant resetAt, Instant now) {
        if (count <= limit) {
            return new RateLimitDecision(true, limit, limit - count, windowSeconds, resetAt, 0, count);
        }
        final var untilReset = resetAt.getEpochSecond() - now.getEpochSecond();
        return new RateLimitDecision(false, limit, 0, windowSeconds, resetAt, Math.max(1, untilReset), count);
    }

    public long resetAtEpochSeconds() {
        return resetAt.getEpochSecond();
    }
}
