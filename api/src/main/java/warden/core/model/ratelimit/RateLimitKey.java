package warden.core.model.ratelimit;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Counter key for one (client, endpoint class, window) combination.
 *
 * <p>Serialized as {@code ratelimit:{client_id}:{endpoint_class}:{window_id}}
 * where {@code window_id} is the epoch second of the window start divided by
 * the window length.
 *
 * @param clientId      client identity (hashed address)
 * @param endpointClass endpoint class
 * @param windowId      window number
 */
public record RateLimitKey(String clientId, EndpointClass endpointClass, long windowId) {

    public static final String PREFIX = "ratelimit:";

    public RateLimitKey {
        Objects.requireNonNull(clientId, "clientId cannot be null");
        Objects.requireNonNull(endpointClass, "endpointClass cannot be null");
    }

    /**
     * Build the key for the window containing {@code now}.
     */
    public static RateLimitKey forWindow(String clientId, EndpointClass endpointClass, Duration window, Instant now) {
        return new RateLimitKey(clientId, endpointClass, windowId(window, now));
    }

    public static long windowId(Duration window, Instant now) {
        final var seconds = window.toSeconds();
        if (seconds < 1) {
            throw new IllegalArgumentException("window must be at least one second, got: " + window);
        }
        return Math.floorDiv(now.getEpochSecond(), seconds);
    }

    /**
     * Start of the window following this one.
     */
    public Instant windowEnd(Duration window) {
        return Instant.ofEpochSecond((windowId + 1) * window.toSeconds());
    }

    public String toCacheKey() {
        return PREFIX + clientId + ":" + endpointClass.key() + ":" + windowId;
    }
}
