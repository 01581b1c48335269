package warden.core.port.out;

/**
 * Port interface for recording service metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface Metrics {

    /**
     * Check if metrics collection is enabled.
     *
     * @return true if enabled
     */
    boolean isEnabled();

    /**
     * Record a store command that exceeded its timeout.
     *
     * @param store     logical store name
     * @param operation operation name
     */
    void recordStoreTimeout(String store, String operation);

    /**
     * Record a store command that failed for a reason other than a timeout.
     *
     * @param store     logical store name
     * @param operation operation name
     */
    void recordStoreFailure(String store, String operation);

    /**
     * Record a request rejected by the rate limiter.
     *
     * @param endpointClass endpoint class key
     */
    void recordRateLimited(String endpointClass);

    /**
     * Record the outcome of a session operation.
     *
     * @param operation login, refresh, logout or revoke_all
     * @param outcome   {@code success} or an error code name
     */
    void recordSessionOutcome(String operation, String outcome);
}
