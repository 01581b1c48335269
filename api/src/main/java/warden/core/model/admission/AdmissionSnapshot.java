package warden.core.model.admission;

/**
 * Point-in-time view of the admission controller.
 *
 * @param active          requests holding a permit
 * @param queued          requests waiting for a permit
 * @param maxConcurrent   permits available
 * @param queueCapacity   waiting slots available
 * @param rejectThreshold active+queued at which new requests are rejected outright
 * @param totalAdmitted   permits granted since start
 * @param totalRejected   requests rejected as overloaded since start
 * @param totalTimedOut   requests that gave up waiting since start
 */
public record AdmissionSnapshot(
        int active,
        int queued,
        int maxConcurrent,
        int queueCapacity,
        int rejectThreshold,
        long totalAdmitted,
        long totalRejected,
        long totalTimedOut) {

    private static final double WARNING_UTILIZATION = 0.7;
    private static final double CRITICAL_UTILIZATION = 0.85;

    /**
     * Fraction of permits in use.
     */
    public double utilization() {
        return maxConcurrent == 0 ? 0.0 : (double) active / maxConcurrent;
    }

    /**
     * {@code healthy} below 70% utilization, {@code warning} below 85%, otherwise {@code critical}.
     */
    public String status() {
        final var utilization = utilization();
        if (utilization < WARNING_UTILIZATION) {
            return "healthy";
        }
        if (utilization < CRITICAL_UTILIZATION) {
            return "warning";
        }
        return "critical";
    }
}
