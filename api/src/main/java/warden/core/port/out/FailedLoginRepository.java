package warden.core.port.out;

import java.time.Duration;

import io.smallrye.mutiny.Uni;

/**
 * Counters of consecutive failed logins per login identifier, keyed {@code failed_login:{identifier}}.
 */
public interface FailedLoginRepository {

    /**
     * Current failure state of an identifier.
     *
     * @param count     failures recorded in the current window
     * @param remaining time until the counter expires, {@link Duration#ZERO} when absent
     */
    record FailureState(long count, Duration remaining) {

        public static FailureState none() {
            return new FailureState(0, Duration.ZERO);
        }
    }

    /**
     * Read the failure state of an identifier.
     *
     * @param identifier normalized login identifier
     * @return Uni with the state
     */
    Uni<FailureState> get(String identifier);

    /**
     * Increment the failure counter and extend its lifetime to {@code window}.
     *
     * @param identifier normalized login identifier
     * @param window     counter lifetime
     * @return Uni with the new count
     */
    Uni<Long> recordFailure(String identifier, Duration window);

    /**
     * Clear the failure counter.
     *
     * @param identifier normalized login identifier
     * @return Uni completing when cleared
     */
    Uni<Void> clear(String identifier);
}
