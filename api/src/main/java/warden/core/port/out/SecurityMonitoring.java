package warden.core.port.out;

import warden.core.model.common.SecurityEvent;

/**
 * Port for recording security events.
 *
 * <p>Implementations must not block and must not throw.
 */
public interface SecurityMonitoring {

    /**
     * Record a security event.
     *
     * @param event the event
     */
    void record(SecurityEvent event);
}
