package warden.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

import warden.core.model.common.SecurityEvent;
import warden.core.port.out.SecurityMonitoring;

/**
 * Writes security events to the {@code warden.security} log category.
 *
 * <p>Log levels are based on event severity:
 * <ul>
 *   <li>INFO severity → INFO level</li>
 *   <li>WARNING severity → WARN level</li>
 *   <li>CRITICAL severity → ERROR level</li>
 * </ul>
 *
 * <p>Client addresses and login identifiers arrive hashed; raw credentials
 * never reach this class.
 */
@ApplicationScoped
public class SecurityEventLogger implements SecurityMonitoring {

    private static final Logger LOG = Logger.getLogger("warden.security");

    @Override
    public void record(SecurityEvent event) {
        final var message = formatEvent(event);

        switch (event.severity()) {
            case INFO -> LOG.info(message);
            case WARNING -> LOG.warn(message);
            case CRITICAL -> LOG.error(message);
        }
    }

    String formatEvent(SecurityEvent event) {
        if (event instanceof SecurityEvent.LoginFailed e) {
            return String.format(
                    "LOGIN_FAILED: client=%s identity=%s reason=%s failures=%d",
                    e.clientHash(), e.identityHash(), e.reason(), e.failureCount());
        }
        if (event instanceof SecurityEvent.LoginLocked e) {
            return String.format(
                    "LOGIN_LOCKED: client=%s identity=%s retryAfter=%ds",
                    e.clientHash(), e.identityHash(), e.retryAfterSeconds());
        }
        if (event instanceof SecurityEvent.RefreshTokenReuse e) {
            return String.format(
                    "REFRESH_TOKEN_REUSE: subject=%s chain=%s chainRevoked=%s",
                    e.subjectId(), e.chainId(), e.chainRevoked());
        }
        if (event instanceof SecurityEvent.SessionsRevoked e) {
            return String.format(
                    "SESSIONS_REVOKED: subject=%s sessions=%d tokens=%d",
                    e.subjectId(), e.revokedSessions(), e.revokedTokens());
        }
        if (event instanceof SecurityEvent.RateLimitExceeded e) {
            return String.format(
                    "RATE_LIMIT: client=%s endpoint=%s requests=%d limit=%d",
                    e.clientHash(), e.endpointClass(), e.requestCount(), e.limit());
        }
        return event.toString();
    }
}
