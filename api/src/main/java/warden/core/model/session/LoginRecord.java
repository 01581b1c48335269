package warden.core.model.session;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

import warden.core.model.auth.ClientContext;

/**
 * Login history row for one attempt against a known account.
 *
 * <p>Successful logins are written in the same transaction as the refresh
 * record; failed attempts are written on their own.
 *
 * @param subjectId     the account the attempt was made against
 * @param client        request metadata
 * @param attemptedAt   time of the attempt
 * @param success       whether the attempt produced a session
 * @param failureReason lower-case failure code, null on success
 */
public record LoginRecord(
        String subjectId, ClientContext client, Instant attemptedAt, boolean success, String failureReason) {

    public LoginRecord {
        Objects.requireNonNull(subjectId, "subjectId cannot be null");
        Objects.requireNonNull(attemptedAt, "attemptedAt cannot be null");
        client = client == null ? ClientContext.unknown() : client;
        if (success && failureReason != null) {
            throw new IllegalArgumentException("A successful login has no failure reason");
        }
        if (!success && (failureReason == null || failureReason.isBlank())) {
            throw new IllegalArgumentException("A failed login requires a failure reason");
        }
    }

    public static LoginRecord succeeded(String subjectId, ClientContext client, Instant at) {
        return new LoginRecord(subjectId, client, at, true, null);
    }

    public static LoginRecord failed(String subjectId, ClientContext client, Instant at, String failureReason) {
        return new LoginRecord(subjectId, client, at, false, failureReason);
    }

    public Map<String, Object> deviceInfo() {
        return client.deviceInfo();
    }
}
