package warden.core.model.session;

/**
 * Lifecycle of a single refresh-token instance.
 *
 * <p>{@code ROTATED}, {@code REVOKED} and {@code EXPIRED} are terminal. A
 * rotation starts a new instance in {@code ISSUED}. Relationally a rotated
 * record is indistinguishable from a revoked one; both carry {@code revoked_at}.
 */
public enum SessionState {
    ISSUED,
    ACTIVE,
    ROTATED,
    REVOKED,
    EXPIRED;

    public boolean isTerminal() {
        return this == ROTATED || this == REVOKED || this == EXPIRED;
    }
}
