package warden.core.model.auth;

/**
 * Stable, machine-readable failure codes surfaced to callers.
 *
 * <p>Messages are environment-agnostic and never carry store details.
 */
public enum AuthErrorCode {
    INVALID_CREDENTIALS("Invalid email or password", false),
    ACCOUNT_LOCKED("Account temporarily locked due to too many failed login attempts", true),
    ACCOUNT_DISABLED("Account is disabled", false),
    TOKEN_EXPIRED("Token has expired", false),
    TOKEN_REVOKED("Token has been revoked", false),
    TOKEN_NOT_FOUND("Token not found", false),
    INVALID_SIGNATURE("Token signature is invalid", false),
    MALFORMED("Token is malformed", false),
    RATE_LIMITED("Too many requests", true),
    OVERLOADED("Service is overloaded", true),
    QUEUE_TIMEOUT("Request timed out waiting for capacity", true),
    STORE_UNAVAILABLE("Service temporarily unavailable", true),
    SYSTEM_ROLE_PROTECTED("System roles cannot be deleted", false),
    INTERNAL("An internal error occurred", false);

    private final String message;
    private final boolean retryable;

    AuthErrorCode(String message, boolean retryable) {
        this.message = message;
        this.retryable = retryable;
    }

    /**
     * Caller-facing message for this code.
     */
    public String message() {
        return message;
    }

    /**
     * Whether the caller may retry later (the failure carries a retry hint).
     */
    public boolean retryable() {
        return retryable;
    }
}
