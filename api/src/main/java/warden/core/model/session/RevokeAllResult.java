package warden.core.model.session;

/**
 * Counts reported by a revoke-all operation.
 *
 * @param revokedSessions refresh records newly marked revoked
 * @param revokedTokens   access-token jtis blacklisted
 */
public record RevokeAllResult(int revokedSessions, int revokedTokens) {}
