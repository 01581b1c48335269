package warden.core.service.auth;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.TokenConfig;
import warden.core.model.auth.AccessTokenClaims;
import warden.core.model.common.SecurityEvent;
import warden.core.model.session.RevokeAllResult;
import warden.core.port.out.RefreshTokenRepository;
import warden.core.port.out.SecurityMonitoring;
import warden.core.port.out.TokenRevocationRepository;
import warden.core.service.common.StoreRetry;

/**
 * Service for access-token revocation.
 *
 * <p>Every lookup and write goes to the shared registry. There is no local
 * cache, so a revocation made through one instance is observed by the next
 * check on any other instance. A lookup that cannot be answered fails the
 * check rather than reporting the token as valid.
 */
@ApplicationScoped
public class TokenRevocationService {

    private static final Logger LOG = Logger.getLogger(TokenRevocationService.class);

    private final TokenRevocationRepository registry;
    private final RefreshTokenRepository refreshTokens;
    private final TokenConfig tokenConfig;
    private final StoreRetry storeRetry;
    private final SecurityMonitoring securityMonitoring;
    private final Clock clock;

    public TokenRevocationService(
            TokenRevocationRepository registry,
            RefreshTokenRepository refreshTokens,
            TokenConfig tokenConfig,
            StoreRetry storeRetry,
            SecurityMonitoring securityMonitoring,
            Clock clock) {
        this.registry = registry;
        this.refreshTokens = refreshTokens;
        this.tokenConfig = tokenConfig;
        this.storeRetry = storeRetry;
        this.securityMonitoring = securityMonitoring;
        this.clock = clock;
    }

    /**
     * Record a newly issued access token so that revoke-all can find it.
     *
     * @param subjectId the token subject
     * @param jti       the token id
     * @return Uni completing when recorded
     */
    public Uni<Void> registerActive(String subjectId, String jti) {
        return storeRetry.failClosed(
                () -> registry.registerActive(subjectId, jti, tokenConfig.accessTokenTtl()), "registerActive");
    }

    /**
     * Check if a token is revoked.
     *
     * @param jti the token id
     * @return Uni with true if revoked; fails with STORE_UNAVAILABLE when the registry cannot answer
     */
    public Uni<Boolean> isRevoked(String jti) {
        return storeRetry.failClosed(() -> registry.isBlacklisted(jti), "isBlacklisted");
    }

    /**
     * Revoke one access token for the rest of its lifetime and drop it from
     * the subject's active set.
     *
     * @param claims claims of the token being revoked
     * @return Uni completing when revoked
     */
    public Uni<Void> revokeToken(AccessTokenClaims claims) {
        final var remaining = claims.remainingLifetime(clock.instant());
        LOG.debugf("Revoking token %s of %s (remaining: %s)", claims.jti(), claims.subject(), remaining);

        return storeRetry
                .failClosed(() -> registry.blacklist(claims.jti(), remaining), "blacklist")
                .chain(() -> storeRetry.failClosed(
                        () -> registry.unregisterActive(claims.subject(), claims.jti()), "unregisterActive"));
    }

    /**
     * Revoke every session and access token of a subject.
     *
     * <p>Steps run in order: revoke refresh records, read the active set,
     * blacklist each jti for the full access-token lifetime, delete the set.
     * Any failing step fails the whole call; every step is idempotent so the
     * call can be repeated.
     *
     * @param subjectId the subject
     * @return Uni with the number of refresh records and access tokens revoked
     */
    public Uni<RevokeAllResult> revokeAll(String subjectId) {
        final var now = clock.instant();
        final var ttl = tokenConfig.accessTokenTtl();

        return storeRetry
                .failClosed(() -> refreshTokens.revokeAllForSubject(subjectId, now), "revokeAllForSubject")
                .chain(sessions -> storeRetry
                        .failClosed(() -> registry.activeJtis(subjectId), "activeJtis")
                        .chain(jtis -> blacklistAll(jtis, ttl))
                        .call(() -> storeRetry.failClosed(() -> registry.clearActive(subjectId), "clearActive"))
                        .map(tokens -> new RevokeAllResult(sessions, tokens)))
                .invoke(result -> {
                    LOG.infof(
                            "Revoked all sessions for %s (sessions: %d, tokens: %d)",
                            subjectId, result.revokedSessions(), result.revokedTokens());
                    securityMonitoring.record(new SecurityEvent.SessionsRevoked(
                            now, subjectId, result.revokedSessions(), result.revokedTokens()));
                });
    }

    private Uni<Integer> blacklistAll(Set<String> jtis, Duration ttl) {
        if (jtis.isEmpty()) {
            return Uni.createFrom().item(0);
        }
        final var writes = new ArrayList<Uni<Void>>(jtis.size());
        for (var jti : jtis) {
            writes.add(storeRetry.failClosed(() -> registry.blacklist(jti, ttl), "blacklist"));
        }
        return Uni.join().all(writes).andFailFast().map(done -> jtis.size());
    }
}
