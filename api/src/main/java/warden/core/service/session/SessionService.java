package warden.core.service.session;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.SessionConfig;
import warden.core.config.TokenConfig;
import warden.core.model.auth.Account;
import warden.core.model.auth.AuthErrorCode;
import warden.core.model.auth.AuthException;
import warden.core.model.auth.ClientContext;
import warden.core.model.auth.IssuedAccessToken;
import warden.core.model.auth.TokenPair;
import warden.core.model.auth.TokenVerification;
import warden.core.model.common.SecurityEvent;
import warden.core.model.session.LoginRecord;
import warden.core.model.session.RefreshTokenLookup;
import warden.core.model.session.RefreshTokenRecord;
import warden.core.model.session.RevokeAllResult;
import warden.core.port.in.SessionManagement;
import warden.core.port.out.AccountRepository;
import warden.core.port.out.Metrics;
import warden.core.port.out.PasswordVerifier;
import warden.core.port.out.RefreshTokenRepository;
import warden.core.port.out.SecurityMonitoring;
import warden.core.port.out.TokenCodec;
import warden.core.service.auth.LoginAttemptService;
import warden.core.service.auth.PermissionCacheService;
import warden.core.service.auth.TokenRevocationService;
import warden.core.service.common.StoreRetry;
import warden.core.util.SecureHash;

/**
 * Login, refresh with rotation, logout and revoke-all.
 *
 * <p>A refresh token is single-use. Rotation revokes the presented record and
 * inserts its successor in one conditional transaction, so of several
 * concurrent refreshes with the same token exactly one succeeds and the rest
 * fail with TOKEN_REVOKED.
 */
@ApplicationScoped
public class SessionService implements SessionManagement {

    private static final Logger LOG = Logger.getLogger(SessionService.class);

    private static final int HASH_PREFIX_LENGTH = 16;
    private static final String FAILURE_INVALID_PASSWORD = "invalid_password";
    private static final String FAILURE_ACCOUNT_DISABLED = "account_disabled";

    private final AccountRepository accounts;
    private final RefreshTokenRepository refreshTokens;
    private final PasswordVerifier passwordVerifier;
    private final TokenCodec tokenCodec;
    private final LoginAttemptService loginAttempts;
    private final PermissionCacheService permissionCache;
    private final TokenRevocationService revocationService;
    private final TokenConfig tokenConfig;
    private final SessionConfig sessionConfig;
    private final StoreRetry storeRetry;
    private final SecurityMonitoring securityMonitoring;
    private final Metrics metrics;
    private final Clock clock;

    public SessionService(
            AccountRepository accounts,
            RefreshTokenRepository refreshTokens,
            PasswordVerifier passwordVerifier,
            TokenCodec tokenCodec,
            LoginAttemptService loginAttempts,
            PermissionCacheService permissionCache,
            TokenRevocationService revocationService,
            TokenConfig tokenConfig,
            SessionConfig sessionConfig,
            StoreRetry storeRetry,
            SecurityMonitoring securityMonitoring,
            Metrics metrics,
            Clock clock) {
        this.accounts = accounts;
        this.refreshTokens = refreshTokens;
        this.passwordVerifier = passwordVerifier;
        this.tokenCodec = tokenCodec;
        this.loginAttempts = loginAttempts;
        this.permissionCache = permissionCache;
        this.revocationService = revocationService;
        this.tokenConfig = tokenConfig;
        this.sessionConfig = sessionConfig;
        this.storeRetry = storeRetry;
        this.securityMonitoring = securityMonitoring;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public Uni<TokenPair> login(String email, char[] password, ClientContext client) {
        final var identifier = LoginAttemptService.normalize(email);
        final var context = client == null ? ClientContext.unknown() : client;

        final var result = loginAttempts
                .checkNotLocked(identifier)
                .onFailure(e -> isCode(e, AuthErrorCode.ACCOUNT_LOCKED))
                .invoke(e -> securityMonitoring.record(new SecurityEvent.LoginLocked(
                        clock.instant(),
                        hash(context.ipAddress()),
                        hash(identifier),
                        ((AuthException) e).retryAfterSeconds())))
                .chain(() -> storeRetry.failClosed(() -> accounts.findByEmail(identifier), "findAccount"))
                .chain(found -> {
                    if (found.isEmpty()) {
                        // Same hashing cost as a real account so timing does not reveal existence
                        return passwordVerifier
                                .verifyDummy(password)
                                .chain(ignored -> rejectCredentials(identifier, context, null));
                    }
                    final var account = found.get();
                    return passwordVerifier.verify(account.passwordHash(), password).chain(matches -> matches
                            ? completeLogin(account, identifier, context)
                            : rejectCredentials(identifier, context, account.subjectId()));
                });

        return track("login", result);
    }

    @Override
    public Uni<TokenPair> refresh(String refreshToken) {
        final var now = clock.instant();
        final var tokenHash = SecureHash.sha256Hex(refreshToken == null ? "" : refreshToken);

        final var result = storeRetry
                .failClosed(() -> refreshTokens.findByTokenHash(tokenHash), "findRefreshToken")
                .chain(found -> {
                    final var lookup = RefreshTokenLookup.of(found, now);
                    if (lookup instanceof RefreshTokenLookup.Active active) {
                        return rotate(active.record(), now);
                    }
                    if (lookup instanceof RefreshTokenLookup.Revoked revoked) {
                        return onRevokedTokenPresented(revoked.record(), now);
                    }
                    if (lookup instanceof RefreshTokenLookup.Expired) {
                        return Uni.createFrom().<TokenPair>failure(new AuthException(AuthErrorCode.TOKEN_EXPIRED));
                    }
                    return Uni.createFrom().<TokenPair>failure(new AuthException(AuthErrorCode.TOKEN_NOT_FOUND));
                });

        return track("refresh", result);
    }

    @Override
    public Uni<Void> logout(String accessToken) {
        final var verification = tokenCodec.decodeAccessToken(accessToken);
        if (verification instanceof TokenVerification.Rejected rejected) {
            LOG.debugf("Logout with unusable token: %s (%s)", rejected.reason(), rejected.detail());
            return track("logout", Uni.createFrom().failure(new AuthException(rejected.reason())));
        }

        final var claims = ((TokenVerification.Verified) verification).claims();
        final var result = revocationService
                .revokeToken(claims)
                .chain(() -> storeRetry.failClosed(
                        () -> refreshTokens.revokeChainByAccessJti(claims.subject(), claims.jti(), clock.instant()),
                        "revokeChainByAccessJti"))
                .invoke(revoked -> LOG.infof(
                        "Logged out %s (token: %s, refresh records revoked: %d)", claims.subject(), claims.jti(), revoked))
                .replaceWithVoid();

        return track("logout", result);
    }

    @Override
    public Uni<RevokeAllResult> revokeAll(String subjectId) {
        return track("revoke_all", revocationService.revokeAll(subjectId));
    }

    @Override
    public Uni<List<RefreshTokenRecord>> listSessions(String subjectId) {
        return storeRetry.failClosed(
                () -> refreshTokens.findActiveBySubject(subjectId, clock.instant()), "findActiveSessions");
    }

    private Uni<TokenPair> completeLogin(Account account, String identifier, ClientContext client) {
        if (!account.active()) {
            LOG.infof("Login refused for disabled account %s", account.subjectId());
            return recordFailedAttempt(account.subjectId(), client, FAILURE_ACCOUNT_DISABLED)
                    .chain(() -> Uni.createFrom().<TokenPair>failure(new AuthException(AuthErrorCode.ACCOUNT_DISABLED)));
        }

        final var subjectId = account.subjectId();
        return loginAttempts
                .reset(identifier)
                .chain(() -> permissionCache.resolve(subjectId))
                .chain(authorization -> {
                    final var now = clock.instant();
                    final var access = tokenCodec.issueAccessToken(subjectId, authorization, tokenConfig.accessTokenTtl());
                    final var refreshSecret = tokenCodec.issueRefreshToken();
                    final var record = RefreshTokenRecord.issue(
                            subjectId,
                            SecureHash.sha256Hex(refreshSecret),
                            access.jti(),
                            client.deviceInfo(),
                            now,
                            now.plus(tokenConfig.refreshTokenTtl()));

                    return storeRetry
                            .failClosed(
                                    () -> refreshTokens.saveLogin(record, LoginRecord.succeeded(subjectId, client, now)),
                                    "saveLogin")
                            .chain(() -> revocationService.registerActive(subjectId, access.jti()))
                            .invoke(() -> LOG.infof("Login succeeded for %s (session: %s)", subjectId, record.chainId()))
                            .map(ignored -> toPair(access, refreshSecret));
                });
    }

    private Uni<TokenPair> rejectCredentials(String identifier, ClientContext client, String knownSubjectId) {
        return recordFailedAttempt(knownSubjectId, client, FAILURE_INVALID_PASSWORD)
                .chain(() -> loginAttempts.recordFailure(identifier))
                .chain(failures -> {
                    securityMonitoring.record(new SecurityEvent.LoginFailed(
                            clock.instant(),
                            hash(client.ipAddress()),
                            hash(identifier),
                            AuthErrorCode.INVALID_CREDENTIALS.name(),
                            failures));
                    return Uni.createFrom().<TokenPair>failure(new AuthException(AuthErrorCode.INVALID_CREDENTIALS));
                });
    }

    /**
     * Append a failure row to the login history of a known account. A write
     * failure is logged and leaves the outcome of the attempt unchanged.
     */
    private Uni<Void> recordFailedAttempt(String subjectId, ClientContext client, String reason) {
        if (subjectId == null) {
            return Uni.createFrom().voidItem();
        }
        final var attempt = LoginRecord.failed(subjectId, client, clock.instant(), reason);
        return refreshTokens.recordFailedLogin(attempt).onFailure().recoverWithItem(e -> {
            LOG.warnv("Could not record failed login for {0}: {1}", subjectId, e.getMessage());
            return null;
        });
    }

    private Uni<TokenPair> rotate(RefreshTokenRecord current, Instant now) {
        final var subjectId = current.subjectId();
        return permissionCache.resolve(subjectId).chain(authorization -> {
            final var access = tokenCodec.issueAccessToken(subjectId, authorization, tokenConfig.accessTokenTtl());
            final var refreshSecret = tokenCodec.issueRefreshToken();
            final var successor = current.successor(
                    SecureHash.sha256Hex(refreshSecret), access.jti(), now, now.plus(tokenConfig.refreshTokenTtl()));

            return storeRetry
                    .failClosed(() -> refreshTokens.rotate(current.id(), successor, now), "rotateRefreshToken")
                    .chain(rotated -> {
                        if (!rotated) {
                            LOG.debugf("Concurrent refresh of %s lost the rotation", current.id());
                            return Uni.createFrom().<TokenPair>failure(new AuthException(AuthErrorCode.TOKEN_REVOKED));
                        }
                        return revocationService
                                .registerActive(subjectId, access.jti())
                                .map(ignored -> toPair(access, refreshSecret));
                    });
        });
    }

    private Uni<TokenPair> onRevokedTokenPresented(RefreshTokenRecord record, Instant now) {
        final var revokeChain = sessionConfig.revokeChainOnReuse();
        final Uni<Integer> chainRevocation = revokeChain
                ? storeRetry.failClosed(() -> refreshTokens.revokeChain(record.chainId(), now), "revokeChain")
                : Uni.createFrom().item(0);

        return chainRevocation.chain(revoked -> {
            LOG.warnv(
                    "Revoked refresh token presented for {0} (chain: {1}, chain revoked: {2}, records: {3})",
                    record.subjectId(), record.chainId(), revokeChain, revoked);
            securityMonitoring.record(new SecurityEvent.RefreshTokenReuse(
                    now, record.subjectId(), record.chainId().toString(), revokeChain));
            return Uni.createFrom().<TokenPair>failure(new AuthException(AuthErrorCode.TOKEN_REVOKED));
        });
    }

    private TokenPair toPair(IssuedAccessToken access, String refreshSecret) {
        final var claims = access.claims();
        return new TokenPair(access, refreshSecret, Duration.between(claims.issuedAt(), claims.expiresAt()));
    }

    private <T> Uni<T> track(String operation, Uni<T> result) {
        if (!metrics.isEnabled()) {
            return result;
        }
        return result.onItem()
                .invoke(() -> metrics.recordSessionOutcome(operation, "success"))
                .onFailure()
                .invoke(e -> metrics.recordSessionOutcome(
                        operation, e instanceof AuthException auth ? auth.code().name() : AuthErrorCode.INTERNAL.name()));
    }

    private static boolean isCode(Throwable e, AuthErrorCode code) {
        return e instanceof AuthException auth && auth.code() == code;
    }

    private static String hash(String value) {
        return SecureHash.truncatedSha256(value == null ? "" : value, HASH_PREFIX_LENGTH);
    }
}
