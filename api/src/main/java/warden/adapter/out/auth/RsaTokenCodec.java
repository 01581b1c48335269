package warden.adapter.out.auth;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jwa.AlgorithmConstraints.ConstraintType;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.ErrorCodes;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.lang.JoseException;

import warden.core.config.TokenConfig;
import warden.core.model.auth.AccessTokenClaims;
import warden.core.model.auth.AuthErrorCode;
import warden.core.model.auth.IssuedAccessToken;
import warden.core.model.auth.SubjectAuthorization;
import warden.core.model.auth.TokenVerification;
import warden.core.port.out.TokenCodec;
import warden.core.service.auth.RefreshTokenGenerator;

/**
 * RS256 (RSA with SHA-256) access token codec.
 *
 * <p>Tokens carry {@code iss}, {@code sub}, {@code iat}, {@code exp}, {@code jti}
 * and the {@code roles} and {@code permissions} string arrays. A token missing
 * any of them, or carrying them with the wrong type, is rejected as
 * {@link AuthErrorCode#MALFORMED}.
 */
@ApplicationScoped
public class RsaTokenCodec implements TokenCodec {

    private static final Logger LOG = Logger.getLogger(RsaTokenCodec.class);

    static final String ROLES_CLAIM = "roles";
    static final String PERMISSIONS_CLAIM = "permissions";

    private static final AlgorithmConstraints RS256_ONLY =
            new AlgorithmConstraints(ConstraintType.PERMIT, AlgorithmIdentifiers.RSA_USING_SHA256);

    private final TokenConfig config;
    private final RsaSigningKeys keys;
    private final RefreshTokenGenerator refreshTokenGenerator;
    private final Clock clock;

    @Inject
    public RsaTokenCodec(
            TokenConfig config, RsaSigningKeys keys, RefreshTokenGenerator refreshTokenGenerator, Clock clock) {
        this.config = config;
        this.keys = keys;
        this.refreshTokenGenerator = refreshTokenGenerator;
        this.clock = clock;
    }

    @Override
    public IssuedAccessToken issueAccessToken(String subjectId, SubjectAuthorization authorization, Duration ttl) {
        final var issuedAt = Instant.ofEpochSecond(clock.instant().getEpochSecond());
        final var expiresAt = issuedAt.plusSeconds(Math.max(1, ttl.toSeconds()));
        final var claims = new AccessTokenClaims(
                subjectId,
                authorization.roles(),
                authorization.permissions(),
                UUID.randomUUID().toString(),
                issuedAt,
                expiresAt);

        try {
            return new IssuedAccessToken(sign(toJwtClaims(claims)), claims);
        } catch (JoseException e) {
            throw new TokenIssuanceException("Failed to sign token: " + e.getMessage(), e);
        }
    }

    @Override
    public String issueRefreshToken() {
        return refreshTokenGenerator.generate();
    }

    @Override
    public TokenVerification verifyAccessToken(String token) {
        final var consumer = new JwtConsumerBuilder()
                .setRequireSubject()
                .setRequireExpirationTime()
                .setRequireIssuedAt()
                .setRequireJwtId()
                .setExpectedIssuer(config.issuer())
                .setSkipDefaultAudienceValidation()
                .setAllowedClockSkewInSeconds((int) config.clockSkew().toSeconds())
                .setEvaluationTime(NumericDate.fromMilliseconds(clock.millis()))
                .setVerificationKey(keys.publicKey())
                .setJwsAlgorithmConstraints(RS256_ONLY)
                .build();
        try {
            return toVerified(consumer.processToClaims(token));
        } catch (InvalidJwtException e) {
            LOG.debugv("Access token rejected: {0}", e.getMessage());
            return new TokenVerification.Rejected(classify(e), e.getMessage());
        }
    }

    @Override
    public TokenVerification decodeAccessToken(String token) {
        final var consumer = new JwtConsumerBuilder()
                .setSkipAllValidators()
                .setVerificationKey(keys.publicKey())
                .setJwsAlgorithmConstraints(RS256_ONLY)
                .build();
        try {
            final var claims = consumer.processToClaims(token);
            if (!config.issuer().equals(claims.getIssuer())) {
                return new TokenVerification.Rejected(AuthErrorCode.INVALID_SIGNATURE, "Unexpected issuer");
            }
            return toVerified(claims);
        } catch (InvalidJwtException e) {
            LOG.debugv("Access token could not be decoded: {0}", e.getMessage());
            return new TokenVerification.Rejected(classify(e), e.getMessage());
        } catch (MalformedClaimException e) {
            return new TokenVerification.Rejected(AuthErrorCode.MALFORMED, e.getMessage());
        }
    }

    @Override
    public String publicKeySetJson() {
        return keys.publicKeySetJson();
    }

    private JwtClaims toJwtClaims(AccessTokenClaims claims) {
        final var jwt = new JwtClaims();
        jwt.setIssuer(config.issuer());
        jwt.setSubject(claims.subject());
        jwt.setIssuedAt(NumericDate.fromSeconds(claims.issuedAt().getEpochSecond()));
        jwt.setExpirationTime(NumericDate.fromSeconds(claims.expiresAt().getEpochSecond()));
        jwt.setJwtId(claims.jti());
        jwt.setStringListClaim(ROLES_CLAIM, claims.roles());
        jwt.setStringListClaim(PERMISSIONS_CLAIM, claims.permissions());
        return jwt;
    }

    private String sign(JwtClaims claims) throws JoseException {
        final var jws = new JsonWebSignature();
        jws.setPayload(claims.toJson());
        jws.setKey(keys.privateKey());
        jws.setKeyIdHeaderValue(keys.keyId());
        jws.setAlgorithmHeaderValue(AlgorithmIdentifiers.RSA_USING_SHA256);
        return jws.getCompactSerialization();
    }

    private TokenVerification toVerified(JwtClaims jwt) {
        try {
            final var subject = jwt.getSubject();
            final var jti = jwt.getJwtId();
            final var issuedAt = jwt.getIssuedAt();
            final var expiresAt = jwt.getExpirationTime();
            final var roles = jwt.getStringListClaimValue(ROLES_CLAIM);
            final var permissions = jwt.getStringListClaimValue(PERMISSIONS_CLAIM);

            if (subject == null || jti == null || issuedAt == null || expiresAt == null) {
                return new TokenVerification.Rejected(AuthErrorCode.MALFORMED, "Missing registered claim");
            }
            if (roles == null || permissions == null) {
                return new TokenVerification.Rejected(AuthErrorCode.MALFORMED, "Missing roles or permissions claim");
            }

            return new TokenVerification.Verified(new AccessTokenClaims(
                    subject,
                    roles,
                    permissions,
                    jti,
                    Instant.ofEpochSecond(issuedAt.getValue()),
                    Instant.ofEpochSecond(expiresAt.getValue())));
        } catch (MalformedClaimException e) {
            return new TokenVerification.Rejected(AuthErrorCode.MALFORMED, e.getMessage());
        }
    }

    private AuthErrorCode classify(InvalidJwtException e) {
        if (e.hasErrorCode(ErrorCodes.SIGNATURE_INVALID) || e.hasErrorCode(ErrorCodes.SIGNATURE_MISSING)) {
            return AuthErrorCode.INVALID_SIGNATURE;
        }
        if (e.hasExpired()) {
            return AuthErrorCode.TOKEN_EXPIRED;
        }
        if (e.hasErrorCode(ErrorCodes.ISSUER_INVALID)) {
            return AuthErrorCode.INVALID_SIGNATURE;
        }
        return AuthErrorCode.MALFORMED;
    }

    /**
     * Exception thrown when token signing fails.
     */
    public static class TokenIssuanceException extends RuntimeException {
        public TokenIssuanceException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
