package warden.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for token issuance and verification.
 *
 * <p>Configuration prefix: {@code warden.token}
 */
@ConfigMapping(prefix = "warden.token")
public interface TokenConfig {

    /**
     * Issuer written to and required in the {@code iss} claim.
     *
     * @return issuer (default: warden)
     */
    @WithDefault("warden")
    String issuer();

    /**
     * Access token lifetime.
     *
     * @return access token TTL (default: 30 minutes)
     */
    @WithDefault("PT30M")
    Duration accessTokenTtl();

    /**
     * Refresh token lifetime.
     *
     * @return refresh token TTL (default: 7 days)
     */
    @WithDefault("P7D")
    Duration refreshTokenTtl();

    /**
     * Key identifier placed in the JWS {@code kid} header and the published JWK set.
     *
     * @return key id (default: warden-key-1)
     */
    @WithDefault("warden-key-1")
    String keyId();

    /**
     * RSA private key in PEM (PKCS#8) form.
     *
     * <p>When absent an ephemeral 2048-bit key pair is generated at startup.
     * Tokens signed with an ephemeral key do not survive a restart and are not
     * shared between instances, so production deployments must set this.
     *
     * @return PEM-encoded private key
     */
    Optional<String> signingKey();

    /**
     * Clock skew tolerated when checking {@code exp}.
     *
     * @return allowed skew (default: 0)
     */
    @WithDefault("PT0S")
    Duration clockSkew();
}
