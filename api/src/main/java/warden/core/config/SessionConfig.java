package warden.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for session lifecycle behaviour.
 *
 * <p>Configuration prefix: {@code warden.session}
 */
@ConfigMapping(prefix = "warden.session")
public interface SessionConfig {

    /**
     * Revoke the whole session chain when an already-rotated refresh token is presented.
     *
     * <p>Reuse is always rejected and reported as a security event. Enabling this
     * additionally signs out the legitimate holder of the chain, which is the
     * usual response when reuse is treated as evidence of token theft.
     *
     * @return true to revoke the chain on reuse (default: false)
     */
    @WithDefault("false")
    boolean revokeChainOnReuse();
}
