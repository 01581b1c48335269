package warden.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Selects the storage backends.
 *
 * <p>Configuration prefix: {@code warden.storage}
 *
 * <p>The in-memory backends are for tests and single-instance development:
 * they are not shared between instances and are lost on restart.
 */
@ConfigMapping(prefix = "warden.storage")
public interface StorageConfig {

    /**
     * Backend for the revocation registry, permission cache and login failure counters.
     *
     * @return {@code redis} or {@code memory} (default: redis)
     */
    @WithDefault("redis")
    String registry();

    /**
     * Backend for refresh-token records, accounts and RBAC tables.
     *
     * @return {@code jdbc} or {@code memory} (default: jdbc)
     */
    @WithDefault("jdbc")
    String relational();
}
