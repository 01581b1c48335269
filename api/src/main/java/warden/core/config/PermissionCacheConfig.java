package warden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the shared permission cache.
 *
 * <p>Configuration prefix: {@code warden.permission-cache}
 */
@ConfigMapping(prefix = "warden.permission-cache")
public interface PermissionCacheConfig {

    /**
     * Maximum staleness of a cached authorization snapshot.
     *
     * @return entry TTL (default: 5 minutes)
     */
    @WithDefault("PT5M")
    Duration ttl();

    /**
     * Keys requested per SCAN round when invalidating every entry.
     *
     * @return scan batch size (default: 500)
     */
    @WithDefault("500")
    int scanBatchSize();

    /**
     * When a role mutation affects more subjects than this, the whole cache is
     * invalidated instead of one entry per subject.
     *
     * @return per-subject fan-out limit (default: 1000)
     */
    @WithDefault("1000")
    int roleFanoutLimit();
}
