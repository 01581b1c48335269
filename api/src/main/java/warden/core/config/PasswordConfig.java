package warden.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for Argon2id password verification.
 *
 * <p>Configuration prefix: {@code warden.password}
 *
 * <p>Verification parameters are read from each stored hash; the values here
 * apply to hashes this service produces (the timing-equalization dummy hash
 * and {@code hash()} for account provisioning).
 */
@ConfigMapping(prefix = "warden.password")
public interface PasswordConfig {

    /**
     * Threads in the bounded pool that runs hashing and verification.
     *
     * @return worker count (default: 4)
     */
    @WithDefault("4")
    int workerThreads();

    /**
     * Verifications allowed to wait for a worker before new ones are refused.
     *
     * @return queue size (default: 256)
     */
    @WithDefault("256")
    int queueSize();

    /**
     * Argon2 iterations.
     *
     * @return iterations (default: 3)
     */
    @WithDefault("3")
    int iterations();

    /**
     * Argon2 memory cost in KiB.
     *
     * @return memory (default: 65536)
     */
    @WithDefault("65536")
    int memoryKib();

    /**
     * Argon2 parallelism.
     *
     * @return parallelism (default: 1)
     */
    @WithDefault("1")
    int parallelism();
}
