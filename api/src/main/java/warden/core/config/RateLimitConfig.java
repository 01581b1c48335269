package warden.core.config;

import java.time.Duration;
import java.util.List;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for per-endpoint rate limiting.
 *
 * <p>Configuration prefix: {@code warden.rate-limit}
 *
 * <p>Example configuration:
 * <pre>
 * warden.rate-limit.enabled=true
 * warden.rate-limit.login.requests=5
 * warden.rate-limit.login.window=PT60S
 * </pre>
 */
@ConfigMapping(prefix = "warden.rate-limit")
public interface RateLimitConfig {

    /**
     * Enable or disable rate limiting.
     *
     * @return true if enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Include {@code X-RateLimit-*} headers in rejections.
     *
     * @return true to include headers (default: true)
     */
    @WithDefault("true")
    boolean includeHeaders();

    /**
     * Peers allowed to name the client through {@code Forwarded} or
     * {@code X-Forwarded-For}. Requests from any other peer are budgeted by
     * their socket address. Entries are IP literals or CIDR ranges.
     *
     * @return trusted proxy addresses (default: private ranges and loopback)
     */
    @WithDefault("10.0.0.0/8,172.16.0.0/12,192.168.0.0/16,127.0.0.0/8,::1/128,fd00::/8")
    List<String> trustedProxies();

    /**
     * Limit for {@code POST /auth/login}.
     */
    LoginLimit login();

    /**
     * Limit for {@code POST /auth/refresh}.
     */
    RefreshLimit refresh();

    /**
     * Limit for {@code POST /auth/logout}.
     */
    LogoutLimit logout();

    /**
     * Limit for every other endpoint.
     */
    DefaultLimit defaults();

    interface LoginLimit {
        /** @return requests per window (default: 5) */
        @WithDefault("5")
        long requests();

        /** @return window length (default: 60 seconds) */
        @WithDefault("PT60S")
        Duration window();
    }

    interface RefreshLimit {
        /** @return requests per window (default: 10) */
        @WithDefault("10")
        long requests();

        /** @return window length (default: 60 seconds) */
        @WithDefault("PT60S")
        Duration window();
    }

    interface LogoutLimit {
        /** @return requests per window (default: 10) */
        @WithDefault("10")
        long requests();

        /** @return window length (default: 60 seconds) */
        @WithDefault("PT60S")
        Duration window();
    }

    interface DefaultLimit {
        /** @return requests per window (default: 100) */
        @WithDefault("100")
        long requests();

        /** @return window length (default: 60 seconds) */
        @WithDefault("PT60S")
        Duration window();
    }
}
