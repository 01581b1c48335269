package warden.core.model.ratelimit;

import java.util.Locale;

/**
 * Groups endpoints that share a rate-limit budget.
 */
public enum EndpointClass {
    LOGIN,
    REFRESH,
    LOGOUT,
    DEFAULT;

    /**
     * Lower-case name used in counter keys and metrics tags.
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Classify a request path.
     *
     * @param path the request path, with or without leading slash
     * @return the matching class, {@link #DEFAULT} when none matches
     */
    public static EndpointClass forPath(String path) {
        if (path == null) {
            return DEFAULT;
        }
        final var normalized = path.startsWith("/") ? path : "/" + path;
        return switch (normalized) {
            case "/auth/login" -> LOGIN;
            case "/auth/refresh" -> REFRESH;
            case "/auth/logout" -> LOGOUT;
            default -> DEFAULT;
        };
    }
}
