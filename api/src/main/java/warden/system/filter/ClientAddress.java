package warden.system.filter;

import java.util.Locale;

import jakarta.ws.rs.container.ContainerRequestContext;

import io.vertx.core.http.HttpServerRequest;

/**
 * Resolves the client address of a request.
 *
 * <p>When the connecting peer is a trusted proxy, the resolution order is
 * RFC 7239 {@code Forwarded} {@code for=}, the first {@code X-Forwarded-For}
 * entry, then the socket's remote address. Any other peer is identified by its
 * socket address alone.
 */
public final class ClientAddress {

    public static final String UNKNOWN = "unknown";

    private ClientAddress() {}

    public static String resolve(
            ContainerRequestContext ctx, HttpServerRequest request, TrustedProxies trustedProxies) {
        return resolve(
                ctx.getHeaderString("Forwarded"),
                ctx.getHeaderString("X-Forwarded-For"),
                remoteHost(request),
                trustedProxies);
    }

    public static String resolve(
            String forwarded, String xForwardedFor, String remoteAddress, TrustedProxies trustedProxies) {
        if (!trustedProxies.isTrusted(remoteAddress)) {
            return orUnknown(remoteAddress);
        }

        // RFC 7239 Forwarded header (preferred)
        if (forwarded != null) {
            final var ip = parseForwardedFor(forwarded);
            if (ip != null && !ip.isBlank()) {
                return ip;
            }
        }

        if (xForwardedFor != null && !xForwardedFor.isBlank()) {
            return xForwardedFor.split(",")[0].trim();
        }

        return orUnknown(remoteAddress);
    }

    private static String orUnknown(String remoteAddress) {
        return remoteAddress == null || remoteAddress.isBlank() ? UNKNOWN : remoteAddress;
    }

    public static String remoteHost(HttpServerRequest request) {
        if (request == null || request.remoteAddress() == null) {
            return null;
        }
        return request.remoteAddress().hostAddress();
    }

    /**
     * Parse the client IP from an RFC 7239 Forwarded header.
     *
     * @param forwarded the Forwarded header value
     * @return the client IP, or null if not found
     */
    static String parseForwardedFor(String forwarded) {
        // Multiple entries: the first one is closest to the client
        final var firstEntry = forwarded.split(",")[0].trim();

        for (final var part : firstEntry.split(";")) {
            final var trimmed = part.trim();
            if (trimmed.toLowerCase(Locale.ROOT).startsWith("for=")) {
                var value = trimmed.substring(4);
                if (value.startsWith("\"") && value.endsWith("\"") && value.length() >= 2) {
                    value = value.substring(1, value.length() - 1);
                }
                // Bracketed IPv6, optionally followed by a port
                if (value.startsWith("[")) {
                    final var bracketEnd = value.indexOf(']');
                    if (bracketEnd > 0) {
                        return value.substring(1, bracketEnd);
                    }
                }
                // IPv4 with port has exactly one colon
                final var colonCount = value.length() - value.replace(":", "").length();
                if (colonCount == 1) {
                    value = value.substring(0, value.indexOf(':'));
                }
                return value;
            }
        }
        return null;
    }
}
