package warden.system.filter;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import warden.core.config.RateLimitConfig;

/**
 * Decides whether a connecting peer may name the client in forwarding headers.
 *
 * <p>Entries are parsed once at construction. Malformed entries are logged and
 * skipped. Peer addresses are compared as IP literals only; hostnames are never
 * resolved.
 */
@ApplicationScoped
public class TrustedProxies {

    private static final Logger LOG = Logger.getLogger(TrustedProxies.class);

    private final List<Network> networks;

    private record Network(byte[] address, int prefixLength) {

        boolean contains(byte[] candidate) {
            if (candidate.length != address.length) {
                return false;
            }
            final var fullBytes = prefixLength / 8;
            final var remainingBits = prefixLength % 8;
            for (var i = 0; i < fullBytes; i++) {
                if (address[i] != candidate[i]) {
                    return false;
                }
            }
            if (remainingBits > 0) {
                final var mask = (byte) (0xFF << (8 - remainingBits));
                return (address[fullBytes] & mask) == (candidate[fullBytes] & mask);
            }
            return true;
        }
    }

    @Inject
    public TrustedProxies(RateLimitConfig config) {
        this(config.trustedProxies());
    }

    public TrustedProxies(List<String> entries) {
        final var parsed = new ArrayList<Network>();
        for (final var entry : entries) {
            final var network = parse(entry.trim());
            if (network != null) {
                parsed.add(network);
            }
        }
        this.networks = List.copyOf(parsed);
        LOG.debugf("Trusting forwarding headers from %d network(s)", networks.size());
    }

    /**
     * @param peerAddress the socket address of the direct connection
     * @return true if forwarding headers from this peer should be honoured
     */
    public boolean isTrusted(String peerAddress) {
        final var candidate = parseLiteral(peerAddress);
        if (candidate == null) {
            return false;
        }
        for (final var network : networks) {
            if (network.contains(candidate)) {
                return true;
            }
        }
        return false;
    }

    private static Network parse(String entry) {
        if (entry.isEmpty()) {
            return null;
        }
        final var slash = entry.indexOf('/');
        final var addressPart = slash < 0 ? entry : entry.substring(0, slash);
        final var address = parseLiteral(addressPart);
        if (address == null) {
            LOG.warnf("Ignoring trusted proxy entry with an invalid address: %s", entry);
            return null;
        }
        final var maxPrefix = address.length * 8;
        if (slash < 0) {
            return new Network(address, maxPrefix);
        }
        try {
            final var prefixLength = Integer.parseInt(entry.substring(slash + 1));
            if (prefixLength < 0 || prefixLength > maxPrefix) {
                LOG.warnf("Ignoring trusted proxy entry with prefix length out of range (max %d): %s", maxPrefix, entry);
                return null;
            }
            return new Network(address, prefixLength);
        } catch (NumberFormatException e) {
            LOG.warnf("Ignoring trusted proxy entry with an invalid prefix length: %s", entry);
            return null;
        }
    }

    /**
     * Parse an IP literal, or return null for anything else. Only literals
     * reach {@link InetAddress#getByName}, so no DNS lookup happens.
     */
    private static byte[] parseLiteral(String input) {
        if (!isIpLiteral(input)) {
            return null;
        }
        try {
            return InetAddress.getByName(input).getAddress();
        } catch (UnknownHostException e) {
            return null;
        }
    }

    private static boolean isIpLiteral(String input) {
        if (input == null || input.isEmpty()) {
            return false;
        }
        if (input.indexOf(':') >= 0) {
            for (var i = 0; i < input.length(); i++) {
                final var c = input.charAt(i);
                if (c != ':' && c != '.' && Character.digit(c, 16) < 0) {
                    return false;
                }
            }
            return true;
        }
        if (!Character.isDigit(input.charAt(0))) {
            return false;
        }
        for (var i = 0; i < input.length(); i++) {
            final var c = input.charAt(i);
            if (c != '.' && !Character.isDigit(c)) {
                return false;
            }
        }
        return true;
    }
}
