package warden.system.filter;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.mock.TestConfigs;

@DisplayName("TrustedProxies")
class TrustedProxiesTest {

    @Nested
    @DisplayName("Default private ranges")
    class DefaultRangeTests {

        private final TrustedProxies proxies = new TrustedProxies(TestConfigs.TRUSTED_PROXIES);

        @Test
        @DisplayName("should trust private IPv4 ranges and loopback")
        void shouldTrustPrivateIpv4() {
            assertTrue(proxies.isTrusted("10.1.2.3"));
            assertTrue(proxies.isTrusted("172.31.255.254"));
            assertTrue(proxies.isTrusted("192.168.0.10"));
            assertTrue(proxies.isTrusted("127.0.0.1"));
        }

        @Test
        @DisplayName("should respect a prefix that ends inside an octet")
        void shouldMaskPartialOctet() {
            assertTrue(proxies.isTrusted("172.16.0.1"));
            assertFalse(proxies.isTrusted("172.32.0.1"));
            assertFalse(proxies.isTrusted("172.15.255.255"));
        }

        @Test
        @DisplayName("should trust IPv6 loopback and unique local addresses")
        void shouldTrustIpv6() {
            assertTrue(proxies.isTrusted("::1"));
            assertTrue(proxies.isTrusted("fd12:3456::1"));
            assertFalse(proxies.isTrusted("2001:db8::1"));
        }

        @Test
        @DisplayName("should not trust public addresses")
        void shouldNotTrustPublic() {
            assertFalse(proxies.isTrusted("203.0.113.7"));
            assertFalse(proxies.isTrusted("8.8.8.8"));
        }

        @Test
        @DisplayName("should not trust missing or non-literal peers")
        void shouldNotTrustNonLiterals() {
            assertFalse(proxies.isTrusted(null));
            assertFalse(proxies.isTrusted(""));
            assertFalse(proxies.isTrusted("unknown"));
            assertFalse(proxies.isTrusted("localhost"));
        }
    }

    @Nested
    @DisplayName("Configured entries")
    class EntryTests {

        @Test
        @DisplayName("should match a bare address exactly")
        void shouldMatchExactAddress() {
            var proxies = new TrustedProxies(List.of("198.51.100.10"));

            assertTrue(proxies.isTrusted("198.51.100.10"));
            assertFalse(proxies.isTrusted("198.51.100.11"));
        }

        @Test
        @DisplayName("should skip malformed entries and keep the valid ones")
        void shouldSkipMalformedEntries() {
            var proxies = new TrustedProxies(List.of("not-an-ip/8", "10.0.0.0/33", "10.0.0.0/x", " 192.168.0.0/16 "));

            assertTrue(proxies.isTrusted("192.168.1.1"));
            assertFalse(proxies.isTrusted("10.0.0.1"));
        }

        @Test
        @DisplayName("should never match an IPv4 peer against an IPv6 range")
        void shouldNotMixFamilies() {
            var proxies = new TrustedProxies(List.of("::/0"));

            assertTrue(proxies.isTrusted("2001:db8::1"));
            assertFalse(proxies.isTrusted("203.0.113.7"));
        }
    }
}
