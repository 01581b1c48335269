package warden.core.service.auth;

import java.security.SecureRandom;
import java.util.Base64;

import jakarta.enterprise.context.ApplicationScoped;

/**
 * Generate cryptographically secure refresh secrets.
 *
 * <p>Secrets are 32 bytes (256 bits) of random data encoded as URL-safe
 * Base64 without padding.
 */
@ApplicationScoped
public class RefreshTokenGenerator {

    private static final int SECRET_BYTES = 32;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    /**
     * Generate a new refresh secret.
     *
     * @return a URL-safe Base64 encoded secret (43 characters)
     */
    public String generate() {
        byte[] bytes = new byte[SECRET_BYTES];
        SECURE_RANDOM.nextBytes(bytes);
        return ENCODER.encodeToString(bytes);
    }
}
