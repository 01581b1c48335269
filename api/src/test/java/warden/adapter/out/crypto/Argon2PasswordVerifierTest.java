package warden.adapter.out.crypto;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Argon2PasswordVerifier")
class Argon2PasswordVerifierTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private static Argon2PasswordVerifier verifier;

    @BeforeAll
    static void setUp() {
        // Minimal cost parameters keep the test fast
        verifier = new Argon2PasswordVerifier(1, 1024, 1, 2, 16);
    }

    @AfterAll
    static void tearDown() {
        verifier.shutdown();
    }

    @Test
    @DisplayName("should produce an argon2id PHC string that verifies")
    void shouldHashAndVerify() {
        final var hash = verifier.hash("correct-horse".toCharArray()).await().atMost(TIMEOUT);

        assertTrue(hash.startsWith("$argon2id$"));
        assertTrue(verifier.verify(hash, "correct-horse".toCharArray()).await().atMost(TIMEOUT));
    }

    @Test
    @DisplayName("should reject a wrong password")
    void shouldRejectWrongPassword() {
        final var hash = verifier.hash("correct-horse".toCharArray()).await().atMost(TIMEOUT);

        assertFalse(verifier.verify(hash, "battery-staple".toCharArray()).await().atMost(TIMEOUT));
    }

    @Test
    @DisplayName("should salt every hash")
    void shouldSaltHashes() {
        final var first = verifier.hash("same".toCharArray()).await().atMost(TIMEOUT);
        final var second = verifier.hash("same".toCharArray()).await().atMost(TIMEOUT);

        assertNotEquals(first, second);
    }

    @Test
    @DisplayName("should treat an unparseable stored hash as a mismatch")
    void shouldRejectGarbageHash() {
        assertFalse(verifier.verify("not-a-hash", "anything".toCharArray()).await().atMost(TIMEOUT));
    }

    @Test
    @DisplayName("dummy verification should always fail")
    void dummyShouldFail() {
        assertFalse(verifier.verifyDummy("warden-timing-equalization".toCharArray())
                .await()
                .atMost(TIMEOUT));
    }

    @Test
    @DisplayName("should wipe the password buffer after use")
    void shouldWipePassword() {
        final var password = "correct-horse".toCharArray();

        verifier.hash(password).await().atMost(TIMEOUT);

        for (char c : password) {
            assertTrue(c == 0);
        }
    }
}
