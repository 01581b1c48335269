package warden.core.port.out;

import io.smallrye.mutiny.Uni;

/**
 * Slow, memory-hard password hashing.
 *
 * <p>Implementations run the hashing work off the event loop on a bounded pool.
 */
public interface PasswordVerifier {

    /**
     * Verify a password against an encoded hash.
     *
     * <p>The password array is wiped once verification completes.
     *
     * @param encodedHash the stored hash
     * @param password    the presented password
     * @return Uni with true when the password matches
     */
    Uni<Boolean> verify(String encodedHash, char[] password);

    /**
     * Spend the same work as {@link #verify} against a fixed dummy hash.
     *
     * <p>Used for unknown accounts so that response time does not reveal
     * whether an account exists. Always yields false.
     *
     * @param password the presented password
     * @return Uni with false
     */
    Uni<Boolean> verifyDummy(char[] password);

    /**
     * Hash a password for storage.
     *
     * @param password the password, wiped afterwards
     * @return Uni with the encoded hash
     */
    Uni<String> hash(char[] password);
}
