package warden.mock;

import java.util.concurrent.atomic.AtomicInteger;

import io.smallrye.mutiny.Uni;

import warden.core.port.out.PasswordVerifier;

/**
 * Password verifier storing {@code plain:<password>}; keeps session tests fast.
 */
public class PlainPasswordVerifier implements PasswordVerifier {

    private static final String PREFIX = "plain:";

    private final AtomicInteger dummyVerifications = new AtomicInteger();

    public static String encode(String password) {
        return PREFIX + password;
    }

    @Override
    public Uni<Boolean> verify(String encodedHash, char[] password) {
        return Uni.createFrom().item(() -> encodedHash.equals(PREFIX + new String(password)));
    }

    @Override
    public Uni<Boolean> verifyDummy(char[] password) {
        dummyVerifications.incrementAndGet();
        return Uni.createFrom().item(false);
    }

    @Override
    public Uni<String> hash(char[] password) {
        return Uni.createFrom().item(() -> PREFIX + new String(password));
    }

    public int dummyVerifications() {
        return dummyVerifications.get();
    }
}
