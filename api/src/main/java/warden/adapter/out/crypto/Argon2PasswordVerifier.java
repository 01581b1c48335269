package warden.adapter.out.crypto;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import de.mkammerer.argon2.Argon2;
import de.mkammerer.argon2.Argon2Factory;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.PasswordConfig;
import warden.core.model.auth.AuthErrorCode;
import warden.core.model.auth.AuthException;
import warden.core.port.out.PasswordVerifier;

/**
 * Argon2id password hashing on a dedicated bounded thread pool.
 *
 * <p>Hashes are PHC strings ({@code $argon2id$v=19$m=...,t=...,p=...$salt$hash}).
 * When the pool and its queue are full, verification fails with
 * {@link AuthErrorCode#OVERLOADED} instead of queueing unbounded work.
 */
@ApplicationScoped
public class Argon2PasswordVerifier implements PasswordVerifier {

    private static final Logger LOG = Logger.getLogger(Argon2PasswordVerifier.class);

    private static final int SALT_LENGTH = 16;
    private static final int HASH_LENGTH = 32;
    private static final Duration SATURATED_RETRY_AFTER = Duration.ofSeconds(1);
    private static final char[] DUMMY_PASSWORD = "warden-timing-equalization".toCharArray();

    private final Argon2 argon2;
    private final int iterations;
    private final int memoryKib;
    private final int parallelism;
    private final ExecutorService pool;
    private final String dummyHash;

    @Inject
    public Argon2PasswordVerifier(PasswordConfig config) {
        this(config.iterations(), config.memoryKib(), config.parallelism(), config.workerThreads(), config.queueSize());
    }

    public Argon2PasswordVerifier(int iterations, int memoryKib, int parallelism, int workerThreads, int queueSize) {
        this.argon2 = Argon2Factory.create(Argon2Factory.Argon2Types.ARGON2id, SALT_LENGTH, HASH_LENGTH);
        this.iterations = iterations;
        this.memoryKib = memoryKib;
        this.parallelism = parallelism;
        this.pool = newPool(workerThreads, queueSize);
        // Unknown emails are verified against this so that timing matches a real account
        this.dummyHash = argon2.hash(iterations, memoryKib, parallelism, DUMMY_PASSWORD.clone());
        LOG.infof(
                "Initialized Argon2id verifier (t=%d, m=%dKiB, p=%d, threads=%d, queue=%d)",
                iterations, memoryKib, parallelism, workerThreads, queueSize);
    }

    @Override
    public Uni<Boolean> verify(String encodedHash, char[] password) {
        return offload(() -> {
            try {
                return argon2.verify(encodedHash, password);
            } catch (IllegalArgumentException e) {
                LOG.warnv("Stored password hash could not be parsed: {0}", e.getMessage());
                return false;
            } finally {
                argon2.wipeArray(password);
            }
        });
    }

    @Override
    public Uni<Boolean> verifyDummy(char[] password) {
        return offload(() -> {
            try {
                argon2.verify(dummyHash, password);
                return false;
            } finally {
                argon2.wipeArray(password);
            }
        });
    }

    @Override
    public Uni<String> hash(char[] password) {
        return offload(() -> {
            try {
                return argon2.hash(iterations, memoryKib, parallelism, password);
            } finally {
                argon2.wipeArray(password);
            }
        });
    }

    @PreDestroy
    public void shutdown() {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private <T> Uni<T> offload(Supplier<T> work) {
        return Uni.createFrom()
                .item(work)
                .runSubscriptionOn(pool)
                .onFailure(RejectedExecutionException.class)
                .transform(e -> {
                    LOG.warn("Password verification pool saturated, rejecting request");
                    return new AuthException(AuthErrorCode.OVERLOADED, SATURATED_RETRY_AFTER, e);
                });
    }

    private static ExecutorService newPool(int threads, int queueSize) {
        final var counter = new AtomicInteger();
        return new ThreadPoolExecutor(
                threads,
                threads,
                60,
                TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(queueSize),
                r -> {
                    final var t = new Thread(r, "warden-password-" + counter.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy());
    }
}
