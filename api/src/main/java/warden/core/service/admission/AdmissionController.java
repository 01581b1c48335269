package warden.core.service.admission;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.AdmissionConfig;
import warden.core.model.admission.AdmissionPermit;
import warden.core.model.admission.AdmissionSnapshot;
import warden.core.model.auth.AuthErrorCode;
import warden.core.model.auth.AuthException;

/**
 * Bounds the number of requests processed concurrently.
 *
 * <p>A request either gets a permit at once, waits in a bounded FIFO queue, or
 * is rejected with OVERLOADED. Waiting never blocks a thread: a released
 * permit is handed directly to the oldest waiter, and a waiter that is still
 * queued when its timeout elapses fails with QUEUE_TIMEOUT.
 *
 * <p>{@code active} never exceeds {@code maxConcurrent} and {@code queued}
 * never exceeds {@code queueCapacity}.
 */
@ApplicationScoped
public class AdmissionController {

    private static final Logger LOG = Logger.getLogger(AdmissionController.class);

    private final boolean enabled;
    private final int maxConcurrent;
    private final int queueCapacity;
    private final int rejectThreshold;
    private final Duration waitTimeout;
    private final Duration overloadedRetryAfter;
    private final Duration queueFullRetryAfter;
    private final Duration queueTimeoutRetryAfter;
    private final List<String> bypassPaths;

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<Waiter> waiting = new ArrayDeque<>();
    private int active;

    private final AtomicLong totalAdmitted = new AtomicLong();
    private final AtomicLong totalRejected = new AtomicLong();
    private final AtomicLong totalTimedOut = new AtomicLong();

    @Inject
    public AdmissionController(AdmissionConfig config) {
        this(
                config.enabled(),
                config.maxConcurrent(),
                config.queueCapacity(),
                config.rejectThreshold().orElse(config.maxConcurrent() + config.queueCapacity()),
                config.waitTimeout(),
                config.overloadedRetryAfter(),
                config.queueFullRetryAfter(),
                config.queueTimeoutRetryAfter(),
                config.bypassPaths());
    }

    public AdmissionController(
            boolean enabled,
            int maxConcurrent,
            int queueCapacity,
            int rejectThreshold,
            Duration waitTimeout,
            Duration overloadedRetryAfter,
            Duration queueFullRetryAfter,
            Duration queueTimeoutRetryAfter,
            List<String> bypassPaths) {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be at least 1");
        }
        if (queueCapacity < 0) {
            throw new IllegalArgumentException("queueCapacity cannot be negative");
        }
        this.enabled = enabled;
        this.maxConcurrent = maxConcurrent;
        this.queueCapacity = queueCapacity;
        this.rejectThreshold = rejectThreshold;
        this.waitTimeout = waitTimeout;
        this.overloadedRetryAfter = overloadedRetryAfter;
        this.queueFullRetryAfter = queueFullRetryAfter;
        this.queueTimeoutRetryAfter = queueTimeoutRetryAfter;
        this.bypassPaths = List.copyOf(bypassPaths);
        LOG.infof(
                "Admission control %s (maxConcurrent=%d, queueCapacity=%d, rejectThreshold=%d, waitTimeout=%s)",
                enabled ? "enabled" : "disabled", maxConcurrent, queueCapacity, rejectThreshold, waitTimeout);
    }

    /**
     * Acquire a permit with the configured wait timeout.
     */
    public Uni<AdmissionPermit> acquire() {
        return acquire(waitTimeout);
    }

    /**
     * Acquire a permit, waiting at most {@code timeout} for one to be released.
     *
     * @param timeout maximum time to wait in the queue
     * @return Uni with the permit; fails with OVERLOADED or QUEUE_TIMEOUT
     */
    public Uni<AdmissionPermit> acquire(Duration timeout) {
        if (!enabled) {
            return Uni.createFrom().item(() -> new AdmissionPermit(() -> {}));
        }

        return Uni.createFrom().deferred(() -> {
            final Waiter waiter;
            lock.lock();
            try {
                if (active + waiting.size() >= rejectThreshold) {
                    totalRejected.incrementAndGet();
                    return reject(overloadedRetryAfter, "system overloaded");
                }
                if (active < maxConcurrent) {
                    active++;
                    totalAdmitted.incrementAndGet();
                    return Uni.createFrom().item(newPermit());
                }
                if (waiting.size() >= queueCapacity) {
                    totalRejected.incrementAndGet();
                    return reject(queueFullRetryAfter, "queue full");
                }
                waiter = new Waiter();
                waiting.addLast(waiter);
            } finally {
                lock.unlock();
            }

            return Uni.createFrom()
                    .completionStage(waiter.permit.copy())
                    .ifNoItem()
                    .after(timeout)
                    .recoverWithUni(() -> onWaitTimeout(waiter))
                    .onCancellation()
                    .invoke(() -> abandon(waiter));
        });
    }

    /**
     * Whether requests to {@code path} skip admission control.
     */
    public boolean isBypassed(String path) {
        if (path == null) {
            return false;
        }
        for (var prefix : bypassPaths) {
            if (path.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public AdmissionSnapshot snapshot() {
        lock.lock();
        try {
            return new AdmissionSnapshot(
                    active,
                    waiting.size(),
                    maxConcurrent,
                    queueCapacity,
                    rejectThreshold,
                    totalAdmitted.get(),
                    totalRejected.get(),
                    totalTimedOut.get());
        } finally {
            lock.unlock();
        }
    }

    private Uni<AdmissionPermit> onWaitTimeout(Waiter waiter) {
        lock.lock();
        try {
            if (waiting.remove(waiter)) {
                totalTimedOut.incrementAndGet();
                LOG.debugf("Admission wait timed out after %s", waitTimeout);
                return Uni.createFrom()
                        .failure(new AuthException(AuthErrorCode.QUEUE_TIMEOUT, queueTimeoutRetryAfter));
            }
        } finally {
            lock.unlock();
        }
        // A permit was handed over just as the timeout fired
        return Uni.createFrom().completionStage(waiter.permit.copy());
    }

    private void abandon(Waiter waiter) {
        lock.lock();
        try {
            if (waiting.remove(waiter)) {
                return;
            }
        } finally {
            lock.unlock();
        }
        waiter.permit.thenAccept(AdmissionPermit::close);
    }

    private void release() {
        final Waiter next;
        lock.lock();
        try {
            next = waiting.pollFirst();
            if (next == null) {
                active--;
            } else {
                totalAdmitted.incrementAndGet();
            }
        } finally {
            lock.unlock();
        }
        if (next != null) {
            // The slot passes to the waiter; active is unchanged
            next.permit.complete(newPermit());
        }
    }

    private AdmissionPermit newPermit() {
        return new AdmissionPermit(this::release);
    }

    private Uni<AdmissionPermit> reject(Duration retryAfter, String reason) {
        LOG.debugf("Admission rejected: %s", reason);
        return Uni.createFrom().failure(new AuthException(AuthErrorCode.OVERLOADED, retryAfter));
    }

    private static final class Waiter {
        private final CompletableFuture<AdmissionPermit> permit = new CompletableFuture<>();
    }
}
