package warden.core.service.admission;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.core.model.admission.AdmissionPermit;
import warden.core.model.auth.AuthErrorCode;
import warden.core.model.auth.AuthException;

@DisplayName("AdmissionController")
class AdmissionControllerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(2);
    private static final Duration OVERLOADED_RETRY = Duration.ofSeconds(5);
    private static final Duration QUEUE_FULL_RETRY = Duration.ofSeconds(2);
    private static final Duration QUEUE_TIMEOUT_RETRY = Duration.ofSeconds(3);

    private static AdmissionController controller(
            int maxConcurrent, int queueCapacity, int rejectThreshold, Duration waitTimeout) {
        return new AdmissionController(
                true,
                maxConcurrent,
                queueCapacity,
                rejectThreshold,
                waitTimeout,
                OVERLOADED_RETRY,
                QUEUE_FULL_RETRY,
                QUEUE_TIMEOUT_RETRY,
                List.of("/q/health", "/q/metrics"));
    }

    private static AdmissionPermit acquireNow(AdmissionController controller) {
        return controller.acquire().await().atMost(TIMEOUT);
    }

    @Nested
    @DisplayName("Immediate admission")
    class ImmediateAdmissionTests {

        @Test
        @DisplayName("should admit up to maxConcurrent requests at once")
        void shouldAdmitUpToMaxConcurrent() {
            var controller = controller(2, 2, 10, Duration.ofSeconds(1));

            var first = acquireNow(controller);
            var second = acquireNow(controller);

            assertNotNull(first);
            assertNotNull(second);
            assertEquals(2, controller.snapshot().active());
            assertEquals(2, controller.snapshot().totalAdmitted());
        }

        @Test
        @DisplayName("closing a permit twice should release only one slot")
        void doubleCloseShouldReleaseOnce() {
            var controller = controller(2, 0, 10, Duration.ofSeconds(1));
            var first = acquireNow(controller);
            acquireNow(controller);

            first.close();
            first.close();

            assertTrue(first.isReleased());
            assertEquals(1, controller.snapshot().active());
        }
    }

    @Nested
    @DisplayName("Queueing")
    class QueueTests {

        @Test
        @DisplayName("a queued request should receive the next released permit")
        void queuedRequestShouldReceiveReleasedPermit() throws Exception {
            var controller = controller(1, 2, 10, Duration.ofSeconds(5));
            var holder = acquireNow(controller);

            var pending = controller.acquire().subscribeAsCompletionStage();
            assertFalse(pending.isDone());
            assertEquals(1, controller.snapshot().queued());

            holder.close();

            var handedOver = pending.get(2, TimeUnit.SECONDS);
            assertNotNull(handedOver);
            assertEquals(1, controller.snapshot().active());
            assertEquals(0, controller.snapshot().queued());

            handedOver.close();
            assertEquals(0, controller.snapshot().active());
        }

        @Test
        @DisplayName("waiters should be served in arrival order")
        void waitersShouldBeServedInOrder() throws Exception {
            var controller = controller(1, 2, 10, Duration.ofSeconds(5));
            var holder = acquireNow(controller);
            var firstWaiter = controller.acquire().subscribeAsCompletionStage();
            var secondWaiter = controller.acquire().subscribeAsCompletionStage();

            holder.close();

            var firstPermit = firstWaiter.get(2, TimeUnit.SECONDS);
            assertFalse(secondWaiter.isDone());

            firstPermit.close();
            assertNotNull(secondWaiter.get(2, TimeUnit.SECONDS));
        }

        @Test
        @DisplayName("a waiter should time out with QUEUE_TIMEOUT and leave the queue")
        void waiterShouldTimeOut() {
            var controller = controller(1, 1, 10, Duration.ofMillis(50));
            acquireNow(controller);

            var error = assertThrows(AuthException.class, () -> acquireNow(controller));

            assertEquals(AuthErrorCode.QUEUE_TIMEOUT, error.code());
            assertEquals(3, error.retryAfterSeconds());
            assertEquals(0, controller.snapshot().queued());
            assertEquals(1, controller.snapshot().totalTimedOut());
            assertEquals(1, controller.snapshot().active());
        }

        @Test
        @DisplayName("a cancelled waiter should leave the queue")
        void cancelledWaiterShouldLeaveQueue() {
            var controller = controller(1, 1, 10, Duration.ofSeconds(5));
            acquireNow(controller);

            var cancellable = controller.acquire().subscribe().with(permit -> {}, failure -> {});
            assertEquals(1, controller.snapshot().queued());

            cancellable.cancel();

            assertEquals(0, controller.snapshot().queued());
        }
    }

    @Nested
    @DisplayName("Rejection")
    class RejectionTests {

        @Test
        @DisplayName("should reject with the queue-full delay when the queue is full")
        void shouldRejectWhenQueueFull() {
            var controller = controller(1, 1, 10, Duration.ofSeconds(5));
            acquireNow(controller);
            controller.acquire().subscribe().with(permit -> {}, failure -> {});

            var error = assertThrows(AuthException.class, () -> acquireNow(controller));

            assertEquals(AuthErrorCode.OVERLOADED, error.code());
            assertEquals(2, error.retryAfterSeconds());
            assertEquals(1, controller.snapshot().totalRejected());
        }

        @Test
        @DisplayName("should reject with the overloaded delay at the reject threshold")
        void shouldRejectAtThreshold() {
            var controller = controller(2, 5, 2, Duration.ofSeconds(5));
            acquireNow(controller);
            acquireNow(controller);

            var error = assertThrows(AuthException.class, () -> acquireNow(controller));

            assertEquals(AuthErrorCode.OVERLOADED, error.code());
            assertEquals(5, error.retryAfterSeconds());
            assertEquals(0, controller.snapshot().queued());
        }
    }

    @Test
    @DisplayName("should never run more than maxConcurrent requests under load")
    void shouldBoundConcurrency() throws InterruptedException {
        var maxConcurrent = 3;
        var controller = controller(maxConcurrent, 100, 200, Duration.ofSeconds(10));
        var requests = 40;
        var executor = Executors.newFixedThreadPool(16);
        var inFlight = new AtomicInteger();
        var peak = new AtomicInteger();
        var completed = new AtomicInteger();
        var done = new CountDownLatch(requests);
        var failures = new ArrayList<Throwable>();

        for (int i = 0; i < requests; i++) {
            executor.submit(() -> {
                try (var permit = controller.acquire().await().atMost(Duration.ofSeconds(10))) {
                    var now = inFlight.incrementAndGet();
                    peak.accumulateAndGet(now, Math::max);
                    Thread.sleep(2);
                    inFlight.decrementAndGet();
                    completed.incrementAndGet();
                } catch (Exception e) {
                    synchronized (failures) {
                        failures.add(e);
                    }
                } finally {
                    done.countDown();
                }
            });
        }

        assertTrue(done.await(20, TimeUnit.SECONDS));
        executor.shutdownNow();
        assertTrue(failures.isEmpty(), () -> "unexpected failures: " + failures);
        assertEquals(requests, completed.get());
        assertTrue(peak.get() <= maxConcurrent, "peak " + peak.get());
        assertEquals(0, controller.snapshot().active());
        assertEquals(0, controller.snapshot().queued());
    }

    @Test
    @DisplayName("a disabled controller should admit everything without counting")
    void disabledControllerShouldAdmitEverything() {
        var controller = new AdmissionController(
                false,
                1,
                0,
                1,
                Duration.ofSeconds(1),
                OVERLOADED_RETRY,
                QUEUE_FULL_RETRY,
                QUEUE_TIMEOUT_RETRY,
                List.of());

        for (int i = 0; i < 5; i++) {
            assertNotNull(acquireNow(controller));
        }
        assertEquals(0, controller.snapshot().active());
        assertFalse(controller.isEnabled());
    }

    @Test
    @DisplayName("should bypass configured path prefixes only")
    void shouldBypassConfiguredPaths() {
        var controller = controller(1, 1, 10, Duration.ofSeconds(1));

        assertTrue(controller.isBypassed("/q/health/ready"));
        assertTrue(controller.isBypassed("/q/metrics"));
        assertFalse(controller.isBypassed("/auth/login"));
        assertFalse(controller.isBypassed(null));
    }

    @Test
    @DisplayName("snapshot should report utilization and status")
    void snapshotShouldReportUtilization() {
        var controller = controller(4, 0, 10, Duration.ofSeconds(1));
        for (int i = 0; i < 3; i++) {
            acquireNow(controller);
        }

        var snapshot = controller.snapshot();

        assertEquals(0.75, snapshot.utilization(), 0.0001);
        assertEquals("warning", snapshot.status());
    }

    @Test
    @DisplayName("should refuse a non-positive maxConcurrent")
    void shouldRefuseInvalidMaxConcurrent() {
        assertThrows(IllegalArgumentException.class, () -> controller(0, 1, 10, Duration.ofSeconds(1)));
    }
}
