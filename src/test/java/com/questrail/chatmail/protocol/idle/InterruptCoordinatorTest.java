package com.questrail.chatmail.protocol.idle;

import com.questrail.chatmail.api.Transport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * InterruptCoordinatorTest
 * -----------------------------------------------------------------------------
 * Wake-up semantics of a single transport's coordinator. Blocking cases run
 * the waiter on a helper thread and bound every wait.
 */
class InterruptCoordinatorTest {

    private static final Duration LONG = Duration.ofSeconds(30);

    private InterruptCoordinator coordinator;
    private ExecutorService waiter;

    @BeforeEach
    void setUp() {
        coordinator = new InterruptCoordinator(Transport.PRIMARY_MAILBOX);
        waiter = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        coordinator.shutdown();
        waiter.shutdownNow();
    }

    // ---------------------------------------------------------------------
    // Pending interrupts
    // ---------------------------------------------------------------------

    @Test
    void interruptBeforeAwaitIsConsumedOnce() {
        coordinator.interrupt();
        coordinator.interrupt();
        assertTrue(coordinator.isInterruptPending());

        assertEquals(WakeReason.INTERRUPTED, coordinator.await(LONG));
        assertFalse(coordinator.isInterruptPending());
        assertEquals(WakeReason.TIMED_OUT, coordinator.await(Duration.ofMillis(20)));
    }

    @Test
    void awaitTimesOutWithoutInterrupt() {
        assertEquals(WakeReason.TIMED_OUT, coordinator.await(Duration.ofMillis(20)));
        assertEquals(WakeReason.TIMED_OUT, coordinator.await(Duration.ZERO));
    }

    @Test
    void interruptWakesBlockedWaiter() throws Exception {
        CountDownLatch waiting = new CountDownLatch(1);
        Future<WakeReason> result = waiter.submit(() -> {
            waiting.countDown();
            return coordinator.await(LONG);
        });
        assertTrue(waiting.await(5, TimeUnit.SECONDS));
        Thread.sleep(50);

        coordinator.interrupt();

        assertEquals(WakeReason.INTERRUPTED, result.get(5, TimeUnit.SECONDS));
    }

    // ---------------------------------------------------------------------
    // Shutdown
    // ---------------------------------------------------------------------

    @Test
    void shutdownWakesWaiterAndIsPermanent() throws Exception {
        Future<WakeReason> result = waiter.submit(() -> coordinator.await(LONG));
        Thread.sleep(50);

        coordinator.shutdown();

        assertEquals(WakeReason.SHUTDOWN, result.get(5, TimeUnit.SECONDS));
        assertTrue(coordinator.isShutdown());
        coordinator.interrupt();
        assertEquals(WakeReason.SHUTDOWN, coordinator.await(LONG));
        assertFalse(coordinator.enterHandle());
    }

    // ---------------------------------------------------------------------
    // Suspension and handle tracking
    // ---------------------------------------------------------------------

    @Test
    void suspendedWaiterIgnoresTimeoutUntilResumed() throws Exception {
        coordinator.suspend();
        Future<WakeReason> result = waiter.submit(() -> coordinator.await(Duration.ofMillis(10)));

        assertThrows(TimeoutException.class, () -> result.get(200, TimeUnit.MILLISECONDS));

        coordinator.resume();

        WakeReason reason = result.get(5, TimeUnit.SECONDS);
        assertNotEquals(WakeReason.SHUTDOWN, reason);
        assertFalse(coordinator.isSuspended());
    }

    @Test
    void enterHandleRefusedWhileSuspended() {
        coordinator.suspend();
        assertFalse(coordinator.enterHandle());

        coordinator.resume();
        assertTrue(coordinator.enterHandle());
        coordinator.leaveHandle();
    }

    @Test
    void awaitHandleReleasedBlocksUntilLastLeave() throws Exception {
        assertTrue(coordinator.enterHandle());
        assertTrue(coordinator.enterHandle());

        Future<Boolean> released = waiter.submit(coordinator::awaitHandleReleased);
        coordinator.leaveHandle();
        assertThrows(TimeoutException.class, () -> released.get(100, TimeUnit.MILLISECONDS));

        coordinator.leaveHandle();
        assertTrue(released.get(5, TimeUnit.SECONDS));
    }

    @Test
    void awaitHandleReleasedReturnsAtOnceWhenUnused() {
        assertTrue(coordinator.awaitHandleReleased());
    }
}
