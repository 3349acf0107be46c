package com.questrail.chatmail.protocol.idle;

import com.questrail.chatmail.api.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * InterruptCoordinator
 * =============================================================================
 * Wake-up point for the one thread that drives a {@link Transport}.
 *
 * <h2>Semantics</h2>
 * <ul>
 *   <li>{@link #await(Duration)} blocks until {@link #interrupt()}, timeout or
 *       {@link #shutdown()}.</li>
 *   <li>At most one interrupt is pending. An interrupt raised while nobody
 *       waits is remembered, and the next {@code await} consumes it and returns
 *       immediately. Further interrupts before that are absorbed.</li>
 *   <li>While {@linkplain #suspend() suspended}, {@code await} parks until
 *       {@link #resume()} regardless of interrupts or timeout.</li>
 * </ul>
 *
 * <h2>Handle tracking</h2>
 * The transport thread brackets every unit of server work with
 * {@link #enterHandle()} / {@link #leaveHandle()}. An exclusive job running on
 * another transport suspends this coordinator and then calls
 * {@link #awaitHandleReleased()} so that it knows the server connection is
 * no longer in use.
 *
 * <p>All methods are thread-safe and none of them fail.</p>
 */
public final class InterruptCoordinator {
    private static final Logger log = LoggerFactory.getLogger(InterruptCoordinator.class);

    private final Transport transport;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();

    private boolean interruptPending;
    private boolean suspended;
    private boolean shutdown;
    private int handleUsers;

    public InterruptCoordinator(Transport transport) {
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    public Transport transport() {
        return transport;
    }

    /**
     * Blocks the caller until interrupted, the timeout elapses, or shutdown.
     */
    public WakeReason await(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        lock.lock();
        try {
            while (suspended && !shutdown) {
                changed.await();
            }
            if (shutdown) {
                return WakeReason.SHUTDOWN;
            }
            long remaining = timeout.toNanos();
            while (!interruptPending && !shutdown) {
                if (remaining <= 0) {
                    return WakeReason.TIMED_OUT;
                }
                remaining = changed.awaitNanos(remaining);
                while (suspended && !shutdown) {
                    changed.await();
                    // resume() counts as a wake-up
                    interruptPending = true;
                }
            }
            if (shutdown) {
                return WakeReason.SHUTDOWN;
            }
            interruptPending = false;
            return WakeReason.INTERRUPTED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("{} wait interrupted by thread interrupt", transport);
            return WakeReason.SHUTDOWN;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wakes the waiting thread, or makes its next {@code await} return at once.
     */
    public void interrupt() {
        lock.lock();
        try {
            interruptPending = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns true if an interrupt is pending and not yet consumed.
     */
    public boolean isInterruptPending() {
        lock.lock();
        try {
            return interruptPending;
        } finally {
            lock.unlock();
        }
    }

    public void suspend() {
        lock.lock();
        try {
            suspended = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public void resume() {
        lock.lock();
        try {
            suspended = false;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isSuspended() {
        lock.lock();
        try {
            return suspended;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Registers the caller as using the transport's server connection.
     *
     * @return false if the coordinator is suspended or shut down, in which case
     *         the caller must not touch the server and must not call
     *         {@link #leaveHandle()}
     */
    public boolean enterHandle() {
        lock.lock();
        try {
            if (suspended || shutdown) {
                return false;
            }
            handleUsers++;
            return true;
        } finally {
            lock.unlock();
        }
    }

    public void leaveHandle() {
        lock.lock();
        try {
            if (handleUsers > 0) {
                handleUsers--;
            }
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until no thread is inside {@link #enterHandle()}/{@link #leaveHandle()}.
     *
     * @return false if the calling thread was interrupted first
     */
    public boolean awaitHandleReleased() {
        lock.lock();
        try {
            while (handleUsers > 0) {
                changed.await();
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Makes every current and future {@code await} return {@link WakeReason#SHUTDOWN}.
     */
    public void shutdown() {
        lock.lock();
        try {
            shutdown = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isShutdown() {
        lock.lock();
        try {
            return shutdown;
        } finally {
            lock.unlock();
        }
    }
}
