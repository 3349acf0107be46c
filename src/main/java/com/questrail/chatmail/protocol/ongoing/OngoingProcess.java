package com.questrail.chatmail.protocol.ongoing;

import com.questrail.chatmail.api.OngoingProcessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * OngoingProcess
 * -----------------------------------------------------------------------------
 * Guard that lets at most one long-running user operation (configure,
 * secure-join) run at a time, and lets the embedder cancel it.
 *
 * <p>Starting a second process while one runs is rejected with
 * {@link OngoingProcessException}. Cancellation only sets a flag and runs the
 * registered wake-up callbacks; the running process checks
 * {@link Token#isCancelled()} between its protocol steps.</p>
 */
public final class OngoingProcess {
    private static final Logger log = LoggerFactory.getLogger(OngoingProcess.class);

    private Token current;

    /**
     * Claims the single process slot.
     *
     * @throws OngoingProcessException if another process is running
     */
    public synchronized Token start(String name) {
        if (current != null) {
            throw new OngoingProcessException(current.name, name);
        }
        current = new Token(name);
        log.debug("Ongoing process {} started", name);
        return current;
    }

    /**
     * Requests cancellation of the running process, if any.
     *
     * @return true if a process was running
     */
    public boolean stop() {
        Token token;
        synchronized (this) {
            token = current;
        }
        if (token == null) {
            return false;
        }
        token.cancel();
        return true;
    }

    public synchronized boolean isRunning() {
        return current != null;
    }

    private synchronized void release(Token token) {
        if (current == token) {
            current = null;
            log.debug("Ongoing process {} finished", token.name);
        }
    }

    /**
     * Ownership of the process slot, released by {@link #close()}.
     */
    public final class Token implements AutoCloseable {
        private final String name;
        private final List<Runnable> onCancel = new ArrayList<>();
        private volatile boolean cancelled;

        private Token(String name) {
            this.name = name;
        }

        public String name() {
            return name;
        }

        public boolean isCancelled() {
            return cancelled;
        }

        /**
         * Registers a callback run when cancellation is requested, for waking
         * a thread that waits on something else.
         */
        public void onCancel(Runnable callback) {
            synchronized (onCancel) {
                onCancel.add(callback);
            }
        }

        private void cancel() {
            cancelled = true;
            List<Runnable> callbacks;
            synchronized (onCancel) {
                callbacks = new ArrayList<>(onCancel);
            }
            log.info("Ongoing process {} cancelled", name);
            callbacks.forEach(Runnable::run);
        }

        @Override
        public void close() {
            release(this);
        }
    }
}
