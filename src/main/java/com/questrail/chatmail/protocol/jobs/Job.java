package com.questrail.chatmail.protocol.jobs;

import com.questrail.chatmail.api.Transport;

import java.util.Objects;

/**
 * A persisted unit of deferred network work.
 *
 * <p>Jobs are immutable. A recoverable failure produces a new row with
 * {@code tries + 1} and a later {@code notBefore}; the original
 * {@code addedAt} is kept so the job keeps its place in FIFO order.</p>
 *
 * @param id        store-assigned id
 * @param action    what to do; also fixes the transport
 * @param params    action parameters
 * @param tries     recoverable failures so far
 * @param addedAt   epoch millis of first enqueue
 * @param notBefore epoch millis before which the job is not due
 */
public record Job(
        long id,
        JobAction action,
        JobParams params,
        int tries,
        long addedAt,
        long notBefore
) {
    public Job {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(params, "params");
        if (tries < 0) {
            throw new IllegalArgumentException("tries must be non-negative");
        }
    }

    public Transport transport() {
        return action.transport();
    }

    public boolean isDue(long nowMillis) {
        return notBefore <= nowMillis;
    }
}
