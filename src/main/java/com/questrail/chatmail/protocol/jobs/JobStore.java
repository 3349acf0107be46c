package com.questrail.chatmail.protocol.jobs;

import com.questrail.chatmail.api.MessageId;
import com.questrail.chatmail.api.Transport;

import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * JobStore
 * =============================================================================
 * Durable table of pending jobs with atomic claiming.
 *
 * <h2>Claiming</h2>
 * A claimed job is invisible to every other claimer until it is
 * {@linkplain #release(Job) released}, {@linkplain #reschedule(Job, int, long) rescheduled}
 * or {@linkplain #delete(Job) deleted}. Two concurrent claims for the same
 * transport therefore never return the same job. Claims are not persisted:
 * after a restart every job is claimable again.
 *
 * <h2>Ordering</h2>
 * {@link #claimDue(Transport, long)} returns jobs ordered by {@code addedAt},
 * then id, which is the order they were enqueued in.
 *
 * <p>Implementations must be thread-safe.</p>
 */
public interface JobStore {

    /**
     * Persists a new job.
     *
     * @param job        the job to add
     * @param nowMillis  current wall-clock time; becomes {@code addedAt}
     */
    Job enqueue(NewJob job, long nowMillis);

    /**
     * Claims every unclaimed job of the transport with {@code notBefore <= nowMillis}.
     */
    List<Job> claimDue(Transport transport, long nowMillis);

    /**
     * Claims every unclaimed job of the transport that has failed before,
     * regardless of {@code notBefore}, ordered by {@code notBefore}.
     */
    List<Job> claimRetrying(Transport transport);

    /**
     * Replaces a claimed job by a new unclaimed row with the given retry state.
     *
     * @return the new row
     */
    Job reschedule(Job job, int tries, long notBefore);

    /**
     * Sets {@code notBefore} to {@code nowMillis} on unclaimed jobs of the given
     * action for the given message that are not due yet.
     *
     * @return the number of jobs made due
     */
    int makeDue(JobAction action, MessageId messageId, long nowMillis);

    /**
     * Releases a claim without changing the job.
     */
    void release(Job job);

    /**
     * Deletes a job, claimed or not.
     *
     * @return true if a row was deleted
     */
    boolean delete(Job job);

    /**
     * Deletes every job with the given action.
     *
     * @return the number of rows deleted
     */
    int deleteByAction(JobAction action);

    boolean exists(JobAction action);

    /**
     * Returns the earliest {@code notBefore} among unclaimed jobs of the transport.
     */
    OptionalLong nextNotBefore(Transport transport);

    Optional<Job> find(long id);

    int count(Transport transport);
}
