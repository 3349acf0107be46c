package com.questrail.chatmail.protocol.jobs;

/**
 * Executes jobs of one {@link JobAction} and reacts to their final outcome.
 *
 * <p>{@link #execute(Job)} performs the network work. The reactions
 * ({@link #onSuccess(Job)}, {@link #onTerminalFailure(Job, String)}) run only
 * after the dispatcher has removed the job from the store.</p>
 */
public interface JobHandler {

    JobOutcome execute(Job job);

    default void onSuccess(Job job) {
    }

    /**
     * Reacts to a job that will not be retried.
     *
     * @return true if the handler reported the failure to the embedder itself,
     *         false to let the dispatcher emit a generic job failure event
     */
    default boolean onTerminalFailure(Job job, String reason) {
        return false;
    }

    /**
     * Asked after a {@link JobOutcome.NotReady} job was put back. Returning true
     * makes it due at once, for jobs whose blocker went away while they ran.
     */
    default boolean isReadyAfterDeferral(Job job) {
        return false;
    }

    /**
     * Exclusive jobs run with every other transport suspended, replace any
     * other pending job of the same action, and end the drain that ran them.
     */
    default boolean isExclusive() {
        return false;
    }

    /**
     * Non-retryable jobs turn a recoverable failure into a terminal one.
     */
    default boolean isRetryable() {
        return true;
    }
}
