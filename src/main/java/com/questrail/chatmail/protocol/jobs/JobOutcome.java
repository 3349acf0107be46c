package com.questrail.chatmail.protocol.jobs;

/**
 * What happened when a {@link JobHandler} ran a job.
 */
public sealed interface JobOutcome
        permits JobOutcome.Success, JobOutcome.RetryAtOnce, JobOutcome.Recoverable,
                JobOutcome.NotReady, JobOutcome.Terminal {

    /** Done; the job is deleted. */
    record Success() implements JobOutcome {}

    /** Run the job again right away, within the same drain. */
    record RetryAtOnce() implements JobOutcome {}

    /** Failed, retry later with backoff. */
    record Recoverable(String reason) implements JobOutcome {}

    /** Preconditions not met yet; put back without counting a failure. */
    record NotReady(String reason) implements JobOutcome {}

    /** Failed for good; the job is deleted and the failure reported. */
    record Terminal(String reason) implements JobOutcome {}

    JobOutcome SUCCESS = new Success();
    JobOutcome RETRY_AT_ONCE = new RetryAtOnce();

    static JobOutcome recoverable(String reason) {
        return new Recoverable(reason);
    }

    static JobOutcome notReady(String reason) {
        return new NotReady(reason);
    }

    static JobOutcome terminal(String reason) {
        return new Terminal(reason);
    }
}
