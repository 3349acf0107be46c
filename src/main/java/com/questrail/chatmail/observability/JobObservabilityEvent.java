package com.questrail.chatmail.observability;

import com.questrail.chatmail.protocol.jobs.Job;

import java.time.Instant;

/**
 * Record representing a job lifecycle step in the dispatcher.
 */
public record JobObservabilityEvent(
    Instant timestamp,
    Job job,
    Kind kind,
    String detail
) {
    public enum Kind {
        ENQUEUED,
        SUCCEEDED,
        RESCHEDULED,
        DEFERRED,
        FAILED,
        DROPPED
    }
}
