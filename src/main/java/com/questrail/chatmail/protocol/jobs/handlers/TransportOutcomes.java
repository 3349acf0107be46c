package com.questrail.chatmail.protocol.jobs.handlers;

import com.questrail.chatmail.protocol.jobs.JobOutcome;
import com.questrail.chatmail.transport.TransportResult;

/**
 * Maps transport results to job outcomes.
 */
final class TransportOutcomes {

    private TransportOutcomes() {}

    static JobOutcome of(TransportResult result) {
        if (result instanceof TransportResult.Ok) {
            return JobOutcome.SUCCESS;
        } else if (result instanceof TransportResult.RetryNow) {
            return JobOutcome.RETRY_AT_ONCE;
        } else if (result instanceof TransportResult.Transient t) {
            return JobOutcome.recoverable(t.reason());
        } else if (result instanceof TransportResult.Permanent p) {
            return JobOutcome.terminal(p.reason());
        }
        throw new IllegalStateException("Unexpected transport result " + result);
    }
}
