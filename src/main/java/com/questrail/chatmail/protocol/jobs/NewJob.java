package com.questrail.chatmail.protocol.jobs;

import com.questrail.chatmail.api.Transport;

import java.time.Duration;
import java.util.Objects;

/**
 * A job not yet persisted.
 *
 * @param action what to do
 * @param params action parameters
 * @param delay  how long after enqueueing the job becomes due
 */
public record NewJob(JobAction action, JobParams params, Duration delay) {

    public NewJob {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(params, "params");
        Objects.requireNonNull(delay, "delay");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be non-negative");
        }
    }

    public static NewJob of(JobAction action, JobParams params) {
        return new NewJob(action, params, Duration.ZERO);
    }

    public NewJob delayedBy(Duration newDelay) {
        return new NewJob(action, params, newDelay);
    }

    public Transport transport() {
        return action.transport();
    }
}
