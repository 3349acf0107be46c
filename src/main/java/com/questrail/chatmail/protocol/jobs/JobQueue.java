package com.questrail.chatmail.protocol.jobs;

import com.questrail.chatmail.api.MessageId;
import com.questrail.chatmail.observability.ChatObservabilitySink;
import com.questrail.chatmail.observability.JobObservabilityEvent;
import com.questrail.chatmail.protocol.idle.TransportCoordinators;
import com.questrail.chatmail.time.WallClock;

import java.util.Objects;

/**
 * Entry point for adding work: persists a job and wakes its transport's thread.
 *
 * <p>Safe to call from any thread, including from inside a job handler.</p>
 */
public final class JobQueue {

    private final JobStore store;
    private final TransportCoordinators coordinators;
    private final WallClock wallClock;
    private final ChatObservabilitySink sink;

    public JobQueue(JobStore store,
                    TransportCoordinators coordinators,
                    WallClock wallClock,
                    ChatObservabilitySink sink) {
        this.store = Objects.requireNonNull(store, "store");
        this.coordinators = Objects.requireNonNull(coordinators, "coordinators");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public Job enqueue(NewJob job) {
        Job stored = store.enqueue(job, wallClock.nowMillis());
        sink.onJobEvent(new JobObservabilityEvent(wallClock.now(), stored,
                JobObservabilityEvent.Kind.ENQUEUED, null));
        coordinators.interrupt(stored.transport());
        return stored;
    }

    public Job enqueue(JobAction action, JobParams params) {
        return enqueue(NewJob.of(action, params));
    }

    /**
     * Makes deferred jobs for a message due now and wakes their transport.
     */
    public void expedite(JobAction action, MessageId messageId) {
        if (store.makeDue(action, messageId, wallClock.nowMillis()) > 0) {
            coordinators.interrupt(action.transport());
        }
    }

    public JobStore store() {
        return store;
    }
}
