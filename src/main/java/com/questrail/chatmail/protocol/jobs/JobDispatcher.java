package com.questrail.chatmail.protocol.jobs;

import com.questrail.chatmail.api.Transport;
import com.questrail.chatmail.config.BackoffPolicy;
import com.questrail.chatmail.events.ChatEvent;
import com.questrail.chatmail.events.EventChannel;
import com.questrail.chatmail.events.EventKind;
import com.questrail.chatmail.observability.ChatErrorEvent;
import com.questrail.chatmail.observability.ChatObservabilitySink;
import com.questrail.chatmail.observability.JobObservabilityEvent;
import com.questrail.chatmail.observability.TransportObservabilityEvent;
import com.questrail.chatmail.protocol.idle.InterruptCoordinator;
import com.questrail.chatmail.protocol.idle.NetworkErrorTracker;
import com.questrail.chatmail.protocol.idle.TransportCoordinators;
import com.questrail.chatmail.time.WallClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * JobDispatcher
 * =============================================================================
 * Runs the due jobs of one transport, on that transport's thread.
 *
 * <h2>Drain cycle</h2>
 * <ol>
 *   <li>Register with the transport's coordinator; a suspended transport
 *       runs nothing.</li>
 *   <li>Atomically claim the due jobs (or, after {@link #requestEarlyRetry()}, every
 *       job that failed before).</li>
 *   <li>Run them one at a time, in claim order, and settle each outcome.</li>
 *   <li>Release whatever was claimed but not run.</li>
 * </ol>
 *
 * <h2>Outcomes</h2>
 * Success and terminal failure delete the job before the handler's reaction
 * runs. Recoverable failure reschedules with {@link BackoffPolicy} spacing
 * until retries are exhausted. {@code NotReady} puts the job back with its
 * failure count unchanged, deferred by the initial backoff delay.
 *
 * <p>The dispatcher holds no lock while a handler runs. Handlers may enqueue
 * further jobs.</p>
 */
public final class JobDispatcher {
    private static final Logger log = LoggerFactory.getLogger(JobDispatcher.class);

    private final JobStore store;
    private final Map<JobAction, JobHandler> handlers;
    private final TransportCoordinators coordinators;
    private final BackoffPolicy backoff;
    private final NetworkErrorTracker networkErrors;
    private final EventChannel events;
    private final WallClock wallClock;
    private final ChatObservabilitySink sink;
    private final Set<Transport> retryEarly = EnumSet.noneOf(Transport.class);

    public JobDispatcher(JobStore store,
                         Map<JobAction, JobHandler> handlers,
                         TransportCoordinators coordinators,
                         BackoffPolicy backoff,
                         NetworkErrorTracker networkErrors,
                         EventChannel events,
                         WallClock wallClock,
                         ChatObservabilitySink sink) {
        this.store = Objects.requireNonNull(store, "store");
        this.handlers = new EnumMap<>(Objects.requireNonNull(handlers, "handlers"));
        this.coordinators = Objects.requireNonNull(coordinators, "coordinators");
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.networkErrors = Objects.requireNonNull(networkErrors, "networkErrors");
        this.events = Objects.requireNonNull(events, "events");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Marks every transport for an early retry and wakes all transport threads.
     *
     * <p>The next drain of such a transport runs every previously failed job
     * immediately and stops at the first one that fails again.</p>
     */
    public void requestEarlyRetry() {
        synchronized (retryEarly) {
            retryEarly.addAll(EnumSet.allOf(Transport.class));
        }
        coordinators.interruptAll();
    }

    private boolean takeEarlyRetry(Transport transport) {
        synchronized (retryEarly) {
            return retryEarly.remove(transport);
        }
    }

    /**
     * Runs the due jobs of {@code transport}.
     *
     * @return the number of jobs executed
     */
    public int drain(Transport transport) {
        InterruptCoordinator coordinator = coordinators.get(transport);
        if (!coordinator.enterHandle()) {
            log.debug("{} is suspended, not running jobs", transport);
            return 0;
        }
        try {
            boolean early = takeEarlyRetry(transport);
            List<Job> claimed = early
                    ? store.claimRetrying(transport)
                    : store.claimDue(transport, wallClock.nowMillis());
            if (claimed.isEmpty()) {
                return 0;
            }
            if (early) {
                log.info("{} retrying {} failed job(s) early", transport, claimed.size());
            }

            int executed = 0;
            int next = 0;
            try {
                while (next < claimed.size()) {
                    Job job = claimed.get(next++);
                    JobHandler handler = handlers.get(job.action());
                    if (handler == null) {
                        log.warn("No handler for {}, dropping job {}", job.action(), job.id());
                        store.delete(job);
                        emitJob(job, JobObservabilityEvent.Kind.DROPPED, "no handler");
                        continue;
                    }

                    executed++;
                    if (handler.isExclusive()) {
                        runExclusive(job, handler);
                        break;
                    }
                    JobOutcome outcome = settle(job, handler, run(job, handler));
                    if (early && outcome instanceof JobOutcome.Recoverable) {
                        log.info("{} early retry stopped at job {}", transport, job.id());
                        break;
                    }
                }
            } finally {
                for (int i = next; i < claimed.size(); i++) {
                    store.release(claimed.get(i));
                }
            }
            return executed;
        } finally {
            coordinator.leaveHandle();
        }
    }

    private JobOutcome run(Job job, JobHandler handler) {
        JobOutcome outcome = invoke(job, handler);
        if (outcome instanceof JobOutcome.RetryAtOnce) {
            log.debug("Job {} {} retrying at once", job.id(), job.action());
            outcome = invoke(job, handler);
            if (outcome instanceof JobOutcome.RetryAtOnce) {
                outcome = JobOutcome.recoverable("immediate retry did not succeed");
            }
        }
        return outcome;
    }

    private JobOutcome invoke(Job job, JobHandler handler) {
        try {
            return Objects.requireNonNull(handler.execute(job), "handler returned no outcome");
        } catch (RuntimeException e) {
            sink.onError(new ChatErrorEvent(wallClock.now(),
                    "Job " + job.id() + " " + job.action() + " threw", e));
            return JobOutcome.recoverable(String.valueOf(e));
        }
    }

    private JobOutcome settle(Job job, JobHandler handler, JobOutcome outcome) {
        if (outcome instanceof JobOutcome.Success) {
            store.delete(job);
            networkErrors.reset(job.transport());
            emitJob(job, JobObservabilityEvent.Kind.SUCCEEDED, null);
            handler.onSuccess(job);
        } else if (outcome instanceof JobOutcome.NotReady notReady) {
            long notBefore = wallClock.nowMillis() + backoff.initialDelay().toMillis();
            Job deferred = store.reschedule(job, job.tries(), notBefore);
            emitJob(deferred, JobObservabilityEvent.Kind.DEFERRED, notReady.reason());
            // an expedite arriving while the job was claimed found nothing to make due
            if (handler.isReadyAfterDeferral(deferred) && deferred.params().message().isPresent()
                    && store.makeDue(job.action(), deferred.params().message().get(), wallClock.nowMillis()) > 0) {
                coordinators.interrupt(job.transport());
            }
        } else if (outcome instanceof JobOutcome.Recoverable recoverable) {
            networkErrors.recordFailure(job.transport(), recoverable.reason());
            int tries = job.tries() + 1;
            if (!handler.isRetryable() || backoff.isExhausted(tries)) {
                String reason = handler.isRetryable()
                        ? "gave up after " + tries + " attempts: " + recoverable.reason()
                        : recoverable.reason();
                fail(job, handler, reason);
            } else {
                long notBefore = wallClock.nowMillis() + backoff.delayFor(tries).toMillis();
                Job rescheduled = store.reschedule(job, tries, notBefore);
                emitJob(rescheduled, JobObservabilityEvent.Kind.RESCHEDULED,
                        "attempt " + tries + ": " + recoverable.reason());
            }
        } else if (outcome instanceof JobOutcome.Terminal terminal) {
            fail(job, handler, terminal.reason());
        } else {
            throw new IllegalStateException("Unexpected job outcome " + outcome);
        }
        return outcome;
    }

    private void fail(Job job, JobHandler handler, String reason) {
        store.delete(job);
        emitJob(job, JobObservabilityEvent.Kind.FAILED, reason);
        if (!handler.onTerminalFailure(job, reason)) {
            events.emit(ChatEvent.withText(EventKind.JOB_FAILED, job.id(), job.action() + ": " + reason));
        }
    }

    /**
     * Runs an exclusive job with every other transport suspended.
     */
    private void runExclusive(Job job, JobHandler handler) {
        int superseded = store.deleteByAction(job.action()) - 1;
        if (superseded > 0) {
            log.info("Dropped {} older {} job(s)", superseded, job.action());
        }

        List<InterruptCoordinator> suspended = new ArrayList<>();
        for (Transport t : Transport.values()) {
            if (t != job.transport()) {
                InterruptCoordinator other = coordinators.get(t);
                other.suspend();
                suspended.add(other);
                sink.onTransportEvent(new TransportObservabilityEvent(wallClock.now(), t,
                        TransportObservabilityEvent.Kind.SUSPENDED, job.action().name()));
            }
        }
        try {
            for (InterruptCoordinator other : suspended) {
                // wake the thread in case it is idling, then wait for it to let go
                other.interrupt();
                if (!other.awaitHandleReleased()) {
                    settle(job, handler, JobOutcome.terminal("interrupted while waiting for " + other.transport()));
                    return;
                }
            }
            settle(job, handler, run(job, handler));
        } finally {
            for (InterruptCoordinator other : suspended) {
                other.resume();
                sink.onTransportEvent(new TransportObservabilityEvent(wallClock.now(), other.transport(),
                        TransportObservabilityEvent.Kind.RESUMED, job.action().name()));
            }
        }
    }

    private void emitJob(Job job, JobObservabilityEvent.Kind kind, String detail) {
        sink.onJobEvent(new JobObservabilityEvent(wallClock.now(), job, kind, detail));
    }
}
