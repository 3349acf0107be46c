package com.questrail.chatmail.protocol.jobs;

import com.questrail.chatmail.api.MessageId;
import com.questrail.chatmail.api.Transport;
import com.questrail.chatmail.config.BackoffPolicy;
import com.questrail.chatmail.events.ChatEvent;
import com.questrail.chatmail.events.EventChannel;
import com.questrail.chatmail.events.EventKind;
import com.questrail.chatmail.observability.JobObservabilityEvent;
import com.questrail.chatmail.observability.RecordingObservabilitySink;
import com.questrail.chatmail.protocol.idle.NetworkErrorTracker;
import com.questrail.chatmail.protocol.idle.TransportCoordinators;
import com.questrail.chatmail.time.ManualWallClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JobDispatcherTest
 * -----------------------------------------------------------------------------
 * Drain semantics against an in-memory store, scripted handlers and a manual
 * wall clock. No transport I/O is involved.
 */
class JobDispatcherTest {

    private static final BackoffPolicy BACKOFF =
            new BackoffPolicy(Duration.ofSeconds(10), Duration.ofMinutes(1), 3);

    private ManualWallClock clock;
    private InMemoryJobStore store;
    private TransportCoordinators coordinators;
    private EventChannel events;
    private RecordingObservabilitySink sink;
    private NetworkErrorTracker networkErrors;
    private JobQueue queue;
    private Map<JobAction, JobHandler> handlers;
    private JobDispatcher dispatcher;

    /**
     * Handler that returns scripted outcomes in order, then SUCCESS.
     */
    static final class ScriptedHandler implements JobHandler {
        final Deque<JobOutcome> script = new ArrayDeque<>();
        final List<Long> executed = Collections.synchronizedList(new ArrayList<>());
        final List<Long> succeeded = new ArrayList<>();
        final List<String> failures = new ArrayList<>();
        boolean exclusive;
        boolean retryable = true;
        boolean reportsFailure;
        volatile boolean readyAfterDeferral;
        Runnable during = () -> { };

        ScriptedHandler then(JobOutcome... outcomes) {
            script.addAll(List.of(outcomes));
            return this;
        }

        @Override
        public synchronized JobOutcome execute(Job job) {
            executed.add(job.params().messageId() == null ? -1 : job.params().messageId().value());
            during.run();
            JobOutcome next = script.poll();
            return next == null ? JobOutcome.SUCCESS : next;
        }

        @Override
        public void onSuccess(Job job) {
            succeeded.add(job.id());
        }

        @Override
        public boolean onTerminalFailure(Job job, String reason) {
            failures.add(reason);
            return reportsFailure;
        }

        @Override
        public boolean isReadyAfterDeferral(Job job) {
            return readyAfterDeferral;
        }

        @Override
        public boolean isExclusive() {
            return exclusive;
        }

        @Override
        public boolean isRetryable() {
            return retryable;
        }
    }

    @BeforeEach
    void setUp() {
        clock = new ManualWallClock();
        store = new InMemoryJobStore();
        coordinators = new TransportCoordinators();
        events = new EventChannel();
        sink = new RecordingObservabilitySink();
        networkErrors = new NetworkErrorTracker(events, sink, clock);
        queue = new JobQueue(store, coordinators, clock, sink);
        handlers = new EnumMap<>(JobAction.class);
    }

    private ScriptedHandler handle(JobAction action) {
        ScriptedHandler h = new ScriptedHandler();
        handlers.put(action, h);
        dispatcher = new JobDispatcher(store, handlers, coordinators, BACKOFF,
                networkErrors, events, clock, sink);
        return h;
    }

    private void send(long messageId) {
        queue.enqueue(JobAction.SEND_MESSAGE, JobParams.forMessage(MessageId.of(messageId)));
    }

    private List<ChatEvent> drainEvents() {
        List<ChatEvent> out = new ArrayList<>();
        events.drainTo(out);
        return out;
    }

    // ---------------------------------------------------------------------
    // Basic drain
    // ---------------------------------------------------------------------

    @Test
    void runsDueJobsInFifoOrderAndDeletesThem() {
        ScriptedHandler h = handle(JobAction.SEND_MESSAGE);
        send(1);
        send(2);
        send(3);

        assertEquals(3, dispatcher.drain(Transport.OUTBOUND));

        assertEquals(List.of(1L, 2L, 3L), h.executed);
        assertEquals(3, h.succeeded.size());
        assertEquals(0, store.count(Transport.OUTBOUND));
        assertEquals(3, sink.getJobEvents(JobObservabilityEvent.Kind.SUCCEEDED).size());
    }

    @Test
    void enqueueWakesTheOwningTransport() {
        handle(JobAction.SEND_MESSAGE);
        send(1);

        assertTrue(coordinators.get(Transport.OUTBOUND).isInterruptPending());
        assertFalse(coordinators.get(Transport.PRIMARY_MAILBOX).isInterruptPending());
    }

    @Test
    void drainOfOtherTransportDoesNotRunJob() {
        ScriptedHandler h = handle(JobAction.SEND_MESSAGE);
        send(1);

        assertEquals(0, dispatcher.drain(Transport.PRIMARY_MAILBOX));
        assertTrue(h.executed.isEmpty());
    }

    @Test
    void jobWithoutHandlerIsDropped() {
        handle(JobAction.SEND_MESSAGE);
        queue.enqueue(JobAction.SEND_MDN, JobParams.forMessage(MessageId.of(5)));

        dispatcher.drain(Transport.OUTBOUND);

        assertEquals(0, store.count(Transport.OUTBOUND));
        assertEquals(1, sink.getJobEvents(JobObservabilityEvent.Kind.DROPPED).size());
    }

    @Test
    void suspendedTransportRunsNothing() {
        ScriptedHandler h = handle(JobAction.SEND_MESSAGE);
        send(1);
        coordinators.get(Transport.OUTBOUND).suspend();

        assertEquals(0, dispatcher.drain(Transport.OUTBOUND));
        assertTrue(h.executed.isEmpty());

        coordinators.get(Transport.OUTBOUND).resume();
        assertEquals(1, dispatcher.drain(Transport.OUTBOUND));
    }

    // ---------------------------------------------------------------------
    // Outcomes
    // ---------------------------------------------------------------------

    @Test
    void retryAtOnceRunsAgainInSameDrain() {
        ScriptedHandler h = handle(JobAction.SEND_MESSAGE).then(JobOutcome.RETRY_AT_ONCE);
        send(1);

        dispatcher.drain(Transport.OUTBOUND);

        assertEquals(2, h.executed.size());
        assertEquals(0, store.count(Transport.OUTBOUND));
    }

    @Test
    void repeatedRetryAtOnceBecomesRecoverable() {
        ScriptedHandler h = handle(JobAction.SEND_MESSAGE)
                .then(JobOutcome.RETRY_AT_ONCE, JobOutcome.RETRY_AT_ONCE);
        send(1);

        dispatcher.drain(Transport.OUTBOUND);

        assertEquals(2, h.executed.size());
        Job rescheduled = store.claimRetrying(Transport.OUTBOUND).get(0);
        assertEquals(1, rescheduled.tries());
    }

    @Test
    void recoverableFailureIsRescheduledWithBackoff() {
        ScriptedHandler h = handle(JobAction.SEND_MESSAGE)
                .then(JobOutcome.recoverable("timeout"), JobOutcome.recoverable("timeout"));
        send(1);
        long start = clock.nowMillis();

        dispatcher.drain(Transport.OUTBOUND);
        assertEquals(start + 10_000, store.nextNotBefore(Transport.OUTBOUND).getAsLong());

        clock.advance(Duration.ofSeconds(9));
        assertEquals(0, dispatcher.drain(Transport.OUTBOUND));

        clock.advance(Duration.ofSeconds(1));
        assertEquals(1, dispatcher.drain(Transport.OUTBOUND));
        assertEquals(clock.nowMillis() + 20_000, store.nextNotBefore(Transport.OUTBOUND).getAsLong());

        clock.advance(Duration.ofSeconds(20));
        dispatcher.drain(Transport.OUTBOUND);

        assertEquals(3, h.executed.size());
        assertEquals(1, h.succeeded.size());
        assertEquals(2, sink.getJobEvents(JobObservabilityEvent.Kind.RESCHEDULED).size());
    }

    @Test
    void recoverableFailureReportsNetworkErrorOncePerRun() {
        handle(JobAction.SEND_MESSAGE)
                .then(JobOutcome.recoverable("down"), JobOutcome.recoverable("down"));
        send(1);

        dispatcher.drain(Transport.OUTBOUND);
        clock.advance(Duration.ofSeconds(10));
        dispatcher.drain(Transport.OUTBOUND);

        long networkErrorsEmitted = drainEvents().stream()
                .filter(e -> e.kind() == EventKind.ERROR_NETWORK)
                .count();
        assertEquals(1, networkErrorsEmitted);
    }

    @Test
    void exhaustedRetriesFailTerminallyWithJobFailedEvent() {
        ScriptedHandler h = handle(JobAction.SEND_MESSAGE).then(
                JobOutcome.recoverable("a"), JobOutcome.recoverable("b"), JobOutcome.recoverable("c"));
        send(1);

        for (int i = 0; i < 3; i++) {
            dispatcher.drain(Transport.OUTBOUND);
            clock.advance(Duration.ofMinutes(1));
        }

        assertEquals(3, h.executed.size());
        assertEquals(0, store.count(Transport.OUTBOUND));
        assertEquals(1, h.failures.size());
        assertTrue(h.failures.get(0).contains("gave up after 3 attempts"));
        assertTrue(drainEvents().stream().anyMatch(e -> e.kind() == EventKind.JOB_FAILED));
    }

    @Test
    void handlerReportedFailureSuppressesJobFailedEvent() {
        ScriptedHandler h = handle(JobAction.SEND_MESSAGE).then(JobOutcome.terminal("rejected"));
        h.reportsFailure = true;
        send(1);

        dispatcher.drain(Transport.OUTBOUND);

        assertEquals(List.of("rejected"), h.failures);
        assertTrue(drainEvents().stream().noneMatch(e -> e.kind() == EventKind.JOB_FAILED));
    }

    @Test
    void nonRetryableHandlerFailsOnFirstRecoverable() {
        ScriptedHandler h = handle(JobAction.SEND_MESSAGE).then(JobOutcome.recoverable("nope"));
        h.retryable = false;
        send(1);

        dispatcher.drain(Transport.OUTBOUND);

        assertEquals(List.of("nope"), h.failures);
        assertEquals(0, store.count(Transport.OUTBOUND));
    }

    @Test
    void throwingHandlerCountsAsRecoverable() {
        ScriptedHandler h = handle(JobAction.SEND_MESSAGE);
        h.during = () -> {
            if (h.executed.size() == 1) {
                throw new IllegalStateException("boom");
            }
        };
        send(1);

        dispatcher.drain(Transport.OUTBOUND);

        assertEquals(1, store.claimRetrying(Transport.OUTBOUND).size());
    }

    @Test
    void notReadyIsDeferredWithoutCountingAFailure() {
        ScriptedHandler h = handle(JobAction.SEND_MESSAGE).then(JobOutcome.notReady("preparing"));
        send(7);

        dispatcher.drain(Transport.OUTBOUND);

        Job deferred = store.claimDue(Transport.OUTBOUND, clock.nowMillis() + 10_000).get(0);
        assertEquals(0, deferred.tries());
        store.release(deferred);
        assertEquals(1, sink.getJobEvents(JobObservabilityEvent.Kind.DEFERRED).size());
        assertEquals(0, networkErrors.failuresFor(Transport.OUTBOUND));

        queue.expedite(JobAction.SEND_MESSAGE, MessageId.of(7));
        assertEquals(1, dispatcher.drain(Transport.OUTBOUND));
        assertEquals(1, h.succeeded.size());
    }

    @Test
    void expediteWhileClaimedIsNotLost() {
        ScriptedHandler h = handle(JobAction.SEND_MESSAGE).then(JobOutcome.notReady("preparing"));
        h.during = () -> {
            // preparation finishes while the job is being run
            h.readyAfterDeferral = true;
            queue.expedite(JobAction.SEND_MESSAGE, MessageId.of(7));
        };
        send(7);

        dispatcher.drain(Transport.OUTBOUND);

        List<Job> due = store.claimDue(Transport.OUTBOUND, clock.nowMillis());
        assertEquals(1, due.size());
        assertEquals(0, due.get(0).tries());
        store.release(due.get(0));

        h.during = () -> { };
        assertEquals(1, dispatcher.drain(Transport.OUTBOUND));
        assertEquals(1, h.succeeded.size());
    }

    @Test
    void deferredJobStaysDeferredWhileStillBlocked() {
        handle(JobAction.SEND_MESSAGE).then(JobOutcome.notReady("preparing"));
        send(7);

        dispatcher.drain(Transport.OUTBOUND);

        assertTrue(store.claimDue(Transport.OUTBOUND, clock.nowMillis()).isEmpty());
    }

    // ---------------------------------------------------------------------
    // Early retry
    // ---------------------------------------------------------------------

    @Test
    void earlyRetryRunsFailedJobsAndStopsAtFirstFailure() {
        ScriptedHandler h = handle(JobAction.SEND_MESSAGE).then(
                JobOutcome.recoverable("x"), JobOutcome.recoverable("x"),
                JobOutcome.recoverable("still down"));
        send(1);
        send(2);
        dispatcher.drain(Transport.OUTBOUND);
        assertEquals(2, h.executed.size());

        dispatcher.requestEarlyRetry();
        assertTrue(coordinators.get(Transport.OUTBOUND).isInterruptPending());
        assertEquals(1, dispatcher.drain(Transport.OUTBOUND));
        assertEquals(2, store.count(Transport.OUTBOUND));

        dispatcher.requestEarlyRetry();
        assertEquals(2, dispatcher.drain(Transport.OUTBOUND));
        assertEquals(0, store.count(Transport.OUTBOUND));
    }

    // ---------------------------------------------------------------------
    // Exclusive jobs
    // ---------------------------------------------------------------------

    @Test
    void exclusiveJobSupersedesOlderCopiesAndSuspendsOtherTransports() {
        ScriptedHandler configure = handle(JobAction.CONFIGURE);
        configure.exclusive = true;
        List<Boolean> outboundSuspended = new ArrayList<>();
        configure.during = () -> outboundSuspended.add(coordinators.get(Transport.OUTBOUND).isSuspended());

        queue.enqueue(JobAction.CONFIGURE, JobParams.none());
        queue.enqueue(JobAction.CONFIGURE, JobParams.none());
        queue.enqueue(JobAction.MARK_SEEN_ON_SERVER, JobParams.forMessage(MessageId.of(1)));

        assertEquals(1, dispatcher.drain(Transport.PRIMARY_MAILBOX));

        assertEquals(List.of(true), outboundSuspended);
        assertFalse(coordinators.get(Transport.OUTBOUND).isSuspended());
        assertFalse(store.exists(JobAction.CONFIGURE));
        assertTrue(store.exists(JobAction.MARK_SEEN_ON_SERVER));
    }

    @Test
    void exclusiveJobWaitsForOtherTransportToLeaveItsHandle() throws Exception {
        ScriptedHandler configure = handle(JobAction.CONFIGURE);
        configure.exclusive = true;
        queue.enqueue(JobAction.CONFIGURE, JobParams.none());

        assertTrue(coordinators.get(Transport.OUTBOUND).enterHandle());
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<Integer> drained = pool.submit(() -> dispatcher.drain(Transport.PRIMARY_MAILBOX));
            Thread.sleep(100);
            assertTrue(configure.executed.isEmpty());

            coordinators.get(Transport.OUTBOUND).leaveHandle();

            assertEquals(1, drained.get(5, TimeUnit.SECONDS));
            assertEquals(1, configure.executed.size());
        } finally {
            pool.shutdownNow();
        }
    }

    // ---------------------------------------------------------------------
    // Concurrency
    // ---------------------------------------------------------------------

    @Test
    void concurrentDrainsNeverRunAJobTwice() throws Exception {
        ScriptedHandler h = handle(JobAction.SEND_MESSAGE);
        for (int i = 1; i <= 100; i++) {
            send(i);
        }

        ExecutorService pool = Executors.newFixedThreadPool(3);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Integer>> results = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            results.add(pool.submit(() -> {
                start.await();
                return dispatcher.drain(Transport.OUTBOUND);
            }));
        }
        start.countDown();
        int total = 0;
        for (Future<Integer> f : results) {
            total += f.get(10, TimeUnit.SECONDS);
        }
        pool.shutdownNow();

        assertEquals(100, total);
        Set<Long> unique = new HashSet<>(h.executed);
        assertEquals(100, unique.size());
    }

    @Test
    void concurrentEnqueueKeepsEachProducersOrder() throws Exception {
        ScriptedHandler h = handle(JobAction.SEND_MESSAGE);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> producers = new ArrayList<>();
        for (int p = 0; p < 2; p++) {
            long base = p * 1_000L;
            producers.add(pool.submit(() -> {
                start.await();
                for (int i = 1; i <= 50; i++) {
                    send(base + i);
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : producers) {
            f.get(10, TimeUnit.SECONDS);
        }
        pool.shutdownNow();

        dispatcher.drain(Transport.OUTBOUND);

        assertEquals(100, h.executed.size());
        List<Long> first = h.executed.stream().filter(id -> id < 1_000).toList();
        List<Long> second = h.executed.stream().filter(id -> id >= 1_000).toList();
        assertEquals(first.stream().sorted().toList(), first);
        assertEquals(second.stream().sorted().toList(), second);
    }
}
