package com.questrail.chatmail.protocol.idle;

import com.questrail.chatmail.api.Transport;
import com.questrail.chatmail.events.ChatEvent;
import com.questrail.chatmail.events.EventChannel;
import com.questrail.chatmail.events.EventKind;
import com.questrail.chatmail.observability.ChatObservabilitySink;
import com.questrail.chatmail.observability.TransportObservabilityEvent;
import com.questrail.chatmail.time.WallClock;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Consecutive network failure tracker.
 *
 * - Counts failures per transport until the next success
 * - Reports only the first failure of a run to the embedder
 * - Does not encode retry policy
 */
public final class NetworkErrorTracker {

    private final ConcurrentMap<Transport, Integer> failures = new ConcurrentHashMap<>();
    private final EventChannel events;
    private final ChatObservabilitySink sink;
    private final WallClock wallClock;

    public NetworkErrorTracker(EventChannel events, ChatObservabilitySink sink, WallClock wallClock) {
        this.events = Objects.requireNonNull(events, "events");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    /**
     * Records a failure; the first one since the last success is emitted as
     * {@link EventKind#ERROR_NETWORK} with {@code data1 = 1}.
     *
     * @return the updated failure count
     */
    public int recordFailure(Transport transport, String reason) {
        int count = failures.merge(transport, 1, Integer::sum);
        sink.onTransportEvent(new TransportObservabilityEvent(wallClock.now(), transport,
                TransportObservabilityEvent.Kind.NETWORK_ERROR, reason));
        if (count == 1) {
            events.emit(new ChatEvent(EventKind.ERROR_NETWORK, 1, 0, transport + ": " + reason));
        }
        return count;
    }

    /**
     * Reset the failure count after the transport worked again.
     */
    public void reset(Transport transport) {
        failures.remove(transport);
    }

    /**
     * Current failure count (0 if none).
     */
    public int failuresFor(Transport transport) {
        return failures.getOrDefault(transport, 0);
    }
}
