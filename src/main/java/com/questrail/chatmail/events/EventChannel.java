package com.questrail.chatmail.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * EventChannel
 * -----------------------------------------------------------------------------
 * Thread-safe queue of {@link ChatEvent}s that the embedder drains.
 *
 * <p>Any core thread may {@link #emit(ChatEvent) emit}; emission never blocks.
 * When the channel is full the oldest event is dropped, so a stalled embedder
 * cannot stall the transports.</p>
 */
public final class EventChannel {
    private static final Logger log = LoggerFactory.getLogger(EventChannel.class);

    public static final int DEFAULT_CAPACITY = 10_000;

    private final LinkedBlockingQueue<ChatEvent> queue;

    public EventChannel() {
        this(DEFAULT_CAPACITY);
    }

    public EventChannel(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.queue = new LinkedBlockingQueue<>(capacity);
    }

    public void emit(ChatEvent event) {
        while (!queue.offer(event)) {
            ChatEvent dropped = queue.poll();
            if (dropped != null) {
                log.warn("Event channel full, dropping {}", dropped.kind());
            }
        }
    }

    public void emit(EventKind kind, long data1, long data2) {
        emit(ChatEvent.of(kind, data1, data2));
    }

    /**
     * Returns the next event without blocking.
     */
    public Optional<ChatEvent> poll() {
        return Optional.ofNullable(queue.poll());
    }

    /**
     * Waits up to {@code timeout} for the next event.
     */
    public Optional<ChatEvent> poll(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS));
    }

    /**
     * Blocks until an event is available.
     */
    public ChatEvent take() throws InterruptedException {
        return queue.take();
    }

    /**
     * Moves all queued events into {@code target}.
     *
     * @return the number of events moved
     */
    public int drainTo(Collection<? super ChatEvent> target) {
        return queue.drainTo(target);
    }

    public int size() {
        return queue.size();
    }
}
