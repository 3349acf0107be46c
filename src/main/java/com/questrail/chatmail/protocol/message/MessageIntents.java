package com.questrail.chatmail.protocol.message;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * MessageIntents
 * -----------------------------------------------------------------------------
 * Immutable set of side effects requested by the {@link MessageStateReducer}.
 *
 * <p>The reducer decides <b>what</b> should follow a state change; the
 * {@link MessageIntentExecutor} turns intents into events and jobs. No intent
 * performs I/O directly.</p>
 */
public final class MessageIntents
{
    public enum Kind {
        /** Tell the embedder the message list changed. */
        NOTIFY_CHANGED,

        /** Tell the embedder the message was delivered. */
        NOTIFY_DELIVERED,

        /** Tell the embedder the message failed. */
        NOTIFY_FAILED,

        /** Tell the embedder the recipient read the message. */
        NOTIFY_READ,

        /** Set the seen flag on the server copy. */
        MARK_SEEN_ON_SERVER,

        /** Send a read receipt to the sender. */
        SEND_READ_RECEIPT,

        /** Enqueue a send job. */
        SCHEDULE_SEND,

        /** Make an already enqueued, deferred send job due now. */
        EXPEDITE_SEND
    }

    private static final MessageIntents NONE = new MessageIntents(EnumSet.noneOf(Kind.class));

    private final Set<Kind> kinds;

    private MessageIntents(Set<Kind> kinds) {
        this.kinds = Collections.unmodifiableSet(EnumSet.copyOf(kinds));
    }

    public Set<Kind> kinds() {
        return kinds;
    }

    public boolean isEmpty() {
        return kinds.isEmpty();
    }

    public boolean contains(Kind kind) {
        return kinds.contains(kind);
    }

    public static MessageIntents none() {
        return NONE;
    }

    public static MessageIntents of(Kind first, Kind... rest) {
        return new MessageIntents(EnumSet.of(first, rest));
    }

    /**
     * Combines this set of intents with another.
     */
    public MessageIntents and(MessageIntents other) {
        Objects.requireNonNull(other, "other");
        EnumSet<Kind> merged = EnumSet.noneOf(Kind.class);
        merged.addAll(this.kinds);
        merged.addAll(other.kinds);
        return new MessageIntents(merged);
    }

    public MessageIntents and(Kind kind) {
        return and(of(kind));
    }

    @Override
    public String toString() {
        return "MessageIntents" + kinds;
    }
}
