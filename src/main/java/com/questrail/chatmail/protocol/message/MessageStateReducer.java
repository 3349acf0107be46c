package com.questrail.chatmail.protocol.message;

import com.questrail.chatmail.api.MessageState;

import java.util.Objects;

import static com.questrail.chatmail.protocol.message.MessageIntents.Kind.EXPEDITE_SEND;
import static com.questrail.chatmail.protocol.message.MessageIntents.Kind.MARK_SEEN_ON_SERVER;
import static com.questrail.chatmail.protocol.message.MessageIntents.Kind.NOTIFY_CHANGED;
import static com.questrail.chatmail.protocol.message.MessageIntents.Kind.NOTIFY_DELIVERED;
import static com.questrail.chatmail.protocol.message.MessageIntents.Kind.NOTIFY_FAILED;
import static com.questrail.chatmail.protocol.message.MessageIntents.Kind.NOTIFY_READ;
import static com.questrail.chatmail.protocol.message.MessageIntents.Kind.SCHEDULE_SEND;
import static com.questrail.chatmail.protocol.message.MessageIntents.Kind.SEND_READ_RECEIPT;

/**
 * MessageStateReducer
 * -----------------------------------------------------------------------------
 * Pure, deterministic delivery-state transition engine for a single message.
 *
 * <p>Given a message and one {@link MessageEvent}, computes the updated
 * message and the {@link MessageIntents} that should follow. Events that are
 * not legal in the message's current state leave the message unchanged and
 * produce no intents; late or duplicate reports (a second delivery
 * confirmation, a receipt for a failed message) are therefore harmless.</p>
 *
 * <p>Legal forward moves are defined by {@link MessageState#canAdvanceTo}.
 * The one exception is {@link MessageEvent.ResendRequested}, which takes a
 * failed message back to pending.</p>
 */
public final class MessageStateReducer
{
    /**
     * Result of applying an event to a message.
     *
     * @param newMessage the updated message, identical to the input if the event was ignored
     * @param intents    side effects to execute
     */
    public record Result(MessageRecord newMessage, MessageIntents intents) {

        public boolean changed(MessageRecord before) {
            return newMessage.state() != before.state();
        }
    }

    public Result apply(MessageRecord message, MessageEvent event) {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(event, "event");

        if (event instanceof MessageEvent.MarkNoticed) {
            return advance(message, MessageState.NOTICED, MessageIntents.of(NOTIFY_CHANGED));
        }
        if (event instanceof MessageEvent.MarkSeen e) {
            return onMarkSeen(message, e);
        }
        if (event instanceof MessageEvent.SendSucceeded) {
            return advance(message, MessageState.DELIVERED, MessageIntents.of(NOTIFY_DELIVERED));
        }
        if (event instanceof MessageEvent.SendFailed
                || event instanceof MessageEvent.DeliveryFailureReported) {
            return advance(message, MessageState.FAILED, MessageIntents.of(NOTIFY_FAILED));
        }
        if (event instanceof MessageEvent.ReadReceiptReceived) {
            return advance(message, MessageState.MDN_RECEIVED, MessageIntents.of(NOTIFY_READ));
        }
        if (event instanceof MessageEvent.PreparationFinished) {
            if (message.state() != MessageState.PREPARING) {
                return unchanged(message);
            }
            return advance(message, MessageState.PENDING, MessageIntents.of(EXPEDITE_SEND, NOTIFY_CHANGED));
        }
        if (event instanceof MessageEvent.ParkedAsDraft) {
            return advance(message, MessageState.DRAFT, MessageIntents.of(NOTIFY_CHANGED));
        }
        if (event instanceof MessageEvent.DraftSubmitted) {
            if (message.state() != MessageState.DRAFT) {
                return unchanged(message);
            }
            return advance(message, MessageState.PENDING, MessageIntents.of(SCHEDULE_SEND, NOTIFY_CHANGED));
        }
        if (event instanceof MessageEvent.ResendRequested) {
            if (message.state() != MessageState.FAILED) {
                return unchanged(message);
            }
            return new Result(message.withState(MessageState.PENDING),
                    MessageIntents.of(SCHEDULE_SEND, NOTIFY_CHANGED));
        }

        return unchanged(message);
    }

    private Result onMarkSeen(MessageRecord message, MessageEvent.MarkSeen e) {
        if (!message.state().canAdvanceTo(MessageState.SEEN)) {
            return unchanged(message);
        }
        MessageIntents intents = MessageIntents.of(NOTIFY_CHANGED);
        // special chats such as the deaddrop change only locally
        if (e.realChat()) {
            if (message.serverRef().isPresent()) {
                intents = intents.and(MARK_SEEN_ON_SERVER);
            }
            if (message.wantsMdn() && e.receiptsEnabled()) {
                intents = intents.and(SEND_READ_RECEIPT);
            }
        }
        return new Result(message.withState(MessageState.SEEN), intents);
    }

    private static Result advance(MessageRecord message, MessageState target, MessageIntents intents) {
        if (!message.state().canAdvanceTo(target)) {
            return unchanged(message);
        }
        return new Result(message.withState(target), intents);
    }

    private static Result unchanged(MessageRecord message) {
        return new Result(message, MessageIntents.none());
    }
}
