package com.questrail.chatmail.protocol.message;

import java.time.Instant;
import java.util.Objects;

/**
 * MessageEvent
 * -----------------------------------------------------------------------------
 * Inputs to the {@link MessageStateReducer}.
 *
 * <p>Each event carries only the facts the reducer needs; anything that depends
 * on other tables (is the chat a real chat, are receipts enabled) is resolved
 * by the caller before the event is built, so the reducer stays pure.</p>
 */
public sealed interface MessageEvent
        permits MessageEvent.MarkNoticed, MessageEvent.MarkSeen,
                MessageEvent.SendSucceeded, MessageEvent.SendFailed,
                MessageEvent.DeliveryFailureReported, MessageEvent.ReadReceiptReceived,
                MessageEvent.PreparationFinished, MessageEvent.ParkedAsDraft,
                MessageEvent.DraftSubmitted, MessageEvent.ResendRequested
{
    Instant timestamp();

    /**
     * Convenience base class for message events.
     */
    abstract class Base {
        private final Instant timestamp;

        protected Base(Instant timestamp) {
            this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        }

        public Instant timestamp() {
            return timestamp;
        }

        @Override
        public String toString() {
            return getClass().getSimpleName() + "@" + timestamp;
        }
    }

    /** The user looked at the chat list entry. */
    final class MarkNoticed extends Base implements MessageEvent {
        public MarkNoticed(Instant timestamp) {
            super(timestamp);
        }
    }

    /** The user read the message. */
    final class MarkSeen extends Base implements MessageEvent {
        private final boolean realChat;
        private final boolean receiptsEnabled;

        /**
         * @param realChat        false for messages in special chats such as the deaddrop
         * @param receiptsEnabled whether the user allows sending read receipts
         */
        public MarkSeen(Instant timestamp, boolean realChat, boolean receiptsEnabled) {
            super(timestamp);
            this.realChat = realChat;
            this.receiptsEnabled = receiptsEnabled;
        }

        public boolean realChat() {
            return realChat;
        }

        public boolean receiptsEnabled() {
            return receiptsEnabled;
        }
    }

    /** The outbound transport accepted the message. */
    final class SendSucceeded extends Base implements MessageEvent {
        public SendSucceeded(Instant timestamp) {
            super(timestamp);
        }
    }

    /** Sending failed for good. */
    final class SendFailed extends Base implements MessageEvent {
        private final String reason;

        public SendFailed(Instant timestamp, String reason) {
            super(timestamp);
            this.reason = reason;
        }

        public String reason() {
            return reason;
        }
    }

    /** A bounce for this message arrived. */
    final class DeliveryFailureReported extends Base implements MessageEvent {
        private final String reason;

        public DeliveryFailureReported(Instant timestamp, String reason) {
            super(timestamp);
            this.reason = reason;
        }

        public String reason() {
            return reason;
        }
    }

    /** A read receipt for this message arrived. */
    final class ReadReceiptReceived extends Base implements MessageEvent {
        public ReadReceiptReceived(Instant timestamp) {
            super(timestamp);
        }
    }

    /** Attachments and rendering are done; the message may be sent. */
    final class PreparationFinished extends Base implements MessageEvent {
        public PreparationFinished(Instant timestamp) {
            super(timestamp);
        }
    }

    /** A prepared message is kept as a draft instead of being sent. */
    final class ParkedAsDraft extends Base implements MessageEvent {
        public ParkedAsDraft(Instant timestamp) {
            super(timestamp);
        }
    }

    /** The user sends a draft. */
    final class DraftSubmitted extends Base implements MessageEvent {
        public DraftSubmitted(Instant timestamp) {
            super(timestamp);
        }
    }

    /** The user asks to send a failed message again. */
    final class ResendRequested extends Base implements MessageEvent {
        public ResendRequested(Instant timestamp) {
            super(timestamp);
        }
    }
}
