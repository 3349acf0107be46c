package com.questrail.chatmail.protocol.message;

import com.questrail.chatmail.api.ChatId;
import com.questrail.chatmail.api.ContactId;
import com.questrail.chatmail.api.MessageId;
import com.questrail.chatmail.api.MessageState;
import com.questrail.chatmail.transport.ServerRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static com.questrail.chatmail.protocol.message.MessageIntents.Kind.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * MessageStateReducerTest
 * -----------------------------------------------------------------------------
 * Unit tests for the pure message delivery-state reducer.
 *
 * No stores, jobs or events are involved: each test feeds one event to one
 * message and checks the resulting message and intents.
 */
public class MessageStateReducerTest {

    private MessageStateReducer reducer;
    private Instant now;

    @BeforeEach
    void setUp() {
        reducer = new MessageStateReducer();
        now = Instant.parse("2024-01-01T12:00:00Z");
    }

    private static MessageRecord message(MessageState state) {
        return MessageRecord.builder()
                .id(MessageId.of(42))
                .chatId(ChatId.of(12))
                .fromContact(state.isIncoming() ? ContactId.of(10) : ContactId.SELF)
                .state(state)
                .rfc724Mid("Mr.abc@example.org")
                .text("hello")
                .build();
    }

    // ---------------------------------------------------------------------
    // Outgoing lifecycle
    // ---------------------------------------------------------------------

    @Test
    void sendSucceededDeliversPendingMessage() {
        MessageStateReducer.Result r = reducer.apply(message(MessageState.PENDING), new MessageEvent.SendSucceeded(now));

        assertEquals(MessageState.DELIVERED, r.newMessage().state());
        assertTrue(r.intents().contains(NOTIFY_DELIVERED));
    }

    @Test
    void sendFailedFailsPendingMessage() {
        MessageStateReducer.Result r = reducer.apply(message(MessageState.PENDING),
                new MessageEvent.SendFailed(now, "550 rejected"));

        assertEquals(MessageState.FAILED, r.newMessage().state());
        assertEquals(MessageIntents.of(NOTIFY_FAILED).kinds(), r.intents().kinds());
    }

    @Test
    void bounceFailsDeliveredMessage() {
        MessageStateReducer.Result r = reducer.apply(message(MessageState.DELIVERED),
                new MessageEvent.DeliveryFailureReported(now, "mailbox full"));

        assertEquals(MessageState.FAILED, r.newMessage().state());
    }

    @Test
    void readReceiptAdvancesDeliveredMessage() {
        MessageStateReducer.Result r = reducer.apply(message(MessageState.DELIVERED),
                new MessageEvent.ReadReceiptReceived(now));

        assertEquals(MessageState.MDN_RECEIVED, r.newMessage().state());
        assertTrue(r.intents().contains(NOTIFY_READ));
    }

    @Test
    void duplicateDeliveryConfirmationIsIgnored() {
        MessageRecord delivered = message(MessageState.DELIVERED);

        MessageStateReducer.Result r = reducer.apply(delivered, new MessageEvent.SendSucceeded(now));

        assertSame(delivered, r.newMessage());
        assertTrue(r.intents().isEmpty());
        assertFalse(r.changed(delivered));
    }

    @Test
    void lateReceiptForFailedMessageIsIgnored() {
        MessageStateReducer.Result r = reducer.apply(message(MessageState.FAILED),
                new MessageEvent.ReadReceiptReceived(now));

        assertEquals(MessageState.FAILED, r.newMessage().state());
        assertTrue(r.intents().isEmpty());
    }

    @Test
    void failedMessageNeverReturnsToDelivered() {
        MessageStateReducer.Result r = reducer.apply(message(MessageState.FAILED),
                new MessageEvent.SendSucceeded(now));

        assertEquals(MessageState.FAILED, r.newMessage().state());
    }

    // ---------------------------------------------------------------------
    // Preparation and drafts
    // ---------------------------------------------------------------------

    @Test
    void finishedPreparationExpeditesTheWaitingSendJob() {
        MessageStateReducer.Result r = reducer.apply(message(MessageState.PREPARING),
                new MessageEvent.PreparationFinished(now));

        assertEquals(MessageState.PENDING, r.newMessage().state());
        assertTrue(r.intents().contains(EXPEDITE_SEND));
        assertFalse(r.intents().contains(SCHEDULE_SEND));
    }

    @Test
    void parkedPreparationBecomesDraft() {
        MessageStateReducer.Result r = reducer.apply(message(MessageState.PREPARING),
                new MessageEvent.ParkedAsDraft(now));

        assertEquals(MessageState.DRAFT, r.newMessage().state());
    }

    @Test
    void submittedDraftSchedulesASend() {
        MessageStateReducer.Result r = reducer.apply(message(MessageState.DRAFT),
                new MessageEvent.DraftSubmitted(now));

        assertEquals(MessageState.PENDING, r.newMessage().state());
        assertTrue(r.intents().contains(SCHEDULE_SEND));
    }

    @Test
    void draftSubmissionOfNonDraftIsIgnored() {
        MessageStateReducer.Result r = reducer.apply(message(MessageState.PENDING),
                new MessageEvent.DraftSubmitted(now));

        assertTrue(r.intents().isEmpty());
    }

    @Test
    void resendTakesFailedMessageBackToPending() {
        MessageStateReducer.Result r = reducer.apply(message(MessageState.FAILED),
                new MessageEvent.ResendRequested(now));

        assertEquals(MessageState.PENDING, r.newMessage().state());
        assertTrue(r.intents().contains(SCHEDULE_SEND));
    }

    @Test
    void resendOfDeliveredMessageIsIgnored() {
        MessageStateReducer.Result r = reducer.apply(message(MessageState.DELIVERED),
                new MessageEvent.ResendRequested(now));

        assertEquals(MessageState.DELIVERED, r.newMessage().state());
    }

    // ---------------------------------------------------------------------
    // Incoming lifecycle
    // ---------------------------------------------------------------------

    @Test
    void noticedThenSeen() {
        MessageStateReducer.Result noticed = reducer.apply(message(MessageState.FRESH),
                new MessageEvent.MarkNoticed(now));
        assertEquals(MessageState.NOTICED, noticed.newMessage().state());

        MessageStateReducer.Result seen = reducer.apply(noticed.newMessage(),
                new MessageEvent.MarkSeen(now, true, true));
        assertEquals(MessageState.SEEN, seen.newMessage().state());
    }

    @Test
    void seenInRealChatMarksServerAndSendsReceipt() {
        MessageRecord fresh = message(MessageState.FRESH).toBuilder()
                .serverRef(new ServerRef("INBOX", 7))
                .wantsMdn(true)
                .build();

        MessageStateReducer.Result r = reducer.apply(fresh, new MessageEvent.MarkSeen(now, true, true));

        assertTrue(r.intents().contains(MARK_SEEN_ON_SERVER));
        assertTrue(r.intents().contains(SEND_READ_RECEIPT));
        assertTrue(r.intents().contains(NOTIFY_CHANGED));
    }

    @Test
    void seenWithReceiptsDisabledSendsNoReceipt() {
        MessageRecord fresh = message(MessageState.FRESH).toBuilder()
                .serverRef(new ServerRef("INBOX", 7))
                .wantsMdn(true)
                .build();

        MessageStateReducer.Result r = reducer.apply(fresh, new MessageEvent.MarkSeen(now, true, false));

        assertTrue(r.intents().contains(MARK_SEEN_ON_SERVER));
        assertFalse(r.intents().contains(SEND_READ_RECEIPT));
    }

    @Test
    void seenInSpecialChatStaysLocal() {
        MessageRecord fresh = message(MessageState.FRESH).toBuilder()
                .chatId(ChatId.DEADDROP)
                .serverRef(new ServerRef("INBOX", 7))
                .wantsMdn(true)
                .build();

        MessageStateReducer.Result r = reducer.apply(fresh, new MessageEvent.MarkSeen(now, false, true));

        assertEquals(MessageState.SEEN, r.newMessage().state());
        assertEquals(MessageIntents.of(NOTIFY_CHANGED).kinds(), r.intents().kinds());
    }

    @Test
    void seenIsFinal() {
        MessageStateReducer.Result r = reducer.apply(message(MessageState.SEEN),
                new MessageEvent.MarkNoticed(now));

        assertEquals(MessageState.SEEN, r.newMessage().state());
        assertTrue(r.intents().isEmpty());
    }

    @Test
    void outgoingMessageCannotBeMarkedSeen() {
        MessageStateReducer.Result r = reducer.apply(message(MessageState.DELIVERED),
                new MessageEvent.MarkSeen(now, true, true));

        assertEquals(MessageState.DELIVERED, r.newMessage().state());
        assertTrue(r.intents().isEmpty());
    }
}
