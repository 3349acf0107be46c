package com.questrail.chatmail.protocol.jobs.handlers;

import com.questrail.chatmail.api.ChatId;
import com.questrail.chatmail.api.ContactId;
import com.questrail.chatmail.api.MessageState;
import com.questrail.chatmail.events.ChatEvent;
import com.questrail.chatmail.events.EventChannel;
import com.questrail.chatmail.events.EventKind;
import com.questrail.chatmail.observability.NullObservabilitySink;
import com.questrail.chatmail.protocol.jobs.Job;
import com.questrail.chatmail.protocol.jobs.JobAction;
import com.questrail.chatmail.protocol.jobs.JobOutcome;
import com.questrail.chatmail.protocol.jobs.JobParams;
import com.questrail.chatmail.protocol.message.InMemoryMessageStore;
import com.questrail.chatmail.protocol.message.MessageRecord;
import com.questrail.chatmail.protocol.message.MessageStateMachine;
import com.questrail.chatmail.protocol.message.MessageStateReducer;
import com.questrail.chatmail.time.ManualWallClock;
import com.questrail.chatmail.transport.FakeTransportExecutor;
import com.questrail.chatmail.transport.FakeTransportExecutor.Op;
import com.questrail.chatmail.transport.ServerRef;
import com.questrail.chatmail.transport.TransportResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ServerJobHandlersTest
 * -----------------------------------------------------------------------------
 * Handlers that act on server copies: move, delete, mark seen.
 */
class ServerJobHandlersTest {

    private static final String MOVED = "DeltaChat";

    private FakeTransportExecutor transport;
    private InMemoryMessageStore messages;
    private MessageStateMachine stateMachine;
    private EventChannel events;

    @BeforeEach
    void setUp() {
        transport = new FakeTransportExecutor();
        messages = new InMemoryMessageStore();
        events = new EventChannel();
        stateMachine = new MessageStateMachine(messages, new MessageStateReducer(),
                (message, intents) -> {}, new ManualWallClock(), NullObservabilitySink.INSTANCE);
    }

    private MessageRecord stored(ServerRef ref, boolean hidden) {
        return messages.insert(MessageRecord.builder()
                .chatId(ChatId.of(10))
                .fromContact(ContactId.of(10))
                .state(MessageState.FRESH)
                .rfc724Mid("m" + System.nanoTime() + "@example.org")
                .serverRef(ref)
                .hidden(hidden)
                .build());
    }

    private static Job job(JobAction action, JobParams params) {
        return new Job(1, action, params, 0, 0, 0);
    }

    // ---------------------------------------------------------------------
    // Move
    // ---------------------------------------------------------------------

    @Test
    void moveRecordsNewLocation() {
        ServerRef inbox = new ServerRef("INBOX", 7);
        MessageRecord m = stored(inbox, false);
        MoveToFolderHandler handler = new MoveToFolderHandler(messages, stateMachine, transport, MOVED);

        JobOutcome outcome = handler.execute(job(JobAction.MOVE_TO_FOLDER, JobParams.forServerCopy(m.id(), inbox)));

        assertEquals(JobOutcome.SUCCESS, outcome);
        assertEquals(List.of(inbox), transport.moved());
        ServerRef now = messages.find(m.id()).orElseThrow().serverRef().orElseThrow();
        assertEquals(MOVED, now.folder());
        assertEquals(1000, now.uid());
    }

    @Test
    void messageAlreadyInTargetFolderIsNotMoved() {
        ServerRef moved = new ServerRef(MOVED, 3);
        MessageRecord m = stored(moved, false);
        MoveToFolderHandler handler = new MoveToFolderHandler(messages, stateMachine, transport, MOVED);

        assertEquals(JobOutcome.SUCCESS,
                handler.execute(job(JobAction.MOVE_TO_FOLDER, JobParams.forServerCopy(m.id(), moved))));
        assertTrue(transport.moved().isEmpty());
    }

    @Test
    void failedMoveKeepsOldLocation() {
        ServerRef inbox = new ServerRef("INBOX", 7);
        MessageRecord m = stored(inbox, false);
        transport.script(Op.MOVE, TransportResult.failedTransiently("connection reset"));
        MoveToFolderHandler handler = new MoveToFolderHandler(messages, stateMachine, transport, MOVED);

        JobOutcome outcome = handler.execute(job(JobAction.MOVE_TO_FOLDER, JobParams.forServerCopy(m.id(), inbox)));

        assertTrue(outcome instanceof JobOutcome.Recoverable);
        assertEquals(inbox, messages.find(m.id()).orElseThrow().serverRef().orElseThrow());
    }

    // ---------------------------------------------------------------------
    // Delete
    // ---------------------------------------------------------------------

    @Test
    void deleteRemovesServerCopyThenLocalRow() {
        ServerRef inbox = new ServerRef("INBOX", 9);
        MessageRecord m = stored(inbox, false);
        DeleteOnServerHandler handler = new DeleteOnServerHandler(messages, transport, events);
        Job job = job(JobAction.DELETE_ON_SERVER, JobParams.forMessage(m.id()));

        assertEquals(JobOutcome.SUCCESS, handler.execute(job));
        handler.onSuccess(job);

        assertEquals(List.of(inbox), transport.deleted());
        assertTrue(messages.find(m.id()).isEmpty());
        List<ChatEvent> emitted = new ArrayList<>();
        events.drainTo(emitted);
        assertEquals(EventKind.MSGS_CHANGED, emitted.get(0).kind());
    }

    @Test
    void deletingHiddenMessageIsSilent() {
        MessageRecord m = stored(new ServerRef("INBOX", 9), true);
        DeleteOnServerHandler handler = new DeleteOnServerHandler(messages, transport, events);
        Job job = job(JobAction.DELETE_ON_SERVER, JobParams.forMessage(m.id()));

        handler.execute(job);
        handler.onSuccess(job);

        assertTrue(messages.find(m.id()).isEmpty());
        assertEquals(0, events.size());
    }

    @Test
    void deleteWithoutServerCopySucceedsAtOnce() {
        MessageRecord m = stored(null, false);
        DeleteOnServerHandler handler = new DeleteOnServerHandler(messages, transport, events);

        assertEquals(JobOutcome.SUCCESS,
                handler.execute(job(JobAction.DELETE_ON_SERVER, JobParams.forMessage(m.id()))));
        assertTrue(transport.deleted().isEmpty());
    }

    // ---------------------------------------------------------------------
    // Seen flags
    // ---------------------------------------------------------------------

    @Test
    void receiptIsMarkedSeenAndMoved() {
        ServerRef inbox = new ServerRef("INBOX", 4);
        MarkMdnSeenOnServerHandler handler = new MarkMdnSeenOnServerHandler(transport, MOVED);

        assertEquals(JobOutcome.SUCCESS,
                handler.execute(job(JobAction.MARK_MDN_SEEN_ON_SERVER, JobParams.forReceipt(inbox, true))));

        assertEquals(List.of(inbox), transport.markedSeen());
        assertEquals(List.of(inbox), transport.moved());
    }

    @Test
    void receiptOutsidePrimaryIsOnlyMarkedSeen() {
        ServerRef moved = new ServerRef(MOVED, 4);
        MarkMdnSeenOnServerHandler handler = new MarkMdnSeenOnServerHandler(transport, MOVED);

        handler.execute(job(JobAction.MARK_MDN_SEEN_ON_SERVER, JobParams.forReceipt(moved, false)));

        assertEquals(List.of(moved), transport.markedSeen());
        assertTrue(transport.moved().isEmpty());
    }

    @Test
    void markSeenWithoutServerCopyIsTerminal() {
        MarkSeenOnServerHandler handler = new MarkSeenOnServerHandler(transport);

        JobOutcome outcome = handler.execute(job(JobAction.MARK_SEEN_ON_SERVER, JobParams.none()));

        assertTrue(outcome instanceof JobOutcome.Terminal);
    }

    @Test
    void serverAskingForRetryIsPassedThrough() {
        ServerRef inbox = new ServerRef("INBOX", 4);
        transport.script(Op.MARK_SEEN, TransportResult.retryNow());
        MarkSeenOnServerHandler handler = new MarkSeenOnServerHandler(transport);

        assertEquals(JobOutcome.RETRY_AT_ONCE,
                handler.execute(job(JobAction.MARK_SEEN_ON_SERVER, JobParams.forServerCopy(null, inbox))));
    }
}
