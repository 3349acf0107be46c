package com.questrail.chatmail.protocol.jobs.handlers;

import com.questrail.chatmail.api.ContactId;
import com.questrail.chatmail.api.MessageState;
import com.questrail.chatmail.events.EventChannel;
import com.questrail.chatmail.observability.NullObservabilitySink;
import com.questrail.chatmail.protocol.chat.ChatRecord;
import com.questrail.chatmail.protocol.chat.InMemoryChatStore;
import com.questrail.chatmail.protocol.jobs.Job;
import com.questrail.chatmail.protocol.jobs.JobAction;
import com.questrail.chatmail.protocol.jobs.JobOutcome;
import com.questrail.chatmail.protocol.jobs.JobParams;
import com.questrail.chatmail.protocol.message.InMemoryMessageStore;
import com.questrail.chatmail.protocol.message.MessageEvent;
import com.questrail.chatmail.protocol.message.MessageRecord;
import com.questrail.chatmail.protocol.message.MessageStateMachine;
import com.questrail.chatmail.protocol.message.MessageStateReducer;
import com.questrail.chatmail.time.ManualWallClock;
import com.questrail.chatmail.transport.FakeTransportExecutor;
import com.questrail.chatmail.transport.FakeTransportExecutor.Op;
import com.questrail.chatmail.transport.TransportResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SendMessageHandlerTest
 * -----------------------------------------------------------------------------
 * Readiness of prepared messages and how send failures are reported.
 */
class SendMessageHandlerTest {

    private FakeTransportExecutor transport;
    private InMemoryMessageStore messages;
    private MessageStateMachine stateMachine;
    private ManualWallClock clock;
    private ChatRecord chat;
    private SendMessageHandler handler;

    @BeforeEach
    void setUp() {
        transport = new FakeTransportExecutor();
        messages = new InMemoryMessageStore();
        clock = new ManualWallClock();
        InMemoryChatStore chats = new InMemoryChatStore();
        chat = chats.getOrCreateSingle(ContactId.of(10), false);
        stateMachine = new MessageStateMachine(messages, new MessageStateReducer(),
                (message, intents) -> {}, clock, NullObservabilitySink.INSTANCE);
        handler = new SendMessageHandler(messages, chats, stateMachine, transport,
                new EventChannel(), clock, true);
    }

    private MessageRecord stored(MessageState state, boolean hidden) {
        return messages.insert(MessageRecord.builder()
                .chatId(chat.id())
                .fromContact(ContactId.SELF)
                .state(state)
                .rfc724Mid("m" + System.nanoTime() + "@example.org")
                .text("hello")
                .hidden(hidden)
                .system(hidden)
                .build());
    }

    private static Job sendJob(MessageRecord m) {
        return new Job(1, JobAction.SEND_MESSAGE, JobParams.forMessage(m.id()), 0, 0, 0);
    }

    // ---------------------------------------------------------------------
    // Prepared messages
    // ---------------------------------------------------------------------

    @Test
    void preparingMessageIsNotReady() {
        MessageRecord m = stored(MessageState.PREPARING, false);

        assertTrue(handler.execute(sendJob(m)) instanceof JobOutcome.NotReady);
        assertFalse(handler.isReadyAfterDeferral(sendJob(m)));
        assertTrue(transport.sent().isEmpty());
    }

    @Test
    void finishedPreparationIsSeenAfterDeferral() {
        MessageRecord m = stored(MessageState.PREPARING, false);
        assertTrue(handler.execute(sendJob(m)) instanceof JobOutcome.NotReady);

        stateMachine.apply(m.id(), new MessageEvent.PreparationFinished(clock.now()));

        assertTrue(handler.isReadyAfterDeferral(sendJob(m)));
    }

    // ---------------------------------------------------------------------
    // Terminal failures
    // ---------------------------------------------------------------------

    @Test
    void visibleFailureIsReportedByMessageState() {
        MessageRecord m = stored(MessageState.PENDING, false);
        transport.script(Op.SEND, TransportResult.failedPermanently("550 no such user"));

        JobOutcome outcome = handler.execute(sendJob(m));
        assertTrue(outcome instanceof JobOutcome.Terminal);

        assertTrue(handler.onTerminalFailure(sendJob(m), "550 no such user"));
        assertEquals(MessageState.FAILED, messages.find(m.id()).orElseThrow().state());
    }

    @Test
    void hiddenFailureIsLeftToTheDispatcher() {
        MessageRecord m = stored(MessageState.PENDING, true);
        transport.script(Op.SEND, TransportResult.failedPermanently("550 no such user"));

        assertTrue(handler.execute(sendJob(m)) instanceof JobOutcome.Terminal);

        assertFalse(handler.onTerminalFailure(sendJob(m), "550 no such user"));
        assertEquals(MessageState.FAILED, messages.find(m.id()).orElseThrow().state());
    }
}
