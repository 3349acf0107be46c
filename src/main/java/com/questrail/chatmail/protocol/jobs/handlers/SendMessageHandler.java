package com.questrail.chatmail.protocol.jobs.handlers;

import com.questrail.chatmail.api.ContactId;
import com.questrail.chatmail.api.MessageId;
import com.questrail.chatmail.api.MessageState;
import com.questrail.chatmail.events.ChatEvent;
import com.questrail.chatmail.events.EventChannel;
import com.questrail.chatmail.events.EventKind;
import com.questrail.chatmail.protocol.chat.ChatRecord;
import com.questrail.chatmail.protocol.chat.ChatStore;
import com.questrail.chatmail.protocol.jobs.Job;
import com.questrail.chatmail.protocol.jobs.JobHandler;
import com.questrail.chatmail.protocol.jobs.JobOutcome;
import com.questrail.chatmail.protocol.message.MessageEvent;
import com.questrail.chatmail.protocol.message.MessageRecord;
import com.questrail.chatmail.protocol.message.MessageStateMachine;
import com.questrail.chatmail.protocol.message.MessageStateReducer;
import com.questrail.chatmail.protocol.message.MessageStore;
import com.questrail.chatmail.time.WallClock;
import com.questrail.chatmail.transport.OutboundMessage;
import com.questrail.chatmail.transport.TransportExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Sends a {@code PENDING} message to the members of its chat.
 *
 * <p>A message still being prepared is not ready; one that is no longer
 * pending (deleted, already sent) is dropped silently. The delivery state
 * changes only after the job has left the queue.</p>
 */
public final class SendMessageHandler implements JobHandler {
    private static final Logger log = LoggerFactory.getLogger(SendMessageHandler.class);

    private final MessageStore messages;
    private final ChatStore chats;
    private final MessageStateMachine stateMachine;
    private final TransportExecutor transport;
    private final EventChannel events;
    private final WallClock wallClock;
    private final boolean mdnsEnabled;

    public SendMessageHandler(MessageStore messages,
                              ChatStore chats,
                              MessageStateMachine stateMachine,
                              TransportExecutor transport,
                              EventChannel events,
                              WallClock wallClock,
                              boolean mdnsEnabled) {
        this.messages = Objects.requireNonNull(messages, "messages");
        this.chats = Objects.requireNonNull(chats, "chats");
        this.stateMachine = Objects.requireNonNull(stateMachine, "stateMachine");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.events = Objects.requireNonNull(events, "events");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.mdnsEnabled = mdnsEnabled;
    }

    @Override
    public JobOutcome execute(Job job) {
        Optional<MessageId> id = job.params().message();
        if (id.isEmpty()) {
            return JobOutcome.terminal("send job without message");
        }
        Optional<MessageRecord> found = messages.find(id.get());
        if (found.isEmpty()) {
            log.debug("{} was deleted before sending", id.get());
            return JobOutcome.SUCCESS;
        }
        MessageRecord message = found.get();
        if (message.state() == MessageState.PREPARING) {
            return JobOutcome.notReady(message.id() + " is still being prepared");
        }
        if (message.state() != MessageState.PENDING) {
            log.debug("{} is {}, nothing to send", message.id(), message.state());
            return JobOutcome.SUCCESS;
        }
        Optional<ChatRecord> chat = chats.find(message.chatId());
        if (chat.isEmpty()) {
            return JobOutcome.terminal(message.chatId() + " no longer exists");
        }

        List<ContactId> recipients = chat.get().members().stream()
                .filter(c -> !c.isSelf())
                .sorted((a, b) -> Long.compare(a.value(), b.value()))
                .collect(Collectors.toList());
        if (recipients.isEmpty()) {
            log.info("{} has no recipients, treating as sent", message.id());
            return JobOutcome.SUCCESS;
        }

        OutboundMessage outbound = new OutboundMessage(message.id(), chat.get().id(), message.rfc724Mid(),
                recipients, chat.get().groupId(), message.text(),
                mdnsEnabled && message.wantsMdn() && !message.isSystem(),
                message.handshake());
        return TransportOutcomes.of(transport.send(outbound));
    }

    @Override
    public boolean isReadyAfterDeferral(Job job) {
        return job.params().message()
                .flatMap(messages::find)
                .map(m -> m.state() != MessageState.PREPARING)
                .orElse(false);
    }

    @Override
    public void onSuccess(Job job) {
        job.params().message().ifPresent(id -> {
            Optional<MessageStateReducer.Result> result =
                    stateMachine.apply(id, new MessageEvent.SendSucceeded(wallClock.now()));
            result.filter(r -> r.newMessage().state() == MessageState.DELIVERED && !r.newMessage().isHidden())
                    .ifPresent(r -> events.emit(ChatEvent.withText(EventKind.SMTP_MESSAGE_SENT, id.value(),
                            "Message " + r.newMessage().rfc724Mid() + " sent")));
        });
    }

    @Override
    public boolean onTerminalFailure(Job job, String reason) {
        Optional<MessageId> id = job.params().message();
        if (id.isEmpty()) {
            return false;
        }
        // hidden messages fail without MSG_FAILED, leave those to the dispatcher
        return stateMachine.apply(id.get(), new MessageEvent.SendFailed(wallClock.now(), reason))
                .map(r -> r.newMessage().state() == MessageState.FAILED && !r.newMessage().isHidden())
                .orElse(false);
    }
}
