package com.questrail.chatmail.protocol.jobs.handlers;

import com.questrail.chatmail.api.MessageId;
import com.questrail.chatmail.events.EventChannel;
import com.questrail.chatmail.events.EventKind;
import com.questrail.chatmail.protocol.jobs.Job;
import com.questrail.chatmail.protocol.jobs.JobHandler;
import com.questrail.chatmail.protocol.jobs.JobOutcome;
import com.questrail.chatmail.protocol.message.MessageRecord;
import com.questrail.chatmail.protocol.message.MessageStore;
import com.questrail.chatmail.transport.ServerRef;
import com.questrail.chatmail.transport.TransportExecutor;

import java.util.Objects;
import java.util.Optional;

/**
 * Deletes a message's server copy, then its local row.
 */
public final class DeleteOnServerHandler implements JobHandler {

    private final MessageStore messages;
    private final TransportExecutor transport;
    private final EventChannel events;

    public DeleteOnServerHandler(MessageStore messages, TransportExecutor transport, EventChannel events) {
        this.messages = Objects.requireNonNull(messages, "messages");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.events = Objects.requireNonNull(events, "events");
    }

    @Override
    public JobOutcome execute(Job job) {
        Optional<ServerRef> ref = job.params().server()
                .or(() -> job.params().message().flatMap(messages::find).flatMap(MessageRecord::serverRef));
        if (ref.isEmpty()) {
            // nothing on the server; the local row can go right away
            return JobOutcome.SUCCESS;
        }
        return TransportOutcomes.of(transport.deleteOnServer(ref.get()));
    }

    @Override
    public void onSuccess(Job job) {
        Optional<MessageId> id = job.params().message();
        if (id.isEmpty()) {
            return;
        }
        Optional<MessageRecord> message = messages.find(id.get());
        if (message.isPresent() && messages.delete(id.get()) && !message.get().isHidden()) {
            events.emit(EventKind.MSGS_CHANGED, message.get().chatId().value(), 0);
        }
    }
}
