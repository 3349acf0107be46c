package com.questrail.chatmail.protocol.jobs.handlers;

import com.questrail.chatmail.api.MessageId;
import com.questrail.chatmail.protocol.jobs.Job;
import com.questrail.chatmail.protocol.jobs.JobHandler;
import com.questrail.chatmail.protocol.jobs.JobOutcome;
import com.questrail.chatmail.protocol.message.MessageRecord;
import com.questrail.chatmail.protocol.message.MessageStateMachine;
import com.questrail.chatmail.protocol.message.MessageStore;
import com.questrail.chatmail.transport.ServerRef;
import com.questrail.chatmail.transport.TransportExecutor;
import com.questrail.chatmail.transport.TransportResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Moves a chat message's server copy into the moved-mailbox folder and
 * records where it ended up.
 */
public final class MoveToFolderHandler implements JobHandler {
    private static final Logger log = LoggerFactory.getLogger(MoveToFolderHandler.class);

    private final MessageStore messages;
    private final MessageStateMachine stateMachine;
    private final TransportExecutor transport;
    private final String movedFolder;

    public MoveToFolderHandler(MessageStore messages,
                               MessageStateMachine stateMachine,
                               TransportExecutor transport,
                               String movedFolder) {
        this.messages = Objects.requireNonNull(messages, "messages");
        this.stateMachine = Objects.requireNonNull(stateMachine, "stateMachine");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.movedFolder = Objects.requireNonNull(movedFolder, "movedFolder");
    }

    @Override
    public JobOutcome execute(Job job) {
        Optional<MessageId> id = job.params().message();
        if (id.isEmpty()) {
            return JobOutcome.terminal("move job without message");
        }
        Optional<MessageRecord> message = messages.find(id.get());
        if (message.isEmpty()) {
            log.debug("{} was deleted, not moving", id.get());
            return JobOutcome.SUCCESS;
        }
        Optional<ServerRef> ref = message.get().serverRef().or(() -> job.params().server());
        if (ref.isEmpty()) {
            return JobOutcome.terminal(id.get() + " has no server copy");
        }
        if (ref.get().folder().equals(movedFolder)) {
            return JobOutcome.SUCCESS;
        }

        TransportResult result = transport.move(ref.get(), movedFolder);
        if (result instanceof TransportResult.Ok ok && ok.newUid().isPresent()) {
            ServerRef moved = ref.get().inFolder(movedFolder, ok.newUid().getAsLong());
            stateMachine.updateDetails(id.get(), m -> m.withServerRef(moved));
            log.debug("{} moved to {}", id.get(), moved);
        }
        return TransportOutcomes.of(result);
    }
}
