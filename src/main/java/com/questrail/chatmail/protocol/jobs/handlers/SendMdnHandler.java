package com.questrail.chatmail.protocol.jobs.handlers;

import com.questrail.chatmail.api.MessageId;
import com.questrail.chatmail.protocol.jobs.Job;
import com.questrail.chatmail.protocol.jobs.JobHandler;
import com.questrail.chatmail.protocol.jobs.JobOutcome;
import com.questrail.chatmail.protocol.message.MessageRecord;
import com.questrail.chatmail.protocol.message.MessageStore;
import com.questrail.chatmail.transport.ReadReceipt;
import com.questrail.chatmail.transport.TransportExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Sends a read receipt for a received message to its sender.
 */
public final class SendMdnHandler implements JobHandler {
    private static final Logger log = LoggerFactory.getLogger(SendMdnHandler.class);

    private final MessageStore messages;
    private final TransportExecutor transport;
    private final boolean mdnsEnabled;

    public SendMdnHandler(MessageStore messages, TransportExecutor transport, boolean mdnsEnabled) {
        this.messages = Objects.requireNonNull(messages, "messages");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.mdnsEnabled = mdnsEnabled;
    }

    @Override
    public JobOutcome execute(Job job) {
        if (!mdnsEnabled) {
            log.debug("Read receipts disabled, dropping job {}", job.id());
            return JobOutcome.SUCCESS;
        }
        Optional<MessageId> id = job.params().message();
        if (id.isEmpty()) {
            return JobOutcome.terminal("read receipt job without message");
        }
        Optional<MessageRecord> message = messages.find(id.get());
        if (message.isEmpty()) {
            log.debug("{} was deleted, no read receipt sent", id.get());
            return JobOutcome.SUCCESS;
        }
        ReadReceipt receipt = new ReadReceipt(message.get().fromContact(), message.get().rfc724Mid());
        return TransportOutcomes.of(transport.sendReadReceipt(receipt));
    }
}
