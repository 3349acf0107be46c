package com.questrail.chatmail.protocol.jobs.handlers;

import com.questrail.chatmail.api.MessageState;
import com.questrail.chatmail.protocol.jobs.Job;
import com.questrail.chatmail.protocol.jobs.JobHandler;
import com.questrail.chatmail.protocol.jobs.JobOutcome;
import com.questrail.chatmail.protocol.message.MessageRecord;
import com.questrail.chatmail.protocol.message.MessageStore;
import com.questrail.chatmail.protocol.securejoin.SecureJoinEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Local maintenance run on the primary mailbox's thread.
 *
 * <p>Drops outgoing handshake messages whose send has finished (received ones
 * are removed with their server copy) and fails secure-join sessions that
 * outlived their deadline. Touches nothing on the server.</p>
 */
public final class HousekeepingHandler implements JobHandler {
    private static final Logger log = LoggerFactory.getLogger(HousekeepingHandler.class);

    private static final Set<MessageState> SEND_FINISHED =
            EnumSet.of(MessageState.DELIVERED, MessageState.FAILED, MessageState.MDN_RECEIVED);

    private final MessageStore messages;
    private final SecureJoinEngine secureJoin;

    public HousekeepingHandler(MessageStore messages, SecureJoinEngine secureJoin) {
        this.messages = Objects.requireNonNull(messages, "messages");
        this.secureJoin = Objects.requireNonNull(secureJoin, "secureJoin");
    }

    @Override
    public JobOutcome execute(Job job) {
        int pruned = 0;
        for (MessageRecord m : messages.listHidden()) {
            if (m.direction() == MessageRecord.Direction.OUTGOING && SEND_FINISHED.contains(m.state())
                    && messages.delete(m.id())) {
                pruned++;
            }
        }
        int expired = secureJoin.expireStale();
        log.info("Housekeeping done: {} handshake message(s) pruned, {} secure-join session(s) expired",
                pruned, expired);
        return JobOutcome.SUCCESS;
    }
}
