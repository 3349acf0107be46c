package com.questrail.chatmail.protocol.jobs;

import com.questrail.chatmail.api.MessageId;
import com.questrail.chatmail.transport.ServerRef;

import java.util.Optional;

/**
 * Parameters of a job. Which fields are set depends on the action.
 *
 * @param messageId local message the job concerns, may be {@code null}
 * @param serverRef server copy the job concerns, may be {@code null}
 * @param alsoMove  for {@code MARK_MDN_SEEN_ON_SERVER}, move after marking
 */
public record JobParams(MessageId messageId, ServerRef serverRef, boolean alsoMove) {

    private static final JobParams NONE = new JobParams(null, null, false);

    public static JobParams none() {
        return NONE;
    }

    public static JobParams forMessage(MessageId messageId) {
        return new JobParams(messageId, null, false);
    }

    public static JobParams forServerCopy(MessageId messageId, ServerRef serverRef) {
        return new JobParams(messageId, serverRef, false);
    }

    public static JobParams forReceipt(ServerRef serverRef, boolean alsoMove) {
        return new JobParams(null, serverRef, alsoMove);
    }

    public Optional<MessageId> message() {
        return Optional.ofNullable(messageId);
    }

    public Optional<ServerRef> server() {
        return Optional.ofNullable(serverRef);
    }
}
