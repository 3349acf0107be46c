package com.questrail.chatmail.protocol.jobs;

import com.questrail.chatmail.api.Transport;

/**
 * What a job does, and on which transport's thread it runs.
 */
public enum JobAction {
    /** Local maintenance: prune finished handshake messages and expire stale sessions. */
    HOUSEKEEPING(Transport.PRIMARY_MAILBOX),

    /** Exclusive account configuration run. */
    CONFIGURE(Transport.PRIMARY_MAILBOX),

    /** Delete a message's server copy, then the local row. */
    DELETE_ON_SERVER(Transport.PRIMARY_MAILBOX),

    /** Set {@code \Seen} on a message's server copy. */
    MARK_SEEN_ON_SERVER(Transport.PRIMARY_MAILBOX),

    /** Set {@code \Seen} on a received read receipt, optionally moving it. */
    MARK_MDN_SEEN_ON_SERVER(Transport.PRIMARY_MAILBOX),

    /** Move a chat message into the moved-mailbox folder. */
    MOVE_TO_FOLDER(Transport.PRIMARY_MAILBOX),

    /** Send an outgoing chat or handshake message. */
    SEND_MESSAGE(Transport.OUTBOUND),

    /** Send a read receipt. */
    SEND_MDN(Transport.OUTBOUND);

    private final Transport transport;

    JobAction(Transport transport) {
        this.transport = transport;
    }

    public Transport transport() {
        return transport;
    }
}
