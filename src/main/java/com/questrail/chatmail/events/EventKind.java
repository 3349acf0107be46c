package com.questrail.chatmail.events;

import java.util.Optional;

/**
 * Kinds of events delivered to the embedder, with their stable numeric codes.
 *
 * <p>Embedders must treat kinds they do not know as no-ops, so new kinds can be
 * added without breaking them.</p>
 */
public enum EventKind {
    INFO(100),
    SMTP_MESSAGE_SENT(103),
    WARNING(300),
    ERROR(400),
    ERROR_NETWORK(401),

    /** data1 chat id, data2 message id (0 for many). */
    MSGS_CHANGED(2000),

    /** data1 chat id, data2 message id. */
    INCOMING_MSG(2005),

    /** data1 chat id, data2 message id. */
    MSG_DELIVERED(2010),

    /** data1 chat id, data2 message id. */
    MSG_FAILED(2012),

    /** data1 chat id, data2 message id. */
    MSG_READ(2015),

    /** data1 chat id. */
    CHAT_MODIFIED(2020),

    /** data1 permille, 0 on failure, 1000 when done. */
    CONFIGURE_PROGRESS(2041),

    /** data1 contact id, data2 permille. */
    SECUREJOIN_INVITER_PROGRESS(2060),

    /** data1 contact id, data2 permille. */
    SECUREJOIN_JOINER_PROGRESS(2061),

    /** data1 contact id, text the failure reason. */
    SECUREJOIN_FAILED(2062),

    /** data1 job id, text the failure reason. */
    JOB_FAILED(2080);

    private final int code;

    EventKind(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static Optional<EventKind> fromCode(int code) {
        for (EventKind kind : values()) {
            if (kind.code == code) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
