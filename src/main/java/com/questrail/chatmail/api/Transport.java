package com.questrail.chatmail.api;

/**
 * The mail transports a caller drives with its own threads.
 *
 * <p>Each transport owns exactly one interrupt coordinator and one job lane.
 * The three mailbox transports fetch mail; {@link #OUTBOUND} only sends.</p>
 */
public enum Transport {
    /** The primary inbox (IMAP {@code INBOX}). */
    PRIMARY_MAILBOX(true),

    /** The folder chat messages are moved to, when moving is enabled. */
    MOVED_MAILBOX(true),

    /** The server-side sent folder. */
    SENT_MAILBOX(true),

    /** Outbound submission (SMTP). */
    OUTBOUND(false);

    private final boolean fetches;

    Transport(boolean fetches) {
        this.fetches = fetches;
    }

    /**
     * Returns true if this transport has a mailbox that can be fetched.
     */
    public boolean fetches() {
        return fetches;
    }
}
