package com.questrail.chatmail.transport;

import java.util.Objects;

/**
 * A raw message as fetched from a mailbox, before parsing.
 */
public record FetchedMail(ServerRef serverRef, byte[] blob) {

    public FetchedMail {
        Objects.requireNonNull(serverRef, "serverRef");
        Objects.requireNonNull(blob, "blob");
    }
}
