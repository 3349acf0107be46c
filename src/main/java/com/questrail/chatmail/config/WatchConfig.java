package com.questrail.chatmail.config;

import com.questrail.chatmail.api.Transport;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Which mailboxes are fetched, and where chat messages are moved.
 *
 * <p>Some servers file chat messages into their own folder. When
 * {@code serverSideMoveFolder} is set the core stops moving messages itself
 * and watches that folder as the moved mailbox instead of
 * {@code movedMailboxFolder}.</p>
 *
 * @param watched              mailbox transports that {@code fetch} reads
 * @param moveToMovedMailbox   whether chat messages are moved out of the inbox
 * @param movedMailboxFolder   server folder name of the moved mailbox
 * @param serverSideMoveFolder folder the server moves chat messages into, or null
 */
public record WatchConfig(
        Set<Transport> watched,
        boolean moveToMovedMailbox,
        String movedMailboxFolder,
        String serverSideMoveFolder
) {
    public static final String INBOX = "INBOX";
    public static final String SENT = "Sent";

    public WatchConfig {
        Objects.requireNonNull(watched, "watched");
        Objects.requireNonNull(movedMailboxFolder, "movedMailboxFolder");
        if (watched.contains(Transport.OUTBOUND)) {
            throw new IllegalArgumentException("OUTBOUND cannot be watched");
        }
        if (movedMailboxFolder.isBlank()) {
            throw new IllegalArgumentException("movedMailboxFolder must not be blank");
        }
        if (serverSideMoveFolder != null && serverSideMoveFolder.isBlank()) {
            throw new IllegalArgumentException("serverSideMoveFolder must not be blank");
        }
        watched = watched.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(watched));
    }

    public WatchConfig(Set<Transport> watched, boolean moveToMovedMailbox, String movedMailboxFolder) {
        this(watched, moveToMovedMailbox, movedMailboxFolder, null);
    }

    public static WatchConfig defaults() {
        return new WatchConfig(
                EnumSet.of(Transport.PRIMARY_MAILBOX, Transport.MOVED_MAILBOX),
                true,
                "DeltaChat");
    }

    /**
     * Hands moving over to a server that files chat messages into
     * {@code <mailboxRoot>/Chats}.
     */
    public WatchConfig withServerSideMove(String mailboxRoot) {
        Objects.requireNonNull(mailboxRoot, "mailboxRoot");
        return new WatchConfig(watched, moveToMovedMailbox, movedMailboxFolder, mailboxRoot + "/Chats");
    }

    public boolean isWatched(Transport transport) {
        return watched.contains(transport);
    }

    public boolean serverSideMove() {
        return serverSideMoveFolder != null;
    }

    /**
     * True if the core itself moves chat messages and receipts out of the inbox.
     */
    public boolean clientMoves() {
        return moveToMovedMailbox && !serverSideMove();
    }

    public String effectiveMovedFolder() {
        return Optional.ofNullable(serverSideMoveFolder).orElse(movedMailboxFolder);
    }

    /**
     * The server folder a mailbox transport reads.
     */
    public String folderFor(Transport mailbox) {
        switch (mailbox) {
            case PRIMARY_MAILBOX:
                return INBOX;
            case MOVED_MAILBOX:
                return effectiveMovedFolder();
            case SENT_MAILBOX:
                return SENT;
            default:
                throw new IllegalArgumentException(mailbox + " has no folder");
        }
    }
}
