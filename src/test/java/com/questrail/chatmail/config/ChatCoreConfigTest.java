package com.questrail.chatmail.config;

import com.questrail.chatmail.api.Transport;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ChatCoreConfigTest {

    @Test
    void defaultsWatchInboxAndMovedMailbox() {
        ChatCoreConfig config = ChatCoreConfig.defaults();

        assertTrue(config.watch().isWatched(Transport.PRIMARY_MAILBOX));
        assertTrue(config.watch().isWatched(Transport.MOVED_MAILBOX));
        assertFalse(config.watch().isWatched(Transport.SENT_MAILBOX));
        assertTrue(config.mdnsEnabled());
        assertEquals(Duration.ofMinutes(2), config.secureJoin().sessionTimeout());
    }

    @Test
    void builderOverridesSelectedValues() {
        ChatCoreConfig config = ChatCoreConfig.builder()
                .withMdnsEnabled(false)
                .withIdleTimeout(Duration.ofSeconds(5))
                .withWatch(new WatchConfig(Set.of(Transport.PRIMARY_MAILBOX), false, "Chats"))
                .build();

        assertFalse(config.mdnsEnabled());
        assertEquals(Duration.ofSeconds(5), config.idleTimeout());
        assertEquals("Chats", config.watch().movedMailboxFolder());
        assertEquals(BackoffPolicy.defaults(), config.backoff());
    }

    @Test
    void rejectsNonPositiveValues() {
        assertThrows(IllegalArgumentException.class,
                () -> ChatCoreConfig.builder().withIdleTimeout(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class,
                () -> ChatCoreConfig.builder().withEventCapacity(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> new SecureJoinPolicy(Duration.ofSeconds(1), Duration.ZERO));
    }

    @Test
    void outboundCannotBeWatched() {
        assertThrows(IllegalArgumentException.class,
                () -> new WatchConfig(EnumSet.of(Transport.OUTBOUND), false, "Chats"));
    }

    @Test
    void watchedSetIsCopied() {
        EnumSet<Transport> watched = EnumSet.of(Transport.PRIMARY_MAILBOX);
        WatchConfig config = new WatchConfig(watched, true, "Chats");
        watched.add(Transport.SENT_MAILBOX);

        assertFalse(config.isWatched(Transport.SENT_MAILBOX));
        assertThrows(UnsupportedOperationException.class,
                () -> config.watched().add(Transport.SENT_MAILBOX));
    }

    @Test
    void serverSideMoveRedirectsMovedFolder() {
        WatchConfig own = WatchConfig.defaults();
        WatchConfig server = own.withServerSideMove("COI");

        assertTrue(own.clientMoves());
        assertEquals("DeltaChat", own.folderFor(Transport.MOVED_MAILBOX));

        assertFalse(server.clientMoves());
        assertEquals("COI/Chats", server.effectiveMovedFolder());
        assertEquals("COI/Chats", server.folderFor(Transport.MOVED_MAILBOX));
        assertEquals(WatchConfig.INBOX, server.folderFor(Transport.PRIMARY_MAILBOX));
        assertThrows(IllegalArgumentException.class, () -> server.folderFor(Transport.OUTBOUND));
    }
}
