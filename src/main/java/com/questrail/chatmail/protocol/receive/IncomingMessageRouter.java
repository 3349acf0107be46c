package com.questrail.chatmail.protocol.receive;

import com.questrail.chatmail.api.ChatId;
import com.questrail.chatmail.api.ChatType;
import com.questrail.chatmail.api.ContactId;
import com.questrail.chatmail.api.MessageState;
import com.questrail.chatmail.api.Transport;
import com.questrail.chatmail.config.WatchConfig;
import com.questrail.chatmail.events.EventChannel;
import com.questrail.chatmail.events.EventKind;
import com.questrail.chatmail.identity.ContactResolver;
import com.questrail.chatmail.protocol.chat.ChatRecord;
import com.questrail.chatmail.protocol.chat.ChatStore;
import com.questrail.chatmail.protocol.jobs.JobAction;
import com.questrail.chatmail.protocol.jobs.JobParams;
import com.questrail.chatmail.protocol.jobs.JobQueue;
import com.questrail.chatmail.protocol.message.MessageEvent;
import com.questrail.chatmail.protocol.message.MessageRecord;
import com.questrail.chatmail.protocol.message.MessageStateMachine;
import com.questrail.chatmail.protocol.message.MessageStore;
import com.questrail.chatmail.protocol.securejoin.SecureJoinEngine;
import com.questrail.chatmail.time.WallClock;
import com.questrail.chatmail.transport.HandshakeHeaders;
import com.questrail.chatmail.transport.ParsedMessage;
import com.questrail.chatmail.transport.ServerRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * IncomingMessageRouter
 * -----------------------------------------------------------------------------
 * Decides what a fetched message is and where it goes.
 *
 * <ul>
 *   <li>Read receipts advance the original message and are cleaned up on the server.</li>
 *   <li>Bounces fail the original message.</li>
 *   <li>Handshake messages are stored hidden, handed to the
 *       {@link SecureJoinEngine} and deleted from the server.</li>
 *   <li>Everything else is stored {@code FRESH} in the sender's chat, or in
 *       the deaddrop if the sender was never accepted. An archived chat
 *       returns to the chat list.</li>
 * </ul>
 * A message whose {@code Message-ID} is already stored is skipped, so a
 * re-fetch after a crash does not duplicate it.
 */
public final class IncomingMessageRouter {
    private static final Logger log = LoggerFactory.getLogger(IncomingMessageRouter.class);

    private final MessageStore messages;
    private final ChatStore chats;
    private final ContactResolver contacts;
    private final MessageStateMachine stateMachine;
    private final JobQueue jobs;
    private final SecureJoinEngine secureJoin;
    private final EventChannel events;
    private final WatchConfig watch;
    private final WallClock wallClock;

    public IncomingMessageRouter(MessageStore messages,
                                 ChatStore chats,
                                 ContactResolver contacts,
                                 MessageStateMachine stateMachine,
                                 JobQueue jobs,
                                 SecureJoinEngine secureJoin,
                                 EventChannel events,
                                 WatchConfig watch,
                                 WallClock wallClock) {
        this.messages = Objects.requireNonNull(messages, "messages");
        this.chats = Objects.requireNonNull(chats, "chats");
        this.contacts = Objects.requireNonNull(contacts, "contacts");
        this.stateMachine = Objects.requireNonNull(stateMachine, "stateMachine");
        this.jobs = Objects.requireNonNull(jobs, "jobs");
        this.secureJoin = Objects.requireNonNull(secureJoin, "secureJoin");
        this.events = Objects.requireNonNull(events, "events");
        this.watch = Objects.requireNonNull(watch, "watch");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    /**
     * Routes one parsed message fetched from {@code mailbox}.
     *
     * @return the stored message, or empty if nothing was stored
     */
    public Optional<MessageRecord> route(Transport mailbox, ServerRef ref, ParsedMessage parsed) {
        if (messages.findByRfc724Mid(parsed.rfc724Mid()).isPresent()) {
            log.debug("{} already stored, skipping", parsed.rfc724Mid());
            return Optional.empty();
        }
        if (parsed.isReadReceipt()) {
            onReadReceipt(mailbox, ref, parsed.readReceiptFor().get());
            return Optional.empty();
        }
        if (parsed.isDeliveryFailure()) {
            onDeliveryFailure(parsed.deliveryFailureFor().get(), parsed.text());
            return Optional.empty();
        }

        ContactId from = contacts.resolve(parsed.fromAddress(), parsed.fromName());
        if (from.isSelf()) {
            log.debug("{} was sent by this account, skipping", parsed.rfc724Mid());
            return Optional.empty();
        }
        if (parsed.isHandshake()) {
            return Optional.of(onHandshake(from, ref, parsed, parsed.handshake().get()));
        }
        return Optional.of(onChatMessage(mailbox, from, ref, parsed));
    }

    private void onReadReceipt(Transport mailbox, ServerRef ref, String originalMid) {
        Optional<MessageRecord> original = messages.findByRfc724Mid(originalMid);
        if (original.isPresent()) {
            stateMachine.apply(original.get().id(), new MessageEvent.ReadReceiptReceived(wallClock.now()));
        } else {
            log.debug("Read receipt for unknown message {}", originalMid);
        }
        boolean alsoMove = watch.clientMoves() && mailbox == Transport.PRIMARY_MAILBOX;
        jobs.enqueue(JobAction.MARK_MDN_SEEN_ON_SERVER, JobParams.forReceipt(ref, alsoMove));
    }

    private void onDeliveryFailure(String originalMid, String reason) {
        Optional<MessageRecord> original = messages.findByRfc724Mid(originalMid);
        if (original.isEmpty()) {
            log.debug("Bounce for unknown message {}", originalMid);
            return;
        }
        stateMachine.apply(original.get().id(),
                new MessageEvent.DeliveryFailureReported(wallClock.now(), reason));
    }

    private MessageRecord onHandshake(ContactId from, ServerRef ref, ParsedMessage parsed, HandshakeHeaders headers) {
        ChatRecord chat = chats.getOrCreateSingle(from, true);
        MessageRecord stored = messages.insert(incoming(chat.id(), from, ref, parsed)
                .state(MessageState.SEEN)
                .system(true)
                .hidden(true)
                .wantsMdn(false)
                .handshake(headers)
                .build());
        jobs.enqueue(JobAction.DELETE_ON_SERVER, JobParams.forServerCopy(stored.id(), ref));
        secureJoin.onHandshakeMessage(from, headers);
        return stored;
    }

    private MessageRecord onChatMessage(Transport mailbox, ContactId from, ServerRef ref, ParsedMessage parsed) {
        ChatId chatId = parsed.groupId() != null
                ? groupChatFor(from, parsed.groupId(), parsed.groupName())
                : singleChatFor(from);

        MessageRecord stored = messages.insert(incoming(chatId, from, ref, parsed)
                .state(MessageState.FRESH)
                .build());

        if (chatId.equals(ChatId.DEADDROP)) {
            events.emit(EventKind.MSGS_CHANGED, chatId.value(), stored.id().value());
        } else {
            unarchive(chatId);
            events.emit(EventKind.INCOMING_MSG, chatId.value(), stored.id().value());
        }

        if (watch.clientMoves() && mailbox == Transport.PRIMARY_MAILBOX && parsed.chatMessage()) {
            jobs.enqueue(JobAction.MOVE_TO_FOLDER, JobParams.forServerCopy(stored.id(), ref));
        }
        return stored;
    }

    private void unarchive(ChatId chatId) {
        synchronized (chats) {
            chats.find(chatId)
                    .filter(ChatRecord::archived)
                    .ifPresent(chat -> {
                        chats.update(chat.withArchived(false));
                        events.emit(EventKind.CHAT_MODIFIED, chatId.value(), 0);
                    });
        }
    }

    private ChatId singleChatFor(ContactId from) {
        synchronized (chats) {
            Optional<ChatRecord> existing = chats.findSingle(from).filter(c -> !c.blocked());
            if (existing.isPresent()) {
                return existing.get().id();
            }
            if (contacts.isAccepted(from)) {
                ChatRecord chat = chats.getOrCreateSingle(from, false);
                if (chat.blocked()) {
                    chat = chat.withBlocked(false);
                    chats.update(chat);
                }
                return chat.id();
            }
        }
        return ChatId.DEADDROP;
    }

    private ChatId groupChatFor(ContactId from, String groupId, String groupName) {
        synchronized (chats) {
            Optional<ChatRecord> existing = chats.findByGroupId(groupId);
            if (existing.isPresent()) {
                return existing.get().id();
            }
            if (!contacts.isAccepted(from)) {
                return ChatId.DEADDROP;
            }
            ChatRecord created = chats.createGroup(ChatType.GROUP, groupName, groupId)
                    .withMember(from)
                    .withPromoted(true);
            chats.update(created);
            log.info("Created {} for incoming group {}", created.id(), groupId);
            return created.id();
        }
    }

    private MessageRecord.Builder incoming(ChatId chatId, ContactId from, ServerRef ref, ParsedMessage parsed) {
        long now = wallClock.nowMillis();
        return MessageRecord.builder()
                .chatId(chatId)
                .fromContact(from)
                .sortTimestamp(now)
                .sentTimestamp(parsed.sentTimestamp())
                .receivedTimestamp(now)
                .rfc724Mid(parsed.rfc724Mid())
                .serverRef(ref)
                .wantsMdn(parsed.wantsMdn())
                .text(parsed.text());
    }
}
