package com.questrail.chatmail.protocol.message;

import com.questrail.chatmail.api.MessageState;
import com.questrail.chatmail.events.EventChannel;
import com.questrail.chatmail.events.EventKind;
import com.questrail.chatmail.identity.IdentityService;
import com.questrail.chatmail.protocol.RandomTokens;
import com.questrail.chatmail.protocol.chat.ChatRecord;
import com.questrail.chatmail.protocol.chat.ChatStore;
import com.questrail.chatmail.protocol.jobs.JobAction;
import com.questrail.chatmail.protocol.jobs.JobParams;
import com.questrail.chatmail.protocol.jobs.JobQueue;
import com.questrail.chatmail.time.WallClock;
import com.questrail.chatmail.transport.HandshakeHeaders;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Creates outgoing messages and schedules their sending.
 *
 * <p>A message created in {@code PENDING} or {@code PREPARING} gets a send
 * job right away; a {@code PREPARING} message's job waits until preparation
 * finishes. Sending to a group promotes it.</p>
 */
public final class MessageComposer {
    private static final Logger log = LoggerFactory.getLogger(MessageComposer.class);

    private static final Set<MessageState> INITIAL_STATES =
            EnumSet.of(MessageState.PREPARING, MessageState.DRAFT, MessageState.PENDING);

    private final MessageStore messages;
    private final ChatStore chats;
    private final JobQueue jobs;
    private final EventChannel events;
    private final IdentityService identity;
    private final WallClock wallClock;

    public MessageComposer(MessageStore messages,
                           ChatStore chats,
                           JobQueue jobs,
                           EventChannel events,
                           IdentityService identity,
                           WallClock wallClock) {
        this.messages = Objects.requireNonNull(messages, "messages");
        this.chats = Objects.requireNonNull(chats, "chats");
        this.jobs = Objects.requireNonNull(jobs, "jobs");
        this.events = Objects.requireNonNull(events, "events");
        this.identity = Objects.requireNonNull(identity, "identity");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    /**
     * Creates a user message in {@code chat}.
     *
     * @param initialState one of {@code PREPARING}, {@code DRAFT} or {@code PENDING}
     */
    public MessageRecord compose(ChatRecord chat, String text, MessageState initialState) {
        if (!INITIAL_STATES.contains(initialState)) {
            throw new IllegalArgumentException("not an initial outgoing state: " + initialState);
        }
        return store(chat, base(chat).state(initialState).text(text), true);
    }

    /**
     * Creates a visible system message, such as a member-added notice, and sends it.
     */
    public MessageRecord composeSystem(ChatRecord chat, String text) {
        return store(chat, base(chat).state(MessageState.PENDING).system(true).text(text), true);
    }

    /**
     * Creates a hidden handshake message and sends it.
     */
    public MessageRecord composeHandshake(ChatRecord chat, HandshakeHeaders headers) {
        return store(chat, base(chat)
                .state(MessageState.PENDING)
                .system(true)
                .hidden(true)
                .wantsMdn(false)
                .text("Secure-Join: " + headers.step().headerValue())
                .handshake(headers), false);
    }

    private MessageRecord.Builder base(ChatRecord chat) {
        long now = wallClock.nowMillis();
        return MessageRecord.builder()
                .chatId(chat.id())
                .rfc724Mid(RandomTokens.messageId(identity.selfAddress()))
                .sortTimestamp(now)
                .sentTimestamp(now)
                .wantsMdn(true);
    }

    private MessageRecord store(ChatRecord chat, MessageRecord.Builder builder, boolean promote) {
        MessageRecord stored = messages.insert(builder.build());
        MessageState state = stored.state();
        if (state == MessageState.PENDING || state == MessageState.PREPARING) {
            if (promote && chat.isGroup()) {
                promote(chat);
            }
            jobs.enqueue(JobAction.SEND_MESSAGE, JobParams.forMessage(stored.id()));
        }
        if (!stored.isHidden()) {
            events.emit(EventKind.MSGS_CHANGED, chat.id().value(), stored.id().value());
        }
        log.debug("Created {} in {}", stored, chat.id());
        return stored;
    }

    private void promote(ChatRecord chat) {
        synchronized (chats) {
            chats.find(chat.id())
                    .filter(current -> !current.promoted())
                    .ifPresent(current -> {
                        chats.update(current.withPromoted(true));
                        log.debug("{} promoted", chat.id());
                    });
        }
    }
}
