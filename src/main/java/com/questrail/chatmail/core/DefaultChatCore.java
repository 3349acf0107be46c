package com.questrail.chatmail.core;

import com.questrail.chatmail.api.ChatCore;
import com.questrail.chatmail.api.ChatId;
import com.questrail.chatmail.api.ChatType;
import com.questrail.chatmail.api.ContactId;
import com.questrail.chatmail.api.MessageId;
import com.questrail.chatmail.api.MessageState;
import com.questrail.chatmail.api.NoSuchChatException;
import com.questrail.chatmail.api.NoSuchContactException;
import com.questrail.chatmail.api.NoSuchMessageException;
import com.questrail.chatmail.api.SecureJoinResult;
import com.questrail.chatmail.api.Transport;
import com.questrail.chatmail.config.ChatCoreConfig;
import com.questrail.chatmail.events.ChatEvent;
import com.questrail.chatmail.events.EventChannel;
import com.questrail.chatmail.events.EventKind;
import com.questrail.chatmail.identity.ContactResolver;
import com.questrail.chatmail.identity.IdentityService;
import com.questrail.chatmail.observability.ChatObservabilitySink;
import com.questrail.chatmail.observability.NullObservabilitySink;
import com.questrail.chatmail.observability.TransportObservabilityEvent;
import com.questrail.chatmail.protocol.RandomTokens;
import com.questrail.chatmail.protocol.chat.ChatMembership;
import com.questrail.chatmail.protocol.chat.ChatRecord;
import com.questrail.chatmail.protocol.chat.ChatStore;
import com.questrail.chatmail.protocol.chat.InMemoryChatStore;
import com.questrail.chatmail.protocol.idle.InterruptCoordinator;
import com.questrail.chatmail.protocol.idle.NetworkErrorTracker;
import com.questrail.chatmail.protocol.idle.TransportCoordinators;
import com.questrail.chatmail.protocol.idle.WakeReason;
import com.questrail.chatmail.protocol.jobs.InMemoryJobStore;
import com.questrail.chatmail.protocol.jobs.JobAction;
import com.questrail.chatmail.protocol.jobs.JobDispatcher;
import com.questrail.chatmail.protocol.jobs.JobHandler;
import com.questrail.chatmail.protocol.jobs.JobParams;
import com.questrail.chatmail.protocol.jobs.JobQueue;
import com.questrail.chatmail.protocol.jobs.JobStore;
import com.questrail.chatmail.protocol.jobs.handlers.ConfigureHandler;
import com.questrail.chatmail.protocol.jobs.handlers.HousekeepingHandler;
import com.questrail.chatmail.protocol.jobs.handlers.DeleteOnServerHandler;
import com.questrail.chatmail.protocol.jobs.handlers.MarkMdnSeenOnServerHandler;
import com.questrail.chatmail.protocol.jobs.handlers.MarkSeenOnServerHandler;
import com.questrail.chatmail.protocol.jobs.handlers.MoveToFolderHandler;
import com.questrail.chatmail.protocol.jobs.handlers.SendMdnHandler;
import com.questrail.chatmail.protocol.jobs.handlers.SendMessageHandler;
import com.questrail.chatmail.protocol.message.DefaultMessageIntentExecutor;
import com.questrail.chatmail.protocol.message.InMemoryMessageStore;
import com.questrail.chatmail.protocol.message.MessageComposer;
import com.questrail.chatmail.protocol.message.MessageEvent;
import com.questrail.chatmail.protocol.message.MessageRecord;
import com.questrail.chatmail.protocol.message.MessageStateMachine;
import com.questrail.chatmail.protocol.message.MessageStateReducer;
import com.questrail.chatmail.protocol.message.MessageStore;
import com.questrail.chatmail.protocol.ongoing.OngoingProcess;
import com.questrail.chatmail.protocol.receive.IncomingMessageRouter;
import com.questrail.chatmail.protocol.securejoin.SecureJoinEngine;
import com.questrail.chatmail.protocol.securejoin.SecureJoinTokens;
import com.questrail.chatmail.time.MonotonicClock;
import com.questrail.chatmail.time.SystemMonotonicClock;
import com.questrail.chatmail.time.SystemWallClock;
import com.questrail.chatmail.time.WallClock;
import com.questrail.chatmail.transport.FetchedMail;
import com.questrail.chatmail.transport.MessageParseException;
import com.questrail.chatmail.transport.MessageParser;
import com.questrail.chatmail.transport.ParsedMessage;
import com.questrail.chatmail.transport.TransportException;
import com.questrail.chatmail.transport.TransportExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * DefaultChatCore
 * =============================================================================
 * Composition root and implementation of {@link ChatCore}.
 *
 * <p>Wires the stores, the job queue and dispatcher, the message state
 * machine, the secure-join engine and the receive path around the
 * collaborators the embedder supplies through {@link Builder}. Stores default
 * to in-memory implementations.</p>
 */
public final class DefaultChatCore implements ChatCore
{
    private static final Logger log = LoggerFactory.getLogger(DefaultChatCore.class);

    private final ChatCoreConfig config;
    private final TransportExecutor transport;
    private final MessageParser parser;
    private final ContactResolver contacts;
    private final JobStore jobStore;
    private final MessageStore messages;
    private final ChatStore chats;
    private final EventChannel events;
    private final TransportCoordinators coordinators;
    private final NetworkErrorTracker networkErrors;
    private final JobQueue jobs;
    private final JobDispatcher dispatcher;
    private final MessageStateMachine stateMachine;
    private final MessageComposer composer;
    private final ChatMembership membership;
    private final OngoingProcess ongoing;
    private final SecureJoinEngine secureJoin;
    private final IncomingMessageRouter router;
    private final WallClock wallClock;
    private final ChatObservabilitySink sink;

    private DefaultChatCore(Builder b) {
        this.config = b.config;
        this.transport = b.transport;
        this.parser = b.parser;
        this.contacts = b.contacts;
        this.jobStore = b.jobStore;
        this.messages = b.messageStore;
        this.chats = b.chatStore;
        this.wallClock = b.wallClock;
        this.sink = b.observabilitySink;

        this.events = new EventChannel(config.eventCapacity());
        this.coordinators = new TransportCoordinators();
        this.networkErrors = new NetworkErrorTracker(events, sink, wallClock);
        this.jobs = new JobQueue(jobStore, coordinators, wallClock, sink);
        this.stateMachine = new MessageStateMachine(messages, new MessageStateReducer(),
                new DefaultMessageIntentExecutor(jobs, events), wallClock, sink);
        this.composer = new MessageComposer(messages, chats, jobs, events, b.identity, wallClock);
        this.membership = new ChatMembership(chats, b.identity);
        this.ongoing = new OngoingProcess();
        this.secureJoin = new SecureJoinEngine(new SecureJoinTokens(), b.identity, contacts, chats,
                membership, composer, events, ongoing, b.monotonicClock, wallClock,
                config.secureJoin(), sink);
        this.router = new IncomingMessageRouter(messages, chats, contacts, stateMachine, jobs,
                secureJoin, events, config.watch(), wallClock);
        this.dispatcher = new JobDispatcher(jobStore, handlers(), coordinators, config.backoff(),
                networkErrors, events, wallClock, sink);
    }

    private Map<JobAction, JobHandler> handlers() {
        String movedFolder = config.watch().effectiveMovedFolder();
        Map<JobAction, JobHandler> handlers = new EnumMap<>(JobAction.class);
        handlers.put(JobAction.HOUSEKEEPING, new HousekeepingHandler(messages, secureJoin));
        handlers.put(JobAction.CONFIGURE, new ConfigureHandler(transport, events, ongoing));
        handlers.put(JobAction.DELETE_ON_SERVER, new DeleteOnServerHandler(messages, transport, events));
        handlers.put(JobAction.MARK_SEEN_ON_SERVER, new MarkSeenOnServerHandler(transport));
        handlers.put(JobAction.MARK_MDN_SEEN_ON_SERVER, new MarkMdnSeenOnServerHandler(transport, movedFolder));
        handlers.put(JobAction.MOVE_TO_FOLDER, new MoveToFolderHandler(messages, stateMachine, transport, movedFolder));
        handlers.put(JobAction.SEND_MESSAGE, new SendMessageHandler(messages, chats, stateMachine, transport,
                events, wallClock, config.mdnsEnabled()));
        handlers.put(JobAction.SEND_MDN, new SendMdnHandler(messages, transport, config.mdnsEnabled()));
        return handlers;
    }

    @Override
    public EventChannel events() {
        return events;
    }

    // ---------------------------------------------------------------------
    // Transport loop
    // ---------------------------------------------------------------------

    @Override
    public void configure() {
        jobs.enqueue(JobAction.CONFIGURE, JobParams.none());
    }

    @Override
    public int drainJobs(Transport t) {
        return dispatcher.drain(t);
    }

    @Override
    public int fetch(Transport t) {
        if (!t.fetches() || !config.watch().isWatched(t)) {
            return 0;
        }
        InterruptCoordinator coordinator = coordinators.get(t);
        if (!coordinator.enterHandle()) {
            log.debug("{} is suspended, not fetching", t);
            return 0;
        }
        try {
            List<FetchedMail> fetched;
            try {
                fetched = transport.fetch(t, config.watch().folderFor(t));
            } catch (TransportException e) {
                networkErrors.recordFailure(t, e.getMessage());
                return 0;
            }
            networkErrors.reset(t);
            sink.onTransportEvent(new TransportObservabilityEvent(wallClock.now(), t,
                    TransportObservabilityEvent.Kind.FETCHED, fetched.size() + " message(s)"));

            int stored = 0;
            for (FetchedMail mail : fetched) {
                ParsedMessage parsed;
                try {
                    parsed = parser.parse(mail.blob());
                } catch (MessageParseException e) {
                    log.warn("Cannot parse {}: {}", mail.serverRef(), e.getMessage());
                    events.emit(ChatEvent.warning("Cannot parse " + mail.serverRef() + ": " + e.getMessage()));
                    continue;
                }
                if (router.route(t, mail.serverRef(), parsed).isPresent()) {
                    stored++;
                }
            }
            return stored;
        } finally {
            coordinator.leaveHandle();
            secureJoin.expireStale();
        }
    }

    @Override
    public WakeReason idle(Transport t) {
        long timeoutMillis = config.idleTimeout().toMillis();
        OptionalLong next = jobStore.nextNotBefore(t);
        if (next.isPresent()) {
            timeoutMillis = Math.max(0, Math.min(timeoutMillis, next.getAsLong() - wallClock.nowMillis()));
        }
        WakeReason reason = coordinators.get(t).await(Duration.ofMillis(timeoutMillis));
        sink.onTransportEvent(new TransportObservabilityEvent(wallClock.now(), t,
                TransportObservabilityEvent.Kind.WOKE, reason.name()));
        return reason;
    }

    @Override
    public void interrupt(Transport t) {
        coordinators.interrupt(t);
    }

    @Override
    public void housekeeping() {
        if (jobs.store().exists(JobAction.HOUSEKEEPING)) {
            log.debug("Housekeeping already scheduled");
            return;
        }
        jobs.enqueue(JobAction.HOUSEKEEPING, JobParams.none());
    }

    @Override
    public void maybeNetwork() {
        log.info("Network may be available, retrying failed jobs early");
        dispatcher.requestEarlyRetry();
    }

    @Override
    public void shutdown() {
        ongoing.stop();
        coordinators.shutdownAll();
        log.info("Chat core shut down");
    }

    // ---------------------------------------------------------------------
    // Long-running processes
    // ---------------------------------------------------------------------

    @Override
    public boolean stopOngoingProcess() {
        return ongoing.stop();
    }

    @Override
    public String initiateSecureJoin(Optional<ChatId> group) {
        return secureJoin.initiate(group);
    }

    @Override
    public SecureJoinResult joinSecureJoin(String qr) {
        return secureJoin.join(qr);
    }

    // ---------------------------------------------------------------------
    // Messages
    // ---------------------------------------------------------------------

    @Override
    public MessageId sendMessage(ChatId chat, String text) {
        return composer.compose(requireChat(chat), text, MessageState.PENDING).id();
    }

    @Override
    public MessageId prepareMessage(ChatId chat, String text) {
        return composer.compose(requireChat(chat), text, MessageState.PREPARING).id();
    }

    @Override
    public void finishPreparing(MessageId message) {
        requireMessage(message);
        stateMachine.apply(message, new MessageEvent.PreparationFinished(wallClock.now()));
    }

    @Override
    public void parkAsDraft(MessageId message) {
        requireMessage(message);
        stateMachine.apply(message, new MessageEvent.ParkedAsDraft(wallClock.now()));
    }

    @Override
    public MessageId setDraft(ChatId chat, String text) {
        return composer.compose(requireChat(chat), text, MessageState.DRAFT).id();
    }

    @Override
    public void sendDraft(MessageId message) {
        requireMessage(message);
        stateMachine.apply(message, new MessageEvent.DraftSubmitted(wallClock.now()));
    }

    @Override
    public void resendMessage(MessageId message) {
        requireMessage(message);
        stateMachine.apply(message, new MessageEvent.ResendRequested(wallClock.now()));
    }

    @Override
    public void markSeen(List<MessageId> ids) {
        ids.forEach(this::requireMessage);
        boolean receipts = config.mdnsEnabled();
        for (MessageId id : ids) {
            stateMachine.apply(id, m -> new MessageEvent.MarkSeen(wallClock.now(),
                    !m.chatId().isSpecial(), receipts));
        }
    }

    @Override
    public void markNoticedChat(ChatId chat) {
        if (!chat.isSpecial()) {
            requireChat(chat);
        }
        markNoticed(messages.listByChat(chat));
    }

    @Override
    public void markNoticedContact(ContactId contact) {
        if (!contact.isSelf() && contacts.address(contact).isEmpty()) {
            throw new NoSuchContactException(contact);
        }
        markNoticed(messages.listFromContact(contact));
    }

    private void markNoticed(List<MessageRecord> candidates) {
        for (MessageRecord m : candidates) {
            if (m.state() == MessageState.FRESH) {
                stateMachine.apply(m.id(), new MessageEvent.MarkNoticed(wallClock.now()));
            }
        }
    }

    @Override
    public Optional<MessageRecord> getMessage(MessageId message) {
        return messages.find(message);
    }

    // ---------------------------------------------------------------------
    // Chats
    // ---------------------------------------------------------------------

    @Override
    public ChatId createChatByContact(ContactId contact) {
        if (contact.isSelf()) {
            throw new IllegalArgumentException("cannot create a chat with self");
        }
        synchronized (chats) {
            ChatRecord chat = chats.getOrCreateSingle(contact, false);
            if (chat.blocked()) {
                chat = chat.withBlocked(false);
                chats.update(chat);
            }
            events.emit(EventKind.CHAT_MODIFIED, chat.id().value(), 0);
            return chat.id();
        }
    }

    @Override
    public ChatId createGroupChat(String name, boolean verified) {
        ChatRecord chat = chats.createGroup(verified ? ChatType.VERIFIED_GROUP : ChatType.GROUP,
                name, RandomTokens.next(9));
        events.emit(EventKind.CHAT_MODIFIED, chat.id().value(), 0);
        return chat.id();
    }

    @Override
    public boolean addContactToChat(ChatId chat, ContactId contact) {
        boolean wasMember = requireChat(chat).hasMember(contact);
        ChatRecord updated = membership.addMember(chat, contact);
        if (wasMember) {
            return false;
        }
        events.emit(EventKind.CHAT_MODIFIED, chat.value(), 0);
        if (updated.promoted()) {
            String who = contacts.address(contact).orElse(contact.toString());
            composer.composeSystem(updated, "Member " + who + " added.");
        }
        return true;
    }

    @Override
    public void archiveChat(ChatId chat, boolean archive) {
        synchronized (chats) {
            ChatRecord current = requireChat(chat);
            if (current.archived() != archive) {
                chats.update(current.withArchived(archive));
                events.emit(EventKind.CHAT_MODIFIED, chat.value(), 0);
            }
        }
    }

    @Override
    public Optional<ChatRecord> getChat(ChatId chat) {
        return chats.find(chat);
    }

    private ChatRecord requireChat(ChatId chat) {
        return chats.find(chat).orElseThrow(() -> new NoSuchChatException(chat));
    }

    private void requireMessage(MessageId message) {
        if (messages.find(message).isEmpty()) {
            throw new NoSuchMessageException(message);
        }
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ChatCoreConfig config = ChatCoreConfig.defaults();
        private TransportExecutor transport;
        private MessageParser parser;
        private IdentityService identity;
        private ContactResolver contacts;
        private JobStore jobStore;
        private MessageStore messageStore;
        private ChatStore chatStore;
        private ChatObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private MonotonicClock monotonicClock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;

        private Builder() {}

        public Builder withConfig(ChatCoreConfig config) {
            this.config = config;
            return this;
        }

        public Builder withTransport(TransportExecutor transport) {
            this.transport = transport;
            return this;
        }

        public Builder withParser(MessageParser parser) {
            this.parser = parser;
            return this;
        }

        public Builder withIdentity(IdentityService identity) {
            this.identity = identity;
            return this;
        }

        public Builder withContacts(ContactResolver contacts) {
            this.contacts = contacts;
            return this;
        }

        public Builder withJobStore(JobStore store) {
            this.jobStore = store;
            return this;
        }

        public Builder withMessageStore(MessageStore store) {
            this.messageStore = store;
            return this;
        }

        public Builder withChatStore(ChatStore store) {
            this.chatStore = store;
            return this;
        }

        public Builder withObservabilitySink(ChatObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withMonotonicClock(MonotonicClock clock) {
            this.monotonicClock = clock;
            return this;
        }

        public Builder withWallClock(WallClock clock) {
            this.wallClock = clock;
            return this;
        }

        public DefaultChatCore build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(transport, "transport");
            Objects.requireNonNull(parser, "parser");
            Objects.requireNonNull(identity, "identity");
            Objects.requireNonNull(contacts, "contacts");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(monotonicClock, "monotonicClock");
            Objects.requireNonNull(wallClock, "wallClock");

            if (jobStore == null) {
                jobStore = new InMemoryJobStore();
            }
            if (messageStore == null) {
                messageStore = new InMemoryMessageStore();
            }
            if (chatStore == null) {
                chatStore = new InMemoryChatStore();
            }
            return new DefaultChatCore(this);
        }
    }
}
