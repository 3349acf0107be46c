package com.questrail.chatmail.protocol.securejoin;

import com.questrail.chatmail.api.ChatCoreException;
import com.questrail.chatmail.api.ChatId;
import com.questrail.chatmail.api.ChatType;
import com.questrail.chatmail.api.ContactId;
import com.questrail.chatmail.api.InvalidQrCodeException;
import com.questrail.chatmail.api.NoSuchChatException;
import com.questrail.chatmail.api.SecureJoinResult;
import com.questrail.chatmail.config.SecureJoinPolicy;
import com.questrail.chatmail.events.ChatEvent;
import com.questrail.chatmail.events.EventChannel;
import com.questrail.chatmail.events.EventKind;
import com.questrail.chatmail.identity.ContactResolver;
import com.questrail.chatmail.identity.IdentityService;
import com.questrail.chatmail.observability.ChatErrorEvent;
import com.questrail.chatmail.observability.ChatObservabilitySink;
import com.questrail.chatmail.observability.SecureJoinTransitionEvent;
import com.questrail.chatmail.protocol.chat.ChatMembership;
import com.questrail.chatmail.protocol.chat.ChatRecord;
import com.questrail.chatmail.protocol.chat.ChatStore;
import com.questrail.chatmail.protocol.message.MessageComposer;
import com.questrail.chatmail.protocol.ongoing.OngoingProcess;
import com.questrail.chatmail.time.MonotonicClock;
import com.questrail.chatmail.time.WallClock;
import com.questrail.chatmail.transport.HandshakeHeaders;
import com.questrail.chatmail.transport.HandshakeStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * SecureJoinEngine
 * =============================================================================
 * Runs secure-join handshakes for both roles.
 *
 * <h2>Inviter</h2>
 * {@link #initiate(Optional)} renders a QR code. Sessions are created when a
 * request carrying one of this device's invite numbers arrives and are
 * dropped once they end. Any number of joiners may be served at once.
 *
 * <h2>Joiner</h2>
 * {@link #join(String)} blocks the calling thread until the handshake
 * completes, fails, times out, or is cancelled through {@link OngoingProcess}.
 * Progress is driven by handshake messages the receive path hands to
 * {@link #onHandshakeMessage(ContactId, HandshakeHeaders)}.
 *
 * <h2>Concurrency</h2>
 * Every reducer step and the execution of its intents happen under the
 * session table lock, so handshake messages for the same session are applied
 * in arrival order.
 */
public final class SecureJoinEngine
{
    private static final Logger log = LoggerFactory.getLogger(SecureJoinEngine.class);

    private final SecureJoinTokens tokens;
    private final IdentityService identity;
    private final ContactResolver contacts;
    private final ChatStore chats;
    private final ChatMembership membership;
    private final MessageComposer composer;
    private final EventChannel events;
    private final OngoingProcess ongoing;
    private final MonotonicClock monotonicClock;
    private final WallClock wallClock;
    private final SecureJoinPolicy policy;
    private final ChatObservabilitySink sink;

    private final SecureJoinReducer reducer = new SecureJoinReducer();
    private final SecureJoinSessionTable sessions = new SecureJoinSessionTable();

    public SecureJoinEngine(SecureJoinTokens tokens,
                            IdentityService identity,
                            ContactResolver contacts,
                            ChatStore chats,
                            ChatMembership membership,
                            MessageComposer composer,
                            EventChannel events,
                            OngoingProcess ongoing,
                            MonotonicClock monotonicClock,
                            WallClock wallClock,
                            SecureJoinPolicy policy,
                            ChatObservabilitySink sink) {
        this.tokens = Objects.requireNonNull(tokens, "tokens");
        this.identity = Objects.requireNonNull(identity, "identity");
        this.contacts = Objects.requireNonNull(contacts, "contacts");
        this.chats = Objects.requireNonNull(chats, "chats");
        this.membership = Objects.requireNonNull(membership, "membership");
        this.composer = Objects.requireNonNull(composer, "composer");
        this.events = Objects.requireNonNull(events, "events");
        this.ongoing = Objects.requireNonNull(ongoing, "ongoing");
        this.monotonicClock = Objects.requireNonNull(monotonicClock, "monotonicClock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    // ---------------------------------------------------------------------
    // Inviter
    // ---------------------------------------------------------------------

    /**
     * Returns the QR payload inviting others to verify this device, or to
     * join {@code group} when present.
     *
     * @throws NoSuchChatException if {@code group} does not exist
     */
    public String initiate(Optional<ChatId> group) {
        String groupId = null;
        String groupName = null;
        if (group.isPresent()) {
            ChatRecord chat = chats.find(group.get()).orElseThrow(() -> new NoSuchChatException(group.get()));
            if (!chat.isGroup()) {
                throw new IllegalArgumentException(chat.id() + " is not a group");
            }
            groupId = chat.groupId();
            groupName = chat.name();
        }
        SecureJoinTokens.Invite invite = tokens.forChat(group);
        QrInvite qr = new QrInvite(identity.selfFingerprint(), identity.selfAddress(), "",
                invite.inviteNumber(), invite.authToken(),
                Optional.ofNullable(groupId), Optional.ofNullable(groupName));
        log.info("Secure-join invite created for {}", group.map(ChatId::toString).orElse("contact verification"));
        return qr.format();
    }

    // ---------------------------------------------------------------------
    // Joiner
    // ---------------------------------------------------------------------

    /**
     * Joins via a scanned QR code, blocking until the handshake ends.
     *
     * @throws InvalidQrCodeException if the code is not a usable invite
     * @throws com.questrail.chatmail.api.OngoingProcessException if another long-running process is active
     */
    public SecureJoinResult join(String qrText) {
        QrInvite invite = QrInvite.parse(qrText);

        try (OngoingProcess.Token token = ongoing.start("secure-join")) {
            ContactId inviter = contacts.resolve(invite.address(), invite.name());
            if (inviter.isSelf()) {
                throw new InvalidQrCodeException("cannot join an invite of this device");
            }
            token.onCancel(sessions::signalAll);

            long deadline = monotonicClock.nowNanos() + policy.sessionTimeout().toNanos();
            SecureJoinSession start = SecureJoinSession.joiner(inviter, invite, deadline);
            log.info("Joining {} via secure-join{}", inviter, invite.isGroupInvite() ? " (group)" : "");

            try {
                return sessions.callLocked(() -> {
                    sessions.put(start);
                    step(start, new HandshakeEvent.JoinStarted(wallClock.now(), identity.fingerprint(inviter)));
                    return awaitOutcome(inviter, token);
                });
            } finally {
                sessions.get(inviter, SecureJoinRole.JOINER).ifPresent(sessions::remove);
            }
        }
    }

    private SecureJoinResult awaitOutcome(ContactId inviter, OngoingProcess.Token token) {
        while (true) {
            Optional<SecureJoinSession> found = sessions.get(inviter, SecureJoinRole.JOINER);
            if (found.isEmpty()) {
                return SecureJoinResult.failed(SecureJoinResult.Status.CANCELLED);
            }
            SecureJoinSession current = found.get();
            if (current.step() == SecureJoinStep.DONE) {
                return current.chatId()
                        .map(SecureJoinResult::success)
                        .orElseGet(() -> SecureJoinResult.failed(SecureJoinResult.Status.CANCELLED));
            }
            if (current.step() == SecureJoinStep.FAILED) {
                return SecureJoinResult.failed(current.failure()
                        .map(FailureReason::status)
                        .orElse(SecureJoinResult.Status.CANCELLED));
            }
            if (token.isCancelled()) {
                step(current, new HandshakeEvent.Cancelled(wallClock.now()));
                continue;
            }
            if (current.isExpired(monotonicClock.nowNanos())) {
                step(current, new HandshakeEvent.DeadlineExpired(wallClock.now()));
                continue;
            }
            try {
                sessions.awaitChange(policy.pollInterval());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                step(current, new HandshakeEvent.Cancelled(wallClock.now()));
            }
        }
    }

    // ---------------------------------------------------------------------
    // Receive path
    // ---------------------------------------------------------------------

    /**
     * Applies a received handshake message from {@code from}.
     *
     * <p>Messages that match no live session, or carry an invite number this
     * device never issued, are logged and ignored.</p>
     */
    public void onHandshakeMessage(ContactId from, HandshakeHeaders headers) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(headers, "headers");

        sessions.withLock(() -> {
            HandshakeStep step = headers.step();
            if (step == HandshakeStep.VC_REQUEST || step == HandshakeStep.VG_REQUEST) {
                startInviterSession(from, headers);
                return;
            }
            SecureJoinRole localRole = step.sender() == HandshakeStep.Sender.INVITER
                    ? SecureJoinRole.JOINER
                    : SecureJoinRole.INVITER;
            Optional<SecureJoinSession> session = sessions.get(from, localRole);
            if (session.isEmpty()
                    && (step == HandshakeStep.VC_REQUEST_WITH_AUTH || step == HandshakeStep.VG_REQUEST_WITH_AUTH)) {
                startInviterSession(from, headers);
                return;
            }
            if (session.isEmpty()) {
                log.info("Ignoring {} from {}: no secure-join session", step.headerValue(), from);
                return;
            }
            step(session.get(), new HandshakeEvent.StepReceived(wallClock.now(), headers,
                    identity.fingerprint(from)));
        });
    }

    private void startInviterSession(ContactId joiner, HandshakeHeaders headers) {
        Optional<SecureJoinTokens.Invite> found = tokens.lookup(headers.inviteNumber());
        if (found.isEmpty()) {
            log.info("Ignoring {} from {}: unknown invite number", headers.step().headerValue(), joiner);
            return;
        }
        SecureJoinTokens.Invite invite = found.get();
        if (invite.group().isPresent() != headers.step().isGroupStep()) {
            log.info("Ignoring {} from {}: invite is for {}", headers.step().headerValue(), joiner,
                    invite.group().isPresent() ? "a group" : "contact verification");
            return;
        }

        String groupId = null;
        String groupName = null;
        ChatId groupChat = null;
        if (invite.group().isPresent()) {
            Optional<ChatRecord> chat = chats.find(invite.group().get());
            if (chat.isEmpty()) {
                log.warn("Ignoring {} from {}: group {} no longer exists",
                        headers.step().headerValue(), joiner, invite.group().get());
                return;
            }
            groupId = chat.get().groupId();
            groupName = chat.get().name();
            groupChat = chat.get().id();
        }

        sessions.get(joiner, SecureJoinRole.INVITER)
                .filter(s -> !s.step().isTerminal())
                .ifPresent(s -> log.info("Restarting secure-join with {} from {}", joiner, s.step()));

        long deadline = monotonicClock.nowNanos() + policy.sessionTimeout().toNanos();
        SecureJoinSession session = SecureJoinSession.inviter(joiner, invite, groupId, groupName, groupChat, deadline);
        sessions.put(session);
        step(session, new HandshakeEvent.StepReceived(wallClock.now(), headers, identity.fingerprint(joiner)));
    }

    /**
     * Fails every session whose deadline has passed.
     *
     * @return the number of sessions expired
     */
    public int expireStale() {
        long now = monotonicClock.nowNanos();
        return sessions.callLocked(() -> {
            int expired = 0;
            for (SecureJoinSession session : sessions.snapshot()) {
                if (!session.step().isTerminal() && session.isExpired(now)) {
                    step(session, new HandshakeEvent.DeadlineExpired(wallClock.now()));
                    expired++;
                }
            }
            return expired;
        });
    }

    /**
     * Returns the live session with {@code peer} in the given local role.
     */
    public Optional<SecureJoinSession> session(ContactId peer, SecureJoinRole role) {
        return sessions.get(peer, role);
    }

    // ---------------------------------------------------------------------
    // Reduction and intents
    // ---------------------------------------------------------------------

    private void step(SecureJoinSession session, HandshakeEvent event) {
        SecureJoinReducer.Result result = reducer.apply(session, event);
        SecureJoinSession updated;
        try {
            updated = execute(result.newSession(), result.intents());
        } catch (ChatCoreException e) {
            sink.onError(new ChatErrorEvent(wallClock.now(),
                    "Secure-join with " + session.peer() + " could not apply " + result.intents(), e));
            // the skipped intents leave the peer half-handled: fail from the step we started at
            event = new HandshakeEvent.Aborted(wallClock.now());
            result = reducer.apply(session, event);
            updated = execute(result.newSession(), result.intents());
        }
        sink.onSecureJoinTransition(new SecureJoinTransitionEvent(wallClock.now(), session.peer(),
                session, updated, event, result.intents()));

        if (updated.role() == SecureJoinRole.INVITER && updated.step().isTerminal()) {
            sessions.remove(updated);
        } else {
            sessions.put(updated);
        }
    }

    private SecureJoinSession execute(SecureJoinSession session, SecureJoinIntents intents) {
        SecureJoinSession current = session;
        ContactId peer = session.peer();

        for (SecureJoinIntents.Kind kind : intents.kinds()) {
            switch (kind) {
                case MARK_PEER_VERIFIED:
                    identity.markVerified(peer);
                    break;
                case ADD_PEER_TO_GROUP: {
                    ChatId group = current.chatId().orElseThrow(
                            () -> new IllegalStateException("group session without chat"));
                    membership.addMember(group, peer);
                    events.emit(EventKind.CHAT_MODIFIED, group.value(), 0);
                    break;
                }
                case JOIN_GROUP:
                    current = current.withChatId(joinGroup(current));
                    break;
                case ACCEPT_PEER_CHAT: {
                    ChatRecord chat = acceptPeerChat(peer);
                    if (!current.isGroupJoin()) {
                        current = current.withChatId(chat.id());
                    }
                    break;
                }
                case SEND_STEP:
                    sendStep(current, intents.stepToSend().orElseThrow());
                    break;
                case REPORT_INVITER_PROGRESS:
                    intents.progress().forEach(p -> events.emit(EventKind.SECUREJOIN_INVITER_PROGRESS, peer.value(), p));
                    break;
                case REPORT_JOINER_PROGRESS:
                    intents.progress().forEach(p -> events.emit(EventKind.SECUREJOIN_JOINER_PROGRESS, peer.value(), p));
                    break;
                case REPORT_FAILURE: {
                    FailureReason reason = intents.failure().orElseThrow();
                    log.warn("Secure-join with {} failed: {}", peer, reason);
                    events.emit(ChatEvent.withText(EventKind.SECUREJOIN_FAILED, peer.value(), reason.name()));
                    break;
                }
                default:
                    throw new IllegalStateException("Unhandled intent " + kind);
            }
        }
        return current;
    }

    private ChatId joinGroup(SecureJoinSession session) {
        String groupId = session.groupId().orElseThrow(() -> new IllegalStateException("not a group join"));
        ChatRecord group;
        synchronized (chats) {
            group = chats.findByGroupId(groupId)
                    .orElseGet(() -> chats.createGroup(ChatType.VERIFIED_GROUP,
                            session.groupName().orElse(groupId), groupId));
            if (!group.promoted()) {
                group = group.withPromoted(true);
                chats.update(group);
            }
        }
        membership.addMember(group.id(), session.peer());
        events.emit(EventKind.CHAT_MODIFIED, group.id().value(), 0);
        return group.id();
    }

    private ChatRecord acceptPeerChat(ContactId peer) {
        synchronized (chats) {
            ChatRecord chat = chats.getOrCreateSingle(peer, false);
            if (chat.blocked()) {
                chat = chat.withBlocked(false);
                chats.update(chat);
            }
            events.emit(EventKind.CHAT_MODIFIED, chat.id().value(), 0);
            return chat;
        }
    }

    private void sendStep(SecureJoinSession session, HandshakeStep step) {
        HandshakeHeaders headers = HandshakeHeaders.of(step, session.inviteNumber());
        if (step == HandshakeStep.VC_REQUEST_WITH_AUTH || step == HandshakeStep.VG_REQUEST_WITH_AUTH) {
            headers = headers.withAuth(session.authToken(), identity.selfFingerprint().hex());
        }
        if (step.isGroupStep()) {
            headers = headers.withGroup(session.groupId().orElse(null), session.groupName().orElse(null), true);
        }

        ChatRecord target;
        if (step == HandshakeStep.VG_MEMBER_ADDED) {
            ChatId group = session.chatId().orElseThrow(() -> new IllegalStateException("group session without chat"));
            target = chats.find(group).orElseThrow(() -> new NoSuchChatException(group));
        } else {
            target = chats.getOrCreateSingle(session.peer(), true);
        }
        composer.composeHandshake(target, headers);
        log.debug("Sent {} to {}", step.headerValue(), session.peer());
    }
}
