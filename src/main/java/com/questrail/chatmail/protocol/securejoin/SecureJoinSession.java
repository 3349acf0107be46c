package com.questrail.chatmail.protocol.securejoin;

import com.questrail.chatmail.api.ChatId;
import com.questrail.chatmail.api.ContactId;
import com.questrail.chatmail.identity.Fingerprint;

import java.util.Objects;
import java.util.Optional;

/**
 * SecureJoinSession
 * -----------------------------------------------------------------------------
 * Immutable state of one handshake with one peer.
 *
 * <p>Both sides hold the invite number and auth token from the QR code. The
 * invite number is echoed on every handshake message and selects the session;
 * the auth token is what the joiner proves knowledge of. Only the joiner
 * knows the expected inviter fingerprint, taken from the QR code.</p>
 */
public final class SecureJoinSession
{
    private final ContactId peer;
    private final SecureJoinRole role;
    private final SecureJoinStep step;
    private final String inviteNumber;
    private final String authToken;
    private final Fingerprint inviterFingerprint;
    private final String groupId;
    private final String groupName;
    private final ChatId chatId;
    private final long deadlineNanos;
    private final FailureReason failure;

    private SecureJoinSession(ContactId peer, SecureJoinRole role, SecureJoinStep step,
                              String inviteNumber, String authToken, Fingerprint inviterFingerprint,
                              String groupId, String groupName, ChatId chatId,
                              long deadlineNanos, FailureReason failure) {
        this.peer = Objects.requireNonNull(peer, "peer");
        this.role = Objects.requireNonNull(role, "role");
        this.step = Objects.requireNonNull(step, "step");
        this.inviteNumber = Objects.requireNonNull(inviteNumber, "inviteNumber");
        this.authToken = Objects.requireNonNull(authToken, "authToken");
        this.inviterFingerprint = inviterFingerprint;
        this.groupId = groupId;
        this.groupName = groupName;
        this.chatId = chatId;
        this.deadlineNanos = deadlineNanos;
        this.failure = failure;
    }

    /**
     * Creates the joiner's session from a scanned invite.
     */
    public static SecureJoinSession joiner(ContactId inviter, QrInvite invite, long deadlineNanos) {
        return new SecureJoinSession(inviter, SecureJoinRole.JOINER, SecureJoinStep.IDLE,
                invite.inviteNumber(), invite.authToken(), invite.fingerprint(),
                invite.groupId().orElse(null), invite.groupName().orElse(null), null,
                deadlineNanos, null);
    }

    /**
     * Creates the inviter's session when a request for one of its invites arrives.
     *
     * @param groupChat the group being joined, or {@code null} for contact verification
     */
    public static SecureJoinSession inviter(ContactId joiner, SecureJoinTokens.Invite invite,
                                            String groupId, String groupName, ChatId groupChat,
                                            long deadlineNanos) {
        return new SecureJoinSession(joiner, SecureJoinRole.INVITER, SecureJoinStep.REQUEST_RECEIVED,
                invite.inviteNumber(), invite.authToken(), null,
                groupId, groupName, groupChat, deadlineNanos, null);
    }

    public ContactId peer() {
        return peer;
    }

    public SecureJoinRole role() {
        return role;
    }

    public SecureJoinStep step() {
        return step;
    }

    public String inviteNumber() {
        return inviteNumber;
    }

    public String authToken() {
        return authToken;
    }

    /**
     * The token the next message from the peer must carry to be accepted.
     */
    public String expectedToken() {
        if (role == SecureJoinRole.INVITER && step == SecureJoinStep.AUTH_SENT) {
            return authToken;
        }
        return inviteNumber;
    }

    public Optional<Fingerprint> inviterFingerprint() {
        return Optional.ofNullable(inviterFingerprint);
    }

    public boolean isGroupJoin() {
        return groupId != null;
    }

    public Optional<String> groupId() {
        return Optional.ofNullable(groupId);
    }

    public Optional<String> groupName() {
        return Optional.ofNullable(groupName);
    }

    /**
     * The group chat for group joins; for the joiner only known once done.
     */
    public Optional<ChatId> chatId() {
        return Optional.ofNullable(chatId);
    }

    public long deadlineNanos() {
        return deadlineNanos;
    }

    public boolean isExpired(long nowNanos) {
        return nowNanos - deadlineNanos >= 0;
    }

    public Optional<FailureReason> failure() {
        return Optional.ofNullable(failure);
    }

    public SecureJoinSession withStep(SecureJoinStep newStep) {
        return new SecureJoinSession(peer, role, newStep, inviteNumber, authToken, inviterFingerprint,
                groupId, groupName, chatId, deadlineNanos, failure);
    }

    public SecureJoinSession failed(FailureReason reason) {
        return new SecureJoinSession(peer, role, SecureJoinStep.FAILED, inviteNumber, authToken,
                inviterFingerprint, groupId, groupName, chatId, deadlineNanos,
                Objects.requireNonNull(reason, "reason"));
    }

    public SecureJoinSession withChatId(ChatId newChatId) {
        return new SecureJoinSession(peer, role, step, inviteNumber, authToken, inviterFingerprint,
                groupId, groupName, newChatId, deadlineNanos, failure);
    }

    @Override
    public String toString() {
        return "SecureJoinSession{" + role + " with " + peer + ", " + step
                + (failure != null ? " (" + failure + ")" : "") + "}";
    }
}
