package com.questrail.chatmail.protocol.securejoin;

import com.questrail.chatmail.identity.Fingerprint;
import com.questrail.chatmail.transport.HandshakeHeaders;
import com.questrail.chatmail.transport.HandshakeStep;

import java.util.Objects;
import java.util.Optional;

/**
 * SecureJoinReducer
 * -----------------------------------------------------------------------------
 * Pure, deterministic transition engine for one side of a secure-join
 * handshake.
 *
 * <h2>Message matching</h2>
 * A received step is considered only if it is one the peer's role sends, it
 * is the step the session waits for, and it echoes the session's invite
 * number. Anything else is ignored: the session is returned unchanged with no
 * intents. Ignored messages never terminate a session.
 *
 * <h2>Verification</h2>
 * <ul>
 *   <li>The joiner compares the key the inviter's messages are signed with
 *       against the fingerprint from the QR code, both when auth is requested
 *       and when the inviter confirms.</li>
 *   <li>The inviter compares the auth token and the fingerprint the joiner
 *       presents against the token it issued and the key the joiner's
 *       message is signed with.</li>
 * </ul>
 * A failed check terminates the session at once with a distinct
 * {@link FailureReason} and produces no membership or verification intents.
 */
public final class SecureJoinReducer
{
    public static final int INVITER_REQUEST_RECEIVED = 300;
    public static final int INVITER_AUTH_VERIFIED = 600;
    public static final int INVITER_MEMBER_ADDED_RECEIVED = 800;
    public static final int DONE = 1000;
    public static final int JOINER_AUTH_SENT = 400;

    /**
     * @param newSession the updated session
     * @param intents    side effects to execute
     */
    public record Result(SecureJoinSession newSession, SecureJoinIntents intents) {}

    public Result apply(SecureJoinSession session, HandshakeEvent event) {
        Objects.requireNonNull(session, "session");
        Objects.requireNonNull(event, "event");

        if (session.step().isTerminal()) {
            return ignore(session);
        }
        if (event instanceof HandshakeEvent.DeadlineExpired) {
            return fail(session, FailureReason.TIMEOUT);
        }
        if (event instanceof HandshakeEvent.Cancelled) {
            return fail(session, FailureReason.CANCELLED);
        }
        if (event instanceof HandshakeEvent.Aborted) {
            return fail(session, FailureReason.ABORTED);
        }
        if (session.role() == SecureJoinRole.JOINER) {
            if (event instanceof HandshakeEvent.JoinStarted e) {
                return onJoinStarted(session, e);
            }
            if (event instanceof HandshakeEvent.StepReceived e) {
                return onJoinerReceived(session, e);
            }
        } else {
            if (event instanceof HandshakeEvent.StepReceived e) {
                return onInviterReceived(session, e);
            }
        }
        return ignore(session);
    }

    // ---------------------------------------------------------------------
    // Joiner
    // ---------------------------------------------------------------------

    private Result onJoinStarted(SecureJoinSession session, HandshakeEvent.JoinStarted e) {
        if (session.step() != SecureJoinStep.IDLE) {
            return ignore(session);
        }
        boolean group = session.isGroupJoin();
        if (matches(e.knownPeerFingerprint(), session.inviterFingerprint())) {
            // the inviter's key is already known and matches: skip the auth-required round trip
            return new Result(session.withStep(SecureJoinStep.AUTH_SENT),
                    SecureJoinIntents.builder()
                            .send(group ? HandshakeStep.VG_REQUEST_WITH_AUTH : HandshakeStep.VC_REQUEST_WITH_AUTH)
                            .joinerProgress(JOINER_AUTH_SENT)
                            .build());
        }
        return new Result(session.withStep(SecureJoinStep.REQUEST_SENT),
                SecureJoinIntents.builder()
                        .send(group ? HandshakeStep.VG_REQUEST : HandshakeStep.VC_REQUEST)
                        .build());
    }

    private Result onJoinerReceived(SecureJoinSession session, HandshakeEvent.StepReceived e) {
        HandshakeHeaders h = e.headers();
        if (!h.inviteNumber().equals(session.expectedToken())) {
            return ignore(session);
        }
        boolean group = session.isGroupJoin();

        if (session.step() == SecureJoinStep.REQUEST_SENT
                && h.step() == (group ? HandshakeStep.VG_AUTH_REQUIRED : HandshakeStep.VC_AUTH_REQUIRED)) {
            if (!matches(e.peerFingerprint(), session.inviterFingerprint())) {
                return fail(session, FailureReason.FINGERPRINT_MISMATCH);
            }
            return new Result(session.withStep(SecureJoinStep.AUTH_SENT),
                    SecureJoinIntents.builder()
                            .send(group ? HandshakeStep.VG_REQUEST_WITH_AUTH : HandshakeStep.VC_REQUEST_WITH_AUTH)
                            .joinerProgress(JOINER_AUTH_SENT)
                            .build());
        }

        if (session.step() == SecureJoinStep.AUTH_SENT
                && h.step() == (group ? HandshakeStep.VG_MEMBER_ADDED : HandshakeStep.VC_CONTACT_CONFIRM)) {
            if (!matches(e.peerFingerprint(), session.inviterFingerprint())) {
                return fail(session, FailureReason.FINGERPRINT_MISMATCH);
            }
            SecureJoinIntents.Builder intents = SecureJoinIntents.builder()
                    .add(SecureJoinIntents.Kind.MARK_PEER_VERIFIED)
                    .joinerProgress(DONE);
            if (group) {
                intents.add(SecureJoinIntents.Kind.JOIN_GROUP)
                        .send(HandshakeStep.VG_MEMBER_ADDED_RECEIVED);
            } else {
                intents.add(SecureJoinIntents.Kind.ACCEPT_PEER_CHAT);
            }
            return new Result(session.withStep(SecureJoinStep.DONE), intents.build());
        }

        return ignore(session);
    }

    // ---------------------------------------------------------------------
    // Inviter
    // ---------------------------------------------------------------------

    private Result onInviterReceived(SecureJoinSession session, HandshakeEvent.StepReceived e) {
        HandshakeHeaders h = e.headers();
        if (!h.inviteNumber().equals(session.inviteNumber())) {
            return ignore(session);
        }
        boolean group = session.isGroupJoin();

        if (session.step() == SecureJoinStep.REQUEST_RECEIVED
                && h.step() == (group ? HandshakeStep.VG_REQUEST : HandshakeStep.VC_REQUEST)) {
            return new Result(session.withStep(SecureJoinStep.AUTH_SENT),
                    SecureJoinIntents.builder()
                            .send(group ? HandshakeStep.VG_AUTH_REQUIRED : HandshakeStep.VC_AUTH_REQUIRED)
                            .inviterProgress(INVITER_REQUEST_RECEIVED)
                            .build());
        }

        // a joiner that already knows our key skips the plain request
        if ((session.step() == SecureJoinStep.AUTH_SENT || session.step() == SecureJoinStep.REQUEST_RECEIVED)
                && h.step() == (group ? HandshakeStep.VG_REQUEST_WITH_AUTH : HandshakeStep.VC_REQUEST_WITH_AUTH)) {
            if (!session.authToken().equals(h.auth())) {
                return fail(session, FailureReason.BAD_TOKEN);
            }
            Optional<Fingerprint> presented = h.senderFingerprint().flatMap(SecureJoinReducer::parseQuietly);
            if (presented.isEmpty() || !matches(e.peerFingerprint(), presented)) {
                return fail(session, FailureReason.FINGERPRINT_MISMATCH);
            }
            if (group) {
                return new Result(session.withStep(SecureJoinStep.MEMBER_ADDED_SENT),
                        SecureJoinIntents.builder()
                                .add(SecureJoinIntents.Kind.MARK_PEER_VERIFIED)
                                .add(SecureJoinIntents.Kind.ADD_PEER_TO_GROUP)
                                .send(HandshakeStep.VG_MEMBER_ADDED)
                                .inviterProgress(INVITER_AUTH_VERIFIED)
                                .build());
            }
            return new Result(session.withStep(SecureJoinStep.DONE),
                    SecureJoinIntents.builder()
                            .add(SecureJoinIntents.Kind.MARK_PEER_VERIFIED)
                            .add(SecureJoinIntents.Kind.ACCEPT_PEER_CHAT)
                            .send(HandshakeStep.VC_CONTACT_CONFIRM)
                            .inviterProgress(INVITER_AUTH_VERIFIED, DONE)
                            .build());
        }

        if (group && session.step() == SecureJoinStep.MEMBER_ADDED_SENT
                && h.step() == HandshakeStep.VG_MEMBER_ADDED_RECEIVED) {
            return new Result(session.withStep(SecureJoinStep.DONE),
                    SecureJoinIntents.builder()
                            .inviterProgress(INVITER_MEMBER_ADDED_RECEIVED, DONE)
                            .build());
        }

        return ignore(session);
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private static boolean matches(Optional<Fingerprint> actual, Optional<Fingerprint> expected) {
        return actual.isPresent() && expected.isPresent() && actual.get().equals(expected.get());
    }

    private static Optional<Fingerprint> parseQuietly(String text) {
        try {
            return Optional.of(Fingerprint.parse(text));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private static Result fail(SecureJoinSession session, FailureReason reason) {
        return new Result(session.failed(reason), SecureJoinIntents.builder().fail(reason).build());
    }

    private static Result ignore(SecureJoinSession session) {
        return new Result(session, SecureJoinIntents.none());
    }
}
