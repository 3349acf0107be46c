package com.questrail.chatmail.protocol.securejoin;

import com.questrail.chatmail.transport.HandshakeStep;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * SecureJoinIntents
 * -----------------------------------------------------------------------------
 * Immutable set of side effects requested by the {@link SecureJoinReducer}.
 *
 * <p>Kinds are executed in declaration order, so the peer is marked verified
 * before it is added to a group, and both happen before the next handshake
 * message is sent.</p>
 */
public final class SecureJoinIntents
{
    public enum Kind {
        /** Record the peer's current key as verified. */
        MARK_PEER_VERIFIED,

        /** Inviter: add the peer to the group being joined. */
        ADD_PEER_TO_GROUP,

        /** Joiner: create or update the local copy of the joined group. */
        JOIN_GROUP,

        /** Take the 1:1 chat with the peer out of the blocked state. */
        ACCEPT_PEER_CHAT,

        /** Send the next handshake message. */
        SEND_STEP,

        /** Emit inviter progress events. */
        REPORT_INVITER_PROGRESS,

        /** Emit joiner progress events. */
        REPORT_JOINER_PROGRESS,

        /** Emit a secure-join failure event. */
        REPORT_FAILURE
    }

    private static final SecureJoinIntents NONE = builder().build();

    private final Set<Kind> kinds;
    private final HandshakeStep stepToSend;
    private final List<Integer> progress;
    private final FailureReason failure;

    private SecureJoinIntents(Builder b) {
        this.kinds = Collections.unmodifiableSet(EnumSet.copyOf(b.kinds));
        this.stepToSend = b.stepToSend;
        this.progress = List.copyOf(b.progress);
        this.failure = b.failure;
    }

    public Set<Kind> kinds() {
        return kinds;
    }

    public boolean isEmpty() {
        return kinds.isEmpty();
    }

    public boolean contains(Kind kind) {
        return kinds.contains(kind);
    }

    public Optional<HandshakeStep> stepToSend() {
        return Optional.ofNullable(stepToSend);
    }

    /**
     * Progress values in permille, in emission order.
     */
    public List<Integer> progress() {
        return progress;
    }

    public Optional<FailureReason> failure() {
        return Optional.ofNullable(failure);
    }

    public static SecureJoinIntents none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final EnumSet<Kind> kinds = EnumSet.noneOf(Kind.class);
        private final List<Integer> progress = new ArrayList<>();
        private HandshakeStep stepToSend;
        private FailureReason failure;

        private Builder() {}

        public Builder add(Kind kind) {
            kinds.add(Objects.requireNonNull(kind, "kind"));
            return this;
        }

        public Builder send(HandshakeStep step) {
            kinds.add(Kind.SEND_STEP);
            this.stepToSend = Objects.requireNonNull(step, "step");
            return this;
        }

        public Builder inviterProgress(int... permille) {
            kinds.add(Kind.REPORT_INVITER_PROGRESS);
            for (int p : permille) {
                progress.add(p);
            }
            return this;
        }

        public Builder joinerProgress(int... permille) {
            kinds.add(Kind.REPORT_JOINER_PROGRESS);
            for (int p : permille) {
                progress.add(p);
            }
            return this;
        }

        public Builder fail(FailureReason reason) {
            kinds.add(Kind.REPORT_FAILURE);
            this.failure = Objects.requireNonNull(reason, "reason");
            return this;
        }

        public SecureJoinIntents build() {
            return new SecureJoinIntents(this);
        }
    }

    @Override
    public String toString() {
        return "SecureJoinIntents" + kinds
                + (stepToSend != null ? " send=" + stepToSend.headerValue() : "")
                + (progress.isEmpty() ? "" : " progress=" + progress)
                + (failure != null ? " failure=" + failure : "");
    }
}
