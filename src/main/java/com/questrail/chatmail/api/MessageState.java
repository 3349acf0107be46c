package com.questrail.chatmail.api;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * MessageState
 * -----------------------------------------------------------------------------
 * Delivery state of a message.
 *
 * <p>The numeric codes are stable and are the values persisted by stores and
 * reported to embedders. Incoming messages move through
 * {@code FRESH -> NOTICED -> SEEN}; outgoing messages through
 * {@code PREPARING -> DRAFT -> PENDING -> DELIVERED -> MDN_RECEIVED}, with
 * {@code FAILED} reachable from {@code PENDING} and {@code DELIVERED}.</p>
 *
 * <p>The only backwards edge is an explicit re-send, {@code FAILED -> PENDING},
 * which is not part of {@link #canAdvanceTo(MessageState)}.</p>
 */
public enum MessageState {
    FRESH(10),
    NOTICED(13),
    SEEN(16),
    PREPARING(18),
    DRAFT(19),
    PENDING(20),
    FAILED(24),
    DELIVERED(26),
    MDN_RECEIVED(28);

    private final int code;

    MessageState(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static Optional<MessageState> fromCode(int code) {
        for (MessageState s : values()) {
            if (s.code == code) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns true for states of received messages.
     */
    public boolean isIncoming() {
        return this == FRESH || this == NOTICED || this == SEEN;
    }

    /**
     * Returns true for states no forward transition leaves.
     */
    public boolean isTerminal() {
        return this == SEEN || this == FAILED || this == MDN_RECEIVED;
    }

    /**
     * Returns true if {@code target} is a legal forward transition from this state.
     */
    public boolean canAdvanceTo(MessageState target) {
        return successors().contains(target);
    }

    private Set<MessageState> successors() {
        switch (this) {
            case FRESH:
                return EnumSet.of(NOTICED, SEEN);
            case NOTICED:
                return EnumSet.of(SEEN);
            case PREPARING:
                return EnumSet.of(DRAFT, PENDING);
            case DRAFT:
                return EnumSet.of(PENDING);
            case PENDING:
                return EnumSet.of(DELIVERED, FAILED);
            case DELIVERED:
                return EnumSet.of(MDN_RECEIVED, FAILED);
            default:
                return EnumSet.noneOf(MessageState.class);
        }
    }
}
