package com.questrail.chatmail.protocol.securejoin;

/**
 * Progress of one side of a handshake.
 *
 * <p>Inviter: {@code REQUEST_RECEIVED -> AUTH_SENT -> [MEMBER_ADDED_SENT] -> DONE}.
 * Joiner: {@code IDLE -> REQUEST_SENT -> AUTH_SENT -> DONE}.
 * Either side may end in {@code FAILED}.</p>
 */
public enum SecureJoinStep {
    IDLE,
    REQUEST_SENT,
    REQUEST_RECEIVED,
    AUTH_SENT,
    MEMBER_ADDED_SENT,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
