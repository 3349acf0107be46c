package com.questrail.chatmail.api;

/**
 * Identifier of a locally stored message.
 */
public record MessageId(long value) {

    public MessageId {
        if (value <= 0) {
            throw new IllegalArgumentException("message id must be positive: " + value);
        }
    }

    public static MessageId of(long value) {
        return new MessageId(value);
    }

    @Override
    public String toString() {
        return "Msg#" + value;
    }
}
