package com.questrail.chatmail.api;

/**
 * Identifier of a chat.
 *
 * <p>Ids {@code 1..9} are reserved for special chats. Id {@link #DEADDROP}
 * collects messages from senders the user has not accepted yet; state changes
 * of messages in special chats never reach the server.</p>
 */
public record ChatId(long value) {

    public static final ChatId DEADDROP = new ChatId(1);

    /** Highest reserved id. */
    public static final long LAST_SPECIAL = 9;

    public ChatId {
        if (value <= 0) {
            throw new IllegalArgumentException("chat id must be positive: " + value);
        }
    }

    public static ChatId of(long value) {
        return new ChatId(value);
    }

    /**
     * Returns true for reserved chat ids, including the deaddrop.
     */
    public boolean isSpecial() {
        return value <= LAST_SPECIAL;
    }

    @Override
    public String toString() {
        return "Chat#" + value;
    }
}
