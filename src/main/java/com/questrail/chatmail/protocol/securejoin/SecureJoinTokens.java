package com.questrail.chatmail.protocol.securejoin;

import com.questrail.chatmail.api.ChatId;
import com.questrail.chatmail.protocol.RandomTokens;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Invite tokens handed out in QR codes.
 *
 * <p>One pair of tokens exists per group, plus one pair for plain contact
 * verification. Tokens are reused for as long as this object lives, so the
 * same QR code stays valid.</p>
 */
public final class SecureJoinTokens {

    /**
     * @param inviteNumber token that identifies the invite
     * @param authToken    secret the joiner must echo back
     * @param chatId       the group the invite is for, {@code null} for contact verification
     */
    public record Invite(String inviteNumber, String authToken, ChatId chatId) {

        public Invite {
            Objects.requireNonNull(inviteNumber, "inviteNumber");
            Objects.requireNonNull(authToken, "authToken");
        }

        public Optional<ChatId> group() {
            return Optional.ofNullable(chatId);
        }
    }

    private static final int TOKEN_BYTES = 18;

    private final Map<Optional<ChatId>, Invite> byChat = new HashMap<>();
    private final Map<String, Invite> byInviteNumber = new HashMap<>();

    /**
     * Returns the invite for a group, or for contact verification when
     * {@code chatId} is empty, creating it on first use.
     */
    public synchronized Invite forChat(Optional<ChatId> chatId) {
        Invite existing = byChat.get(chatId);
        if (existing != null) {
            return existing;
        }
        Invite created = new Invite(RandomTokens.next(TOKEN_BYTES), RandomTokens.next(TOKEN_BYTES),
                chatId.orElse(null));
        byChat.put(chatId, created);
        byInviteNumber.put(created.inviteNumber(), created);
        return created;
    }

    public synchronized Optional<Invite> lookup(String inviteNumber) {
        return Optional.ofNullable(byInviteNumber.get(inviteNumber));
    }
}
