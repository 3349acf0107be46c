package com.questrail.chatmail.protocol.chat;

import com.questrail.chatmail.api.ChatId;
import com.questrail.chatmail.api.ContactId;
import com.questrail.chatmail.api.NoSuchChatException;
import com.questrail.chatmail.api.VerificationRequiredException;
import com.questrail.chatmail.identity.IdentityService;

import java.util.Objects;

/**
 * Adds members to chats while keeping verified groups verified.
 */
public final class ChatMembership {

    private final ChatStore chats;
    private final IdentityService identity;

    public ChatMembership(ChatStore chats, IdentityService identity) {
        this.chats = Objects.requireNonNull(chats, "chats");
        this.identity = Objects.requireNonNull(identity, "identity");
    }

    /**
     * Adds {@code contact} to a group.
     *
     * @return the updated chat, or the unchanged chat if the contact already was a member
     * @throws NoSuchChatException           if the chat does not exist
     * @throws VerificationRequiredException if the chat is a verified group and
     *                                       the contact is not verified
     */
    public ChatRecord addMember(ChatId chatId, ContactId contact) {
        synchronized (chats) {
            ChatRecord chat = chats.find(chatId).orElseThrow(() -> new NoSuchChatException(chatId));
            if (!chat.isGroup()) {
                throw new IllegalArgumentException(chatId + " is not a group");
            }
            if (chat.hasMember(contact)) {
                return chat;
            }
            if (chat.isVerified() && !contact.isSelf() && !identity.isVerified(contact)) {
                throw new VerificationRequiredException(contact, chatId);
            }
            ChatRecord updated = chat.withMember(contact);
            chats.update(updated);
            return updated;
        }
    }
}
