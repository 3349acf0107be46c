package com.questrail.chatmail.protocol.chat;

import com.questrail.chatmail.api.ChatId;
import com.questrail.chatmail.api.ChatType;
import com.questrail.chatmail.api.ContactId;

import java.util.Optional;

/**
 * Persistence for chats. Implementations must be thread-safe.
 */
public interface ChatStore {

    Optional<ChatRecord> find(ChatId id);

    Optional<ChatRecord> findByGroupId(String groupId);

    Optional<ChatRecord> findSingle(ContactId contact);

    /**
     * Returns the 1:1 chat with {@code contact}, creating it (possibly blocked) if missing.
     */
    ChatRecord getOrCreateSingle(ContactId contact, boolean blocked);

    /**
     * Creates a group chat whose only member is self.
     */
    ChatRecord createGroup(ChatType type, String name, String groupId);

    void update(ChatRecord chat);
}
