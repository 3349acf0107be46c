package com.questrail.chatmail.protocol.chat;

import com.questrail.chatmail.api.ChatId;
import com.questrail.chatmail.api.ChatType;
import com.questrail.chatmail.api.ContactId;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Non-durable {@link ChatStore}. Chat ids start after the reserved range.
 */
public final class InMemoryChatStore implements ChatStore {

    private final Map<ChatId, ChatRecord> chats = new HashMap<>();
    private long nextId = ChatId.LAST_SPECIAL + 1;

    @Override
    public synchronized Optional<ChatRecord> find(ChatId id) {
        return Optional.ofNullable(chats.get(id));
    }

    @Override
    public synchronized Optional<ChatRecord> findByGroupId(String groupId) {
        return chats.values().stream()
                .filter(c -> groupId.equals(c.groupId()))
                .findFirst();
    }

    @Override
    public synchronized Optional<ChatRecord> findSingle(ContactId contact) {
        return chats.values().stream()
                .filter(c -> c.type() == ChatType.SINGLE && c.hasMember(contact))
                .findFirst();
    }

    @Override
    public synchronized ChatRecord getOrCreateSingle(ContactId contact, boolean blocked) {
        Optional<ChatRecord> existing = findSingle(contact);
        if (existing.isPresent()) {
            return existing.get();
        }
        ChatRecord chat = new ChatRecord(ChatId.of(nextId++), ChatType.SINGLE, null, null,
                Set.of(contact), false, false, blocked);
        chats.put(chat.id(), chat);
        return chat;
    }

    @Override
    public synchronized ChatRecord createGroup(ChatType type, String name, String groupId) {
        if (type == ChatType.SINGLE) {
            throw new IllegalArgumentException("not a group type: " + type);
        }
        Objects.requireNonNull(groupId, "groupId");
        ChatRecord chat = new ChatRecord(ChatId.of(nextId++), type, name, groupId,
                Set.of(ContactId.SELF), false, false, false);
        chats.put(chat.id(), chat);
        return chat;
    }

    @Override
    public synchronized void update(ChatRecord chat) {
        if (!chats.containsKey(chat.id())) {
            throw new IllegalArgumentException("unknown chat " + chat.id());
        }
        chats.put(chat.id(), chat);
    }
}
