package com.questrail.chatmail.protocol.chat;

import com.questrail.chatmail.api.ChatId;
import com.questrail.chatmail.api.ChatType;
import com.questrail.chatmail.api.ContactId;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Snapshot of a chat and its members.
 *
 * @param id       chat id
 * @param type     single, group or verified group
 * @param name     display name
 * @param groupId  group id shared by all members' devices, {@code null} for single chats
 * @param members  member contacts; groups include {@link ContactId#SELF}
 * @param promoted whether a message was ever sent to the group
 * @param archived whether the user moved the chat out of the main list
 * @param blocked  whether the chat is hidden from the chat list
 */
public record ChatRecord(
        ChatId id,
        ChatType type,
        String name,
        String groupId,
        Set<ContactId> members,
        boolean promoted,
        boolean archived,
        boolean blocked
) {
    public ChatRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(members, "members");
        name = name == null ? "" : name;
        members = Set.copyOf(members);
        if (type != ChatType.SINGLE && groupId == null) {
            throw new IllegalArgumentException("group chats need a group id");
        }
    }

    public boolean isGroup() {
        return type != ChatType.SINGLE;
    }

    public boolean isVerified() {
        return type == ChatType.VERIFIED_GROUP;
    }

    public boolean hasMember(ContactId contact) {
        return members.contains(contact);
    }

    public ChatRecord withMember(ContactId contact) {
        Set<ContactId> updated = new LinkedHashSet<>(members);
        updated.add(contact);
        return new ChatRecord(id, type, name, groupId, updated, promoted, archived, blocked);
    }

    public ChatRecord withPromoted(boolean value) {
        return new ChatRecord(id, type, name, groupId, members, value, archived, blocked);
    }

    public ChatRecord withArchived(boolean value) {
        return new ChatRecord(id, type, name, groupId, members, promoted, value, blocked);
    }

    public ChatRecord withBlocked(boolean value) {
        return new ChatRecord(id, type, name, groupId, members, promoted, archived, value);
    }
}
