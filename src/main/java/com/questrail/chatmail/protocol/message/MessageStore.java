package com.questrail.chatmail.protocol.message;

import com.questrail.chatmail.api.ChatId;
import com.questrail.chatmail.api.ContactId;
import com.questrail.chatmail.api.MessageId;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for messages. Implementations must be thread-safe.
 */
public interface MessageStore {

    /**
     * Stores a message that has no id yet.
     *
     * @return the stored message, carrying its new id
     */
    MessageRecord insert(MessageRecord message);

    Optional<MessageRecord> find(MessageId id);

    Optional<MessageRecord> findByRfc724Mid(String rfc724Mid);

    /**
     * Overwrites the stored row of a message.
     *
     * @return false if the message no longer exists
     */
    boolean update(MessageRecord message);

    boolean delete(MessageId id);

    /**
     * Messages of a chat, oldest first.
     */
    List<MessageRecord> listByChat(ChatId chatId);

    /**
     * Messages received from a contact, in any chat, oldest first.
     */
    List<MessageRecord> listFromContact(ContactId contact);

    /**
     * Hidden (handshake) messages, oldest first.
     */
    List<MessageRecord> listHidden();
}
