package com.questrail.chatmail.transport;

import com.questrail.chatmail.api.ChatId;
import com.questrail.chatmail.api.ContactId;
import com.questrail.chatmail.api.MessageId;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything a transport needs to render and submit one outgoing message.
 *
 * @param messageId  local id of the message
 * @param chatId     chat the message belongs to
 * @param rfc724Mid  the {@code Message-ID} to use
 * @param recipients contacts to address, never including self
 * @param groupId    group id for group chats, {@code null} otherwise
 * @param text       body text
 * @param requestMdn whether to ask recipients for a read receipt
 * @param handshake  secure-join headers, present for handshake messages
 */
public record OutboundMessage(
        MessageId messageId,
        ChatId chatId,
        String rfc724Mid,
        List<ContactId> recipients,
        String groupId,
        String text,
        boolean requestMdn,
        Optional<HandshakeHeaders> handshake
) {
    public OutboundMessage {
        Objects.requireNonNull(messageId, "messageId");
        Objects.requireNonNull(chatId, "chatId");
        Objects.requireNonNull(rfc724Mid, "rfc724Mid");
        Objects.requireNonNull(handshake, "handshake");
        recipients = List.copyOf(recipients);
        text = text == null ? "" : text;
    }
}
