package com.questrail.chatmail.protocol.message;

import com.questrail.chatmail.api.ChatId;
import com.questrail.chatmail.api.ContactId;
import com.questrail.chatmail.api.MessageId;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Non-durable {@link MessageStore}.
 */
public final class InMemoryMessageStore implements MessageStore {

    private static final Comparator<MessageRecord> CHRONOLOGICAL =
            Comparator.comparingLong(MessageRecord::sortTimestamp)
                    .thenComparingLong(m -> m.id().value());

    private final Map<MessageId, MessageRecord> rows = new LinkedHashMap<>();
    private long nextId = 10;

    @Override
    public synchronized MessageRecord insert(MessageRecord message) {
        Objects.requireNonNull(message, "message");
        if (message.isStored()) {
            throw new IllegalArgumentException("message already has an id: " + message.id());
        }
        MessageRecord stored = message.withId(MessageId.of(nextId++));
        rows.put(stored.id(), stored);
        return stored;
    }

    @Override
    public synchronized Optional<MessageRecord> find(MessageId id) {
        return Optional.ofNullable(rows.get(id));
    }

    @Override
    public synchronized Optional<MessageRecord> findByRfc724Mid(String rfc724Mid) {
        return rows.values().stream()
                .filter(m -> m.rfc724Mid().equals(rfc724Mid))
                .findFirst();
    }

    @Override
    public synchronized boolean update(MessageRecord message) {
        if (!rows.containsKey(message.id())) {
            return false;
        }
        rows.put(message.id(), message);
        return true;
    }

    @Override
    public synchronized boolean delete(MessageId id) {
        return rows.remove(id) != null;
    }

    @Override
    public synchronized List<MessageRecord> listByChat(ChatId chatId) {
        return list(m -> m.chatId().equals(chatId));
    }

    @Override
    public synchronized List<MessageRecord> listFromContact(ContactId contact) {
        return list(m -> m.fromContact().equals(contact));
    }

    @Override
    public synchronized List<MessageRecord> listHidden() {
        return list(MessageRecord::isHidden);
    }

    private List<MessageRecord> list(Predicate<MessageRecord> filter) {
        return rows.values().stream()
                .filter(filter)
                .sorted(CHRONOLOGICAL)
                .collect(Collectors.toList());
    }
}
