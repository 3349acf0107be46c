package com.questrail.chatmail.protocol.message;

import com.questrail.chatmail.api.MessageId;
import com.questrail.chatmail.observability.ChatObservabilitySink;
import com.questrail.chatmail.observability.MessageTransitionEvent;
import com.questrail.chatmail.time.WallClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * MessageStateMachine
 * =============================================================================
 * The only writer of message delivery state.
 *
 * <p>Loads a message, applies the {@link MessageStateReducer}, stores the
 * result and hands the intents to the {@link MessageIntentExecutor}. The load,
 * reduce and store steps are serialized under one lock so that concurrent
 * events for the same message (a send result racing a bounce) are applied one
 * after the other. Intents run after the lock is released.</p>
 */
public final class MessageStateMachine {
    private static final Logger log = LoggerFactory.getLogger(MessageStateMachine.class);

    private final MessageStore store;
    private final MessageStateReducer reducer;
    private final MessageIntentExecutor executor;
    private final WallClock wallClock;
    private final ChatObservabilitySink sink;
    private final Object lock = new Object();

    public MessageStateMachine(MessageStore store,
                               MessageStateReducer reducer,
                               MessageIntentExecutor executor,
                               WallClock wallClock,
                               ChatObservabilitySink sink) {
        this.store = Objects.requireNonNull(store, "store");
        this.reducer = Objects.requireNonNull(reducer, "reducer");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Applies an event to a stored message.
     *
     * @return the reducer result, or empty if the message does not exist
     */
    public Optional<MessageStateReducer.Result> apply(MessageId id, MessageEvent event) {
        return apply(id, m -> event);
    }

    /**
     * Applies an event built from the current stored message.
     *
     * <p>Use this form when the event depends on message fields that must be
     * read under the same lock as the state change.</p>
     */
    public Optional<MessageStateReducer.Result> apply(MessageId id,
                                                      Function<MessageRecord, MessageEvent> eventFactory) {
        MessageRecord before;
        MessageEvent event;
        MessageStateReducer.Result result;
        synchronized (lock) {
            Optional<MessageRecord> current = store.find(id);
            if (current.isEmpty()) {
                log.debug("{} no longer exists", id);
                return Optional.empty();
            }
            before = current.get();
            event = eventFactory.apply(before);
            result = reducer.apply(before, event);
            if (result.changed(before)) {
                store.update(result.newMessage());
            }
        }

        sink.onMessageTransition(new MessageTransitionEvent(wallClock.now(),
                before, result.newMessage(), event, result.intents()));
        executor.execute(result.newMessage(), result.intents());
        return Optional.of(result);
    }

    /**
     * Updates non-state fields of a message, keeping its current state.
     */
    public Optional<MessageRecord> updateDetails(MessageId id, Function<MessageRecord, MessageRecord> change) {
        synchronized (lock) {
            Optional<MessageRecord> current = store.find(id);
            if (current.isEmpty()) {
                return Optional.empty();
            }
            MessageRecord changed = change.apply(current.get()).withState(current.get().state());
            store.update(changed);
            return Optional.of(changed);
        }
    }
}
