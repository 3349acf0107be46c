package com.questrail.chatmail.protocol.message;

/**
 * Carries out the {@link MessageIntents} produced for a message.
 *
 * <p>Called after the new message state has been stored and outside any
 * state machine lock.</p>
 */
public interface MessageIntentExecutor {

    void execute(MessageRecord message, MessageIntents intents);
}
