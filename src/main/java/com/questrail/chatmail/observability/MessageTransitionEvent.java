package com.questrail.chatmail.observability;

import com.questrail.chatmail.protocol.message.MessageEvent;
import com.questrail.chatmail.protocol.message.MessageIntents;
import com.questrail.chatmail.protocol.message.MessageRecord;

import java.time.Instant;

/**
 * Record representing one reducer step of the message state machine.
 */
public record MessageTransitionEvent(
    Instant timestamp,
    MessageRecord oldMessage,
    MessageRecord newMessage,
    MessageEvent triggeringEvent,
    MessageIntents resultingIntents
) {
    /**
     * Checks if the delivery state changed during this transition.
     */
    public boolean isStateChange() {
        return oldMessage.state() != newMessage.state();
    }
}
