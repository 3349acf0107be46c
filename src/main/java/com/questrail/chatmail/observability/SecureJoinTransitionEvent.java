package com.questrail.chatmail.observability;

import com.questrail.chatmail.api.ContactId;
import com.questrail.chatmail.protocol.securejoin.HandshakeEvent;
import com.questrail.chatmail.protocol.securejoin.SecureJoinIntents;
import com.questrail.chatmail.protocol.securejoin.SecureJoinSession;

import java.time.Instant;

/**
 * Record representing one reducer step of a secure-join session.
 */
public record SecureJoinTransitionEvent(
    Instant timestamp,
    ContactId peer,
    SecureJoinSession oldSession,
    SecureJoinSession newSession,
    HandshakeEvent triggeringEvent,
    SecureJoinIntents resultingIntents
) {
    public boolean isStepChange() {
        return oldSession.step() != newSession.step();
    }
}
