package com.questrail.chatmail.protocol.securejoin;

import com.questrail.chatmail.identity.Fingerprint;
import com.questrail.chatmail.transport.HandshakeHeaders;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * HandshakeEvent
 * -----------------------------------------------------------------------------
 * Inputs to the {@link SecureJoinReducer}.
 *
 * <p>Key lookups happen before an event is built: events carry the fingerprint
 * the identity service currently knows for the peer, so the reducer can
 * compare fingerprints without calling out.</p>
 */
public sealed interface HandshakeEvent
        permits HandshakeEvent.JoinStarted, HandshakeEvent.StepReceived,
                HandshakeEvent.DeadlineExpired, HandshakeEvent.Cancelled,
                HandshakeEvent.Aborted
{
    Instant timestamp();

    abstract class Base {
        private final Instant timestamp;

        protected Base(Instant timestamp) {
            this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        }

        public Instant timestamp() {
            return timestamp;
        }
    }

    /** The joiner scanned the code and starts the handshake. */
    final class JoinStarted extends Base implements HandshakeEvent {
        private final Optional<Fingerprint> knownPeerFingerprint;

        public JoinStarted(Instant timestamp, Optional<Fingerprint> knownPeerFingerprint) {
            super(timestamp);
            this.knownPeerFingerprint = Objects.requireNonNull(knownPeerFingerprint, "knownPeerFingerprint");
        }

        /** The inviter's key, if one was already known before the join. */
        public Optional<Fingerprint> knownPeerFingerprint() {
            return knownPeerFingerprint;
        }
    }

    /** A handshake message from the peer arrived. */
    final class StepReceived extends Base implements HandshakeEvent {
        private final HandshakeHeaders headers;
        private final Optional<Fingerprint> peerFingerprint;

        public StepReceived(Instant timestamp, HandshakeHeaders headers, Optional<Fingerprint> peerFingerprint) {
            super(timestamp);
            this.headers = Objects.requireNonNull(headers, "headers");
            this.peerFingerprint = Objects.requireNonNull(peerFingerprint, "peerFingerprint");
        }

        public HandshakeHeaders headers() {
            return headers;
        }

        /** The key the message was signed with, as known to the identity service. */
        public Optional<Fingerprint> peerFingerprint() {
            return peerFingerprint;
        }
    }

    /** The session deadline passed. */
    final class DeadlineExpired extends Base implements HandshakeEvent {
        public DeadlineExpired(Instant timestamp) {
            super(timestamp);
        }
    }

    /** The user stopped the handshake. */
    final class Cancelled extends Base implements HandshakeEvent {
        public Cancelled(Instant timestamp) {
            super(timestamp);
        }
    }

    /** Applying the previous step's side effects failed locally. */
    final class Aborted extends Base implements HandshakeEvent {
        public Aborted(Instant timestamp) {
            super(timestamp);
        }
    }
}
