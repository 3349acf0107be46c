package com.questrail.chatmail.transport;

import java.util.Objects;
import java.util.Optional;

/**
 * Secure-join payload carried by a handshake message.
 *
 * @param step          the {@code Secure-Join} header
 * @param inviteNumber  {@code Secure-Join-Invitenumber}, echoed by both sides to match the session
 * @param auth          {@code Secure-Join-Auth}, only on request-with-auth
 * @param fingerprint   {@code Secure-Join-Fingerprint}, the sender's own fingerprint
 * @param groupId       {@code Secure-Join-Group}, group steps only
 * @param groupName     group name for member-added, may be {@code null}
 * @param groupVerified whether the group being joined is a verified group
 */
public record HandshakeHeaders(
        HandshakeStep step,
        String inviteNumber,
        String auth,
        String fingerprint,
        String groupId,
        String groupName,
        boolean groupVerified
) {
    public HandshakeHeaders {
        Objects.requireNonNull(step, "step");
        Objects.requireNonNull(inviteNumber, "inviteNumber");
    }

    public static HandshakeHeaders of(HandshakeStep step, String inviteNumber) {
        return new HandshakeHeaders(step, inviteNumber, null, null, null, null, false);
    }

    public HandshakeHeaders withAuth(String auth, String fingerprint) {
        return new HandshakeHeaders(step, inviteNumber, auth, fingerprint, groupId, groupName, groupVerified);
    }

    public HandshakeHeaders withGroup(String groupId, String groupName, boolean verified) {
        return new HandshakeHeaders(step, inviteNumber, auth, fingerprint, groupId, groupName, verified);
    }

    public Optional<String> authToken() {
        return Optional.ofNullable(auth);
    }

    public Optional<String> senderFingerprint() {
        return Optional.ofNullable(fingerprint);
    }

    public Optional<String> group() {
        return Optional.ofNullable(groupId);
    }
}
