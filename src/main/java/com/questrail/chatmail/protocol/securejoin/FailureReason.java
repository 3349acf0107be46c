package com.questrail.chatmail.protocol.securejoin;

import com.questrail.chatmail.api.SecureJoinResult;

/**
 * Why a handshake session failed.
 */
public enum FailureReason {
    /** The peer's key does not match the fingerprint from the QR code or the one it presented. */
    FINGERPRINT_MISMATCH(SecureJoinResult.Status.FINGERPRINT_MISMATCH),

    /** The peer presented a wrong auth token for a valid invite. */
    BAD_TOKEN(SecureJoinResult.Status.BAD_TOKEN),

    /** The peer did not answer before the session deadline. */
    TIMEOUT(SecureJoinResult.Status.TIMEOUT),

    /** The user stopped the handshake. */
    CANCELLED(SecureJoinResult.Status.CANCELLED),

    /** A local step of the handshake could not be applied, e.g. the group was deleted meanwhile. */
    ABORTED(SecureJoinResult.Status.ABORTED);

    private final SecureJoinResult.Status status;

    FailureReason(SecureJoinResult.Status status) {
        this.status = status;
    }

    public SecureJoinResult.Status status() {
        return status;
    }
}
