package com.questrail.chatmail.protocol.securejoin;

public enum SecureJoinRole {
    /** Showed the QR code. */
    INVITER,

    /** Scanned the QR code. */
    JOINER
}
