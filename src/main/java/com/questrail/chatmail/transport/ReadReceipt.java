package com.questrail.chatmail.transport;

import com.questrail.chatmail.api.ContactId;

import java.util.Objects;

/**
 * A read receipt (MDN) to send for a received message.
 *
 * @param recipient         the original sender
 * @param originalRfc724Mid {@code Message-ID} of the message that was read
 */
public record ReadReceipt(ContactId recipient, String originalRfc724Mid) {

    public ReadReceipt {
        Objects.requireNonNull(recipient, "recipient");
        Objects.requireNonNull(originalRfc724Mid, "originalRfc724Mid");
    }
}
