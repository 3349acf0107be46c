package com.questrail.chatmail.transport;

import java.util.Optional;

/**
 * Values of the {@code Secure-Join} header.
 *
 * <p>{@code vc-*} steps verify a contact, {@code vg-*} steps additionally join
 * a group. Each step is sent by exactly one side.</p>
 */
public enum HandshakeStep {
    VC_REQUEST("vc-request", Sender.JOINER),
    VG_REQUEST("vg-request", Sender.JOINER),
    VC_AUTH_REQUIRED("vc-auth-required", Sender.INVITER),
    VG_AUTH_REQUIRED("vg-auth-required", Sender.INVITER),
    VC_REQUEST_WITH_AUTH("vc-request-with-auth", Sender.JOINER),
    VG_REQUEST_WITH_AUTH("vg-request-with-auth", Sender.JOINER),
    VC_CONTACT_CONFIRM("vc-contact-confirm", Sender.INVITER),
    VG_MEMBER_ADDED("vg-member-added", Sender.INVITER),
    VG_MEMBER_ADDED_RECEIVED("vg-member-added-received", Sender.JOINER);

    public enum Sender { INVITER, JOINER }

    private final String headerValue;
    private final Sender sender;

    HandshakeStep(String headerValue, Sender sender) {
        this.headerValue = headerValue;
        this.sender = sender;
    }

    public String headerValue() {
        return headerValue;
    }

    public Sender sender() {
        return sender;
    }

    public boolean isGroupStep() {
        return headerValue.startsWith("vg-");
    }

    public static Optional<HandshakeStep> fromHeader(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        for (HandshakeStep step : values()) {
            if (step.headerValue.equalsIgnoreCase(trimmed)) {
                return Optional.of(step);
            }
        }
        return Optional.empty();
    }
}
