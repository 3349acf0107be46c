package com.questrail.chatmail.api;

/**
 * Identifier of a contact. {@link #SELF} is the local user.
 */
public record ContactId(long value) {

    public static final ContactId SELF = new ContactId(1);

    public ContactId {
        if (value <= 0) {
            throw new IllegalArgumentException("contact id must be positive: " + value);
        }
    }

    public static ContactId of(long value) {
        return new ContactId(value);
    }

    public boolean isSelf() {
        return value == SELF.value;
    }

    @Override
    public String toString() {
        return "Contact#" + value;
    }
}
