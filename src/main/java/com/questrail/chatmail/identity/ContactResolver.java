package com.questrail.chatmail.identity;

import com.questrail.chatmail.api.ContactId;

import java.util.Optional;

/**
 * Maps e-mail addresses to contact ids.
 */
public interface ContactResolver {

    /**
     * Returns the contact for {@code address}, creating it if unknown.
     */
    ContactId resolve(String address, String displayName);

    Optional<ContactId> lookup(String address);

    Optional<String> address(ContactId contact);

    /**
     * Returns true if the user accepted chats from this contact, so that their
     * messages are not parked in the deaddrop.
     */
    boolean isAccepted(ContactId contact);
}
