package com.questrail.chatmail.identity;

import com.questrail.chatmail.api.ContactId;

import java.util.Optional;

/**
 * Key-management collaborator: who is who, and whom the user has verified.
 *
 * <p>Peer fingerprints are learned from received messages (Autocrypt headers)
 * by the implementation; the core only queries them.</p>
 */
public interface IdentityService {

    Fingerprint selfFingerprint();

    String selfAddress();

    /**
     * Returns the fingerprint of the key currently known for {@code contact}.
     */
    Optional<Fingerprint> fingerprint(ContactId contact);

    boolean isVerified(ContactId contact);

    /**
     * Records that the key currently known for {@code contact} was verified.
     */
    void markVerified(ContactId contact);
}
