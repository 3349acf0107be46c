package com.questrail.chatmail.identity;

import com.questrail.chatmail.api.ContactId;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory key store for tests. Keys are learned explicitly through
 * {@link #learnKey(ContactId, Fingerprint)}.
 */
public final class FakeIdentityService implements IdentityService {

    private final Fingerprint self;
    private final String selfAddress;
    private final Map<ContactId, Fingerprint> keys = new HashMap<>();
    private final Set<ContactId> verified = new HashSet<>();

    public FakeIdentityService(String selfAddress, Fingerprint self) {
        this.selfAddress = selfAddress;
        this.self = self;
    }

    @Override
    public Fingerprint selfFingerprint() {
        return self;
    }

    @Override
    public String selfAddress() {
        return selfAddress;
    }

    @Override
    public synchronized Optional<Fingerprint> fingerprint(ContactId contact) {
        return Optional.ofNullable(keys.get(contact));
    }

    @Override
    public synchronized boolean isVerified(ContactId contact) {
        return verified.contains(contact);
    }

    @Override
    public synchronized void markVerified(ContactId contact) {
        verified.add(contact);
    }

    public synchronized void learnKey(ContactId contact, Fingerprint fingerprint) {
        Fingerprint previous = keys.put(contact, fingerprint);
        if (previous != null && !previous.equals(fingerprint)) {
            verified.remove(contact);
        }
    }
}
