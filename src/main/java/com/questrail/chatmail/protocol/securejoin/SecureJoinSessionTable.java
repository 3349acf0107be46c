package com.questrail.chatmail.protocol.securejoin;

import com.questrail.chatmail.api.ContactId;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Live secure-join sessions, keyed by peer and local role.
 *
 * <p>All access happens under one lock. A joiner waiting for the handshake to
 * progress parks on {@link #awaitChange(Duration)} and is woken by
 * {@link #signalAll()} whenever a session changes.</p>
 */
final class SecureJoinSessionTable {

    record Key(ContactId peer, SecureJoinRole role) {}

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final Map<Key, SecureJoinSession> sessions = new HashMap<>();

    static Key keyOf(SecureJoinSession session) {
        return new Key(session.peer(), session.role());
    }

    <T> T callLocked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    void withLock(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    Optional<SecureJoinSession> get(ContactId peer, SecureJoinRole role) {
        lock.lock();
        try {
            return Optional.ofNullable(sessions.get(new Key(peer, role)));
        } finally {
            lock.unlock();
        }
    }

    void put(SecureJoinSession session) {
        lock.lock();
        try {
            sessions.put(keyOf(session), session);
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    void remove(SecureJoinSession session) {
        lock.lock();
        try {
            sessions.remove(keyOf(session));
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    List<SecureJoinSession> snapshot() {
        lock.lock();
        try {
            return new ArrayList<>(sessions.values());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits for a session change. Must be called with the lock held, via
     * {@link #callLocked(Supplier)}.
     */
    void awaitChange(Duration timeout) throws InterruptedException {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("awaitChange requires the table lock");
        }
        changed.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    void signalAll() {
        lock.lock();
        try {
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }
}
