package com.questrail.chatmail.transport;

import java.util.OptionalLong;

/**
 * Result of a single transport operation.
 */
public sealed interface TransportResult
        permits TransportResult.Ok, TransportResult.RetryNow,
                TransportResult.Transient, TransportResult.Permanent {

    /** The operation succeeded; {@code newUid} is set by moves. */
    record Ok(OptionalLong newUid) implements TransportResult {}

    /** The connection was re-established and the operation should be repeated immediately. */
    record RetryNow() implements TransportResult {}

    /** The operation failed but may succeed later. */
    record Transient(String reason) implements TransportResult {}

    /** The operation cannot succeed. */
    record Permanent(String reason) implements TransportResult {}

    static TransportResult ok() {
        return new Ok(OptionalLong.empty());
    }

    static TransportResult movedTo(long newUid) {
        return new Ok(OptionalLong.of(newUid));
    }

    static TransportResult retryNow() {
        return new RetryNow();
    }

    static TransportResult failedTransiently(String reason) {
        return new Transient(reason);
    }

    static TransportResult failedPermanently(String reason) {
        return new Permanent(reason);
    }
}
