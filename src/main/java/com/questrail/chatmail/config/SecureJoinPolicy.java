package com.questrail.chatmail.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Timing for secure-join sessions.
 *
 * @param sessionTimeout how long a session may wait for the peer's next step
 * @param pollInterval   how often a blocked joiner rechecks cancellation and deadline
 */
public record SecureJoinPolicy(Duration sessionTimeout, Duration pollInterval) {

    public SecureJoinPolicy {
        Objects.requireNonNull(sessionTimeout, "sessionTimeout");
        Objects.requireNonNull(pollInterval, "pollInterval");
        if (sessionTimeout.isZero() || sessionTimeout.isNegative()) {
            throw new IllegalArgumentException("sessionTimeout must be positive");
        }
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
    }

    /**
     * Two minute sessions, rechecked every 100 ms.
     */
    public static SecureJoinPolicy defaults() {
        return new SecureJoinPolicy(Duration.ofMinutes(2), Duration.ofMillis(100));
    }
}
