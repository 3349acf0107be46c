package com.questrail.chatmail.observability;

import com.questrail.chatmail.api.Transport;

import java.time.Instant;

/**
 * Record representing a transport-thread event (wake-ups, fetches, network trouble).
 */
public record TransportObservabilityEvent(
    Instant timestamp,
    Transport transport,
    Kind kind,
    String detail
) {
    public enum Kind {
        WOKE,
        FETCHED,
        NETWORK_ERROR,
        SUSPENDED,
        RESUMED
    }
}
