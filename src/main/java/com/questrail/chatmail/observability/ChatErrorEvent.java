package com.questrail.chatmail.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the chat core.
 */
public record ChatErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
