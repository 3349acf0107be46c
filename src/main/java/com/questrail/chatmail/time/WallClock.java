package com.questrail.chatmail.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source for timestamps that outlive the process.
 *
 * <p>
 * This clock may jump due to DST, NTP adjustments, or explicit time setting.
 * It is used for job scheduling columns and message timestamps because those
 * are persisted, but never for in-process deadlines.
 * </p>
 */
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();

    /**
     * Returns the current wall-clock time in epoch milliseconds.
     */
    default long nowMillis() {
        return now().toEpochMilli();
    }
}
