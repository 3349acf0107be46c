package com.questrail.chatmail.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for operational correctness.
 *
 * <h2>Binding invariant</h2>
 * Idle timeouts and secure-join deadlines MUST use a monotonic time source.
 * Wall-clock time is used only for persisted timestamps (message sort times,
 * job {@code notBefore}) and for observability.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();
}
