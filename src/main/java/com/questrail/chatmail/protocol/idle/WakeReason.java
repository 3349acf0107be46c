package com.questrail.chatmail.protocol.idle;

/**
 * Why {@link InterruptCoordinator#await(java.time.Duration)} returned.
 */
public enum WakeReason {
    /** Someone called {@code interrupt()}, or a suspension ended. */
    INTERRUPTED,

    /** The timeout elapsed without an interrupt. */
    TIMED_OUT,

    /** The coordinator was shut down, or the waiting thread was interrupted. */
    SHUTDOWN
}
