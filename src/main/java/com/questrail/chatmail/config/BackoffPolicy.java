package com.questrail.chatmail.config;

import java.time.Duration;
import java.util.Objects;

/**
 * BackoffPolicy
 * -----------------------------------------------------------------------------
 * Retry spacing for recoverable job failures.
 *
 * <p>The delay before attempt {@code n} (with {@code n >= 1} prior failures) is
 * {@code min(initialDelay * 2^(n-1), maxDelay)}. The schedule is deterministic
 * and non-decreasing in {@code n}. A job whose failure count reaches
 * {@code maxRetries} is failed terminally.</p>
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>initialDelay</b> - delay after the first failure.</li>
 *   <li><b>maxDelay</b> - upper bound for any single delay.</li>
 *   <li><b>maxRetries</b> - failures after which a job is abandoned.</li>
 * </ul>
 */
public record BackoffPolicy(
        Duration initialDelay,
        Duration maxDelay,
        int maxRetries
) {
    public BackoffPolicy {
        Objects.requireNonNull(initialDelay, "initialDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");

        if (initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must be non-negative");
        }
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= initialDelay");
        }
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be at least 1");
        }
    }

    /**
     * Default values: 30 s initial delay, 30 min cap, 8 retries.
     */
    public static BackoffPolicy defaults() {
        return new BackoffPolicy(Duration.ofSeconds(30), Duration.ofMinutes(30), 8);
    }

    /**
     * Returns the delay to apply after the given number of failures.
     *
     * @param tries failures so far, at least 1
     */
    public Duration delayFor(int tries) {
        if (tries < 1) {
            throw new IllegalArgumentException("tries must be at least 1");
        }
        int shift = Math.min(tries - 1, 30);
        long millis = initialDelay.toMillis();
        long max = maxDelay.toMillis();
        if (millis > (max >> shift)) {
            return maxDelay;
        }
        return Duration.ofMillis(Math.min(millis << shift, max));
    }

    /**
     * Returns true if a job with this many failures should not be retried.
     */
    public boolean isExhausted(int tries) {
        return tries >= maxRetries;
    }
}
