package com.questrail.chatmail.config;

import com.questrail.chatmail.events.EventChannel;

import java.time.Duration;
import java.util.Objects;

/**
 * Aggregated configuration for a chat core instance.
 */
public record ChatCoreConfig(
        BackoffPolicy backoff,
        SecureJoinPolicy secureJoin,
        WatchConfig watch,
        Duration idleTimeout,
        boolean mdnsEnabled,
        int eventCapacity
) {
    public ChatCoreConfig {
        Objects.requireNonNull(backoff, "backoff");
        Objects.requireNonNull(secureJoin, "secureJoin");
        Objects.requireNonNull(watch, "watch");
        Objects.requireNonNull(idleTimeout, "idleTimeout");
        if (idleTimeout.isZero() || idleTimeout.isNegative()) {
            throw new IllegalArgumentException("idleTimeout must be positive");
        }
        if (eventCapacity <= 0) {
            throw new IllegalArgumentException("eventCapacity must be positive");
        }
    }

    public static ChatCoreConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private BackoffPolicy backoff = BackoffPolicy.defaults();
        private SecureJoinPolicy secureJoin = SecureJoinPolicy.defaults();
        private WatchConfig watch = WatchConfig.defaults();
        private Duration idleTimeout = Duration.ofMinutes(10);
        private boolean mdnsEnabled = true;
        private int eventCapacity = EventChannel.DEFAULT_CAPACITY;

        public Builder withBackoff(BackoffPolicy backoff) {
            this.backoff = backoff;
            return this;
        }

        public Builder withSecureJoin(SecureJoinPolicy secureJoin) {
            this.secureJoin = secureJoin;
            return this;
        }

        public Builder withWatch(WatchConfig watch) {
            this.watch = watch;
            return this;
        }

        public Builder withIdleTimeout(Duration idleTimeout) {
            this.idleTimeout = idleTimeout;
            return this;
        }

        public Builder withMdnsEnabled(boolean enabled) {
            this.mdnsEnabled = enabled;
            return this;
        }

        public Builder withEventCapacity(int capacity) {
            this.eventCapacity = capacity;
            return this;
        }

        public ChatCoreConfig build() {
            return new ChatCoreConfig(backoff, secureJoin, watch, idleTimeout, mdnsEnabled, eventCapacity);
        }
    }
}
