package com.questrail.chatmail.events;

import java.util.Objects;

/**
 * An event for the embedder.
 *
 * @param kind  what happened
 * @param data1 first integer payload, meaning depends on {@code kind}
 * @param data2 second integer payload, meaning depends on {@code kind}
 * @param text  optional human-readable payload, may be {@code null}
 */
public record ChatEvent(EventKind kind, long data1, long data2, String text) {

    public ChatEvent {
        Objects.requireNonNull(kind, "kind");
    }

    public static ChatEvent of(EventKind kind, long data1, long data2) {
        return new ChatEvent(kind, data1, data2, null);
    }

    public static ChatEvent withText(EventKind kind, long data1, String text) {
        return new ChatEvent(kind, data1, 0, text);
    }

    public static ChatEvent info(String text) {
        return new ChatEvent(EventKind.INFO, 0, 0, text);
    }

    public static ChatEvent warning(String text) {
        return new ChatEvent(EventKind.WARNING, 0, 0, text);
    }
}
