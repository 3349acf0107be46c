package com.questrail.chatmail.api;

/**
 * Base class for precondition failures reported synchronously by the core.
 *
 * <p>An operation that throws a {@code ChatCoreException} has not mutated any
 * state.</p>
 */
public class ChatCoreException extends RuntimeException {

    public ChatCoreException(String message) {
        super(message);
    }

    public ChatCoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
