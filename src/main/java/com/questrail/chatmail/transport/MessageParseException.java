package com.questrail.chatmail.transport;

/**
 * Raised when a fetched blob cannot be understood as a message.
 */
public class MessageParseException extends Exception {

    public MessageParseException(String message) {
        super(message);
    }

    public MessageParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
