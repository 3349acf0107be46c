package com.questrail.chatmail.protocol.message;

/**
 * Unchecked wrapper for failures of the message store's backing storage.
 */
public class MessageStoreException extends RuntimeException {

    public MessageStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
