package com.questrail.chatmail.transport;

/**
 * Raised by a transport collaborator when it cannot reach or use the server.
 */
public class TransportException extends Exception {

    private final boolean permanent;

    public TransportException(String message) {
        this(message, false, null);
    }

    public TransportException(String message, Throwable cause) {
        this(message, false, cause);
    }

    public TransportException(String message, boolean permanent, Throwable cause) {
        super(message, cause);
        this.permanent = permanent;
    }

    /**
     * Returns true if retrying the same operation cannot succeed.
     */
    public boolean isPermanent() {
        return permanent;
    }
}
