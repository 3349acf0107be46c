package com.questrail.chatmail.protocol.jobs;

/**
 * Unchecked wrapper for failures of the job store's backing storage.
 */
public class JobStoreException extends RuntimeException {

    public JobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
