package com.questrail.chatmail.api;

/**
 * Thrown when a long-running operation is started while another one runs.
 */
public class OngoingProcessException extends ChatCoreException {

    public OngoingProcessException(String running, String requested) {
        super("cannot start " + requested + " while " + running + " is running");
    }
}
