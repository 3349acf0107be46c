package com.questrail.chatmail.api;

public class NoSuchMessageException extends ChatCoreException {

    public NoSuchMessageException(MessageId messageId) {
        super("no such message: " + messageId);
    }
}
