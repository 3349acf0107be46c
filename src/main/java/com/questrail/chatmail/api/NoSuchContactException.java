package com.questrail.chatmail.api;

public class NoSuchContactException extends ChatCoreException {

    public NoSuchContactException(ContactId contactId) {
        super("no such contact: " + contactId);
    }
}
