package com.questrail.chatmail.api;

/**
 * Thrown when an unverified contact would be added to a verified group.
 */
public class VerificationRequiredException extends ChatCoreException {

    public VerificationRequiredException(ContactId contact, ChatId chatId) {
        super(contact + " is not verified and cannot join verified " + chatId);
    }
}
