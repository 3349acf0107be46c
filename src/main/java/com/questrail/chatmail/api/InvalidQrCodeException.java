package com.questrail.chatmail.api;

public class InvalidQrCodeException extends ChatCoreException {

    public InvalidQrCodeException(String message) {
        super(message);
    }
}
