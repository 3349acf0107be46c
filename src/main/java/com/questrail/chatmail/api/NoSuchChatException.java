package com.questrail.chatmail.api;

public class NoSuchChatException extends ChatCoreException {

    public NoSuchChatException(ChatId chatId) {
        super("no such chat: " + chatId);
    }
}
