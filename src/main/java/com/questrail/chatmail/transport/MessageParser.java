package com.questrail.chatmail.transport;

/**
 * Decodes a raw fetched message (MIME, decryption) into the fields the core uses.
 */
@FunctionalInterface
public interface MessageParser {

    ParsedMessage parse(byte[] blob) throws MessageParseException;
}
