package com.questrail.chatmail.api;

/**
 * Kinds of chat the core distinguishes.
 */
public enum ChatType {
    /** One-to-one chat with a single contact. */
    SINGLE,

    /** Ordinary group chat. */
    GROUP,

    /** Group that only ever contains verified members. */
    VERIFIED_GROUP
}
