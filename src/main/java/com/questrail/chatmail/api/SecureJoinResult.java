package com.questrail.chatmail.api;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a blocking secure-join attempt on the joiner side.
 *
 * @param status how the attempt ended
 * @param chatId the verified 1:1 chat or the joined group, present only on success
 */
public record SecureJoinResult(Status status, Optional<ChatId> chatId) {

    public enum Status {
        SUCCESS,
        FINGERPRINT_MISMATCH,
        BAD_TOKEN,
        TIMEOUT,
        CANCELLED,
        ABORTED
    }

    public SecureJoinResult {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(chatId, "chatId");
        if (status == Status.SUCCESS && chatId.isEmpty()) {
            throw new IllegalArgumentException("successful join requires a chat id");
        }
    }

    public static SecureJoinResult success(ChatId chatId) {
        return new SecureJoinResult(Status.SUCCESS, Optional.of(chatId));
    }

    public static SecureJoinResult failed(Status status) {
        return new SecureJoinResult(status, Optional.empty());
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
