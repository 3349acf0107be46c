package com.questrail.chatmail.protocol;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * URL-safe random strings for message ids, group ids and secure-join tokens.
 */
public final class RandomTokens {

    private static final SecureRandom RANDOM = new SecureRandom();

    private RandomTokens() {}

    /**
     * Returns a random token of {@code bytes} bytes of entropy, base64url encoded without padding.
     */
    public static String next(int bytes) {
        byte[] buf = new byte[bytes];
        RANDOM.nextBytes(buf);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(buf);
    }

    /**
     * Returns a new {@code Message-ID} in the given domain.
     */
    public static String messageId(String selfAddress) {
        int at = selfAddress.lastIndexOf('@');
        String domain = at >= 0 && at < selfAddress.length() - 1
                ? selfAddress.substring(at + 1)
                : "localhost";
        return "Mr." + next(9) + "." + next(9) + "@" + domain;
    }
}
