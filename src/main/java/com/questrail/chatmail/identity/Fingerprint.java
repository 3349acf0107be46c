package com.questrail.chatmail.identity;

import java.util.Locale;
import java.util.Objects;

/**
 * OpenPGP key fingerprint in normalized form: upper-case hex, no separators.
 */
public record Fingerprint(String hex) {

    public Fingerprint {
        Objects.requireNonNull(hex, "hex");
        if (hex.isEmpty()) {
            throw new IllegalArgumentException("fingerprint must not be empty");
        }
        for (int i = 0; i < hex.length(); i++) {
            if (Character.digit(hex.charAt(i), 16) < 0) {
                throw new IllegalArgumentException("fingerprint is not hex: " + hex);
            }
        }
    }

    /**
     * Normalizes a fingerprint as written by humans or in QR codes:
     * whitespace and colons are ignored, case is folded.
     */
    public static Fingerprint parse(String text) {
        Objects.requireNonNull(text, "text");
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!Character.isWhitespace(c) && c != ':') {
                sb.append(c);
            }
        }
        return new Fingerprint(sb.toString().toUpperCase(Locale.ROOT));
    }

    @Override
    public String toString() {
        return hex;
    }
}
