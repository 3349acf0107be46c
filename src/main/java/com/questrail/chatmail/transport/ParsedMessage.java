package com.questrail.chatmail.transport;

import java.util.Objects;
import java.util.Optional;

/**
 * The parts of a received message the protocol core acts on.
 *
 * @param rfc724Mid          {@code Message-ID}
 * @param fromAddress        sender address
 * @param fromName           sender display name, may be {@code null}
 * @param sentTimestamp      sender's {@code Date}, epoch millis
 * @param chatMessage        true if the sender is a chat client ({@code Chat-Version} present)
 * @param groupId            {@code Chat-Group-ID}, may be {@code null}
 * @param groupName          {@code Chat-Group-Name}, may be {@code null}
 * @param text               decoded body text
 * @param wantsMdn           whether the sender asked for a read receipt
 * @param handshake          secure-join headers, if this is a handshake message
 * @param readReceiptFor     for MDNs, the {@code Message-ID} that was read
 * @param deliveryFailureFor for bounces, the {@code Message-ID} that failed
 */
public record ParsedMessage(
        String rfc724Mid,
        String fromAddress,
        String fromName,
        long sentTimestamp,
        boolean chatMessage,
        String groupId,
        String groupName,
        String text,
        boolean wantsMdn,
        Optional<HandshakeHeaders> handshake,
        Optional<String> readReceiptFor,
        Optional<String> deliveryFailureFor
) {
    public ParsedMessage {
        Objects.requireNonNull(rfc724Mid, "rfc724Mid");
        Objects.requireNonNull(fromAddress, "fromAddress");
        Objects.requireNonNull(handshake, "handshake");
        Objects.requireNonNull(readReceiptFor, "readReceiptFor");
        Objects.requireNonNull(deliveryFailureFor, "deliveryFailureFor");
        text = text == null ? "" : text;
    }

    public boolean isHandshake() {
        return handshake.isPresent();
    }

    public boolean isReadReceipt() {
        return readReceiptFor.isPresent();
    }

    public boolean isDeliveryFailure() {
        return deliveryFailureFor.isPresent();
    }

    public static Builder builder(String rfc724Mid, String fromAddress) {
        return new Builder(rfc724Mid, fromAddress);
    }

    public static final class Builder {
        private final String rfc724Mid;
        private final String fromAddress;
        private String fromName;
        private long sentTimestamp;
        private boolean chatMessage = true;
        private String groupId;
        private String groupName;
        private String text = "";
        private boolean wantsMdn;
        private HandshakeHeaders handshake;
        private String readReceiptFor;
        private String deliveryFailureFor;

        private Builder(String rfc724Mid, String fromAddress) {
            this.rfc724Mid = rfc724Mid;
            this.fromAddress = fromAddress;
        }

        public Builder withFromName(String name) {
            this.fromName = name;
            return this;
        }

        public Builder withSentTimestamp(long millis) {
            this.sentTimestamp = millis;
            return this;
        }

        public Builder withChatMessage(boolean chatMessage) {
            this.chatMessage = chatMessage;
            return this;
        }

        public Builder withGroup(String groupId, String groupName) {
            this.groupId = groupId;
            this.groupName = groupName;
            return this;
        }

        public Builder withText(String text) {
            this.text = text;
            return this;
        }

        public Builder withWantsMdn(boolean wantsMdn) {
            this.wantsMdn = wantsMdn;
            return this;
        }

        public Builder withHandshake(HandshakeHeaders headers) {
            this.handshake = headers;
            return this;
        }

        public Builder withReadReceiptFor(String originalMid) {
            this.readReceiptFor = originalMid;
            return this;
        }

        public Builder withDeliveryFailureFor(String originalMid) {
            this.deliveryFailureFor = originalMid;
            return this;
        }

        public ParsedMessage build() {
            return new ParsedMessage(rfc724Mid, fromAddress, fromName, sentTimestamp, chatMessage,
                    groupId, groupName, text, wantsMdn,
                    Optional.ofNullable(handshake),
                    Optional.ofNullable(readReceiptFor),
                    Optional.ofNullable(deliveryFailureFor));
        }
    }
}
