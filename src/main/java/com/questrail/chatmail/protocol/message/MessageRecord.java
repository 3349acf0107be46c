package com.questrail.chatmail.protocol.message;

import com.questrail.chatmail.api.ChatId;
import com.questrail.chatmail.api.ContactId;
import com.questrail.chatmail.api.MessageId;
import com.questrail.chatmail.api.MessageState;
import com.questrail.chatmail.transport.HandshakeHeaders;
import com.questrail.chatmail.transport.ServerRef;

import java.util.Objects;
import java.util.Optional;

/**
 * MessageRecord
 * -----------------------------------------------------------------------------
 * Immutable snapshot of a stored message.
 *
 * <p>A record built by {@link #builder()} has no id until a
 * {@link MessageStore} inserts it. The delivery {@link #state()} is changed
 * only through {@link MessageStateReducer}; other fields (server location)
 * may be updated by job handlers.</p>
 */
public final class MessageRecord
{
    public enum Direction { INCOMING, OUTGOING }

    private final MessageId id;
    private final ChatId chatId;
    private final ContactId fromContact;
    private final MessageState state;
    private final long sortTimestamp;
    private final long sentTimestamp;
    private final long receivedTimestamp;
    private final boolean system;
    private final boolean hidden;
    private final String rfc724Mid;
    private final ServerRef serverRef;
    private final boolean wantsMdn;
    private final String text;
    private final HandshakeHeaders handshake;

    private MessageRecord(Builder b) {
        this.id = b.id;
        this.chatId = Objects.requireNonNull(b.chatId, "chatId");
        this.fromContact = Objects.requireNonNull(b.fromContact, "fromContact");
        this.state = Objects.requireNonNull(b.state, "state");
        this.sortTimestamp = b.sortTimestamp;
        this.sentTimestamp = b.sentTimestamp;
        this.receivedTimestamp = b.receivedTimestamp;
        this.system = b.system;
        this.hidden = b.hidden;
        this.rfc724Mid = Objects.requireNonNull(b.rfc724Mid, "rfc724Mid");
        this.serverRef = b.serverRef;
        this.wantsMdn = b.wantsMdn;
        this.text = b.text == null ? "" : b.text;
        this.handshake = b.handshake;
    }

    /**
     * Returns the id; fails for records that were never stored.
     */
    public MessageId id() {
        if (id == null) {
            throw new IllegalStateException("message has not been stored");
        }
        return id;
    }

    public boolean isStored() {
        return id != null;
    }

    public ChatId chatId() {
        return chatId;
    }

    public ContactId fromContact() {
        return fromContact;
    }

    public MessageState state() {
        return state;
    }

    public Direction direction() {
        return state.isIncoming() ? Direction.INCOMING : Direction.OUTGOING;
    }

    public long sortTimestamp() {
        return sortTimestamp;
    }

    public long sentTimestamp() {
        return sentTimestamp;
    }

    public long receivedTimestamp() {
        return receivedTimestamp;
    }

    public boolean isSystem() {
        return system;
    }

    /** Hidden messages (handshake steps) are never shown and never notify. */
    public boolean isHidden() {
        return hidden;
    }

    public String rfc724Mid() {
        return rfc724Mid;
    }

    public Optional<ServerRef> serverRef() {
        return Optional.ofNullable(serverRef);
    }

    public boolean wantsMdn() {
        return wantsMdn;
    }

    public String text() {
        return text;
    }

    public Optional<HandshakeHeaders> handshake() {
        return Optional.ofNullable(handshake);
    }

    // ---------------------------------------------------------------------
    // Copy helpers
    // ---------------------------------------------------------------------

    public MessageRecord withId(MessageId newId) {
        return toBuilder().id(newId).build();
    }

    public MessageRecord withState(MessageState newState) {
        return toBuilder().state(newState).build();
    }

    public MessageRecord withServerRef(ServerRef ref) {
        return toBuilder().serverRef(ref).build();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.id = id;
        b.chatId = chatId;
        b.fromContact = fromContact;
        b.state = state;
        b.sortTimestamp = sortTimestamp;
        b.sentTimestamp = sentTimestamp;
        b.receivedTimestamp = receivedTimestamp;
        b.system = system;
        b.hidden = hidden;
        b.rfc724Mid = rfc724Mid;
        b.serverRef = serverRef;
        b.wantsMdn = wantsMdn;
        b.text = text;
        b.handshake = handshake;
        return b;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private MessageId id;
        private ChatId chatId;
        private ContactId fromContact = ContactId.SELF;
        private MessageState state;
        private long sortTimestamp;
        private long sentTimestamp;
        private long receivedTimestamp;
        private boolean system;
        private boolean hidden;
        private String rfc724Mid;
        private ServerRef serverRef;
        private boolean wantsMdn;
        private String text = "";
        private HandshakeHeaders handshake;

        private Builder() {}

        public Builder id(MessageId id) {
            this.id = id;
            return this;
        }

        public Builder chatId(ChatId chatId) {
            this.chatId = chatId;
            return this;
        }

        public Builder fromContact(ContactId fromContact) {
            this.fromContact = fromContact;
            return this;
        }

        public Builder state(MessageState state) {
            this.state = state;
            return this;
        }

        public Builder sortTimestamp(long millis) {
            this.sortTimestamp = millis;
            return this;
        }

        public Builder sentTimestamp(long millis) {
            this.sentTimestamp = millis;
            return this;
        }

        public Builder receivedTimestamp(long millis) {
            this.receivedTimestamp = millis;
            return this;
        }

        public Builder system(boolean system) {
            this.system = system;
            return this;
        }

        public Builder hidden(boolean hidden) {
            this.hidden = hidden;
            return this;
        }

        public Builder rfc724Mid(String rfc724Mid) {
            this.rfc724Mid = rfc724Mid;
            return this;
        }

        public Builder serverRef(ServerRef serverRef) {
            this.serverRef = serverRef;
            return this;
        }

        public Builder wantsMdn(boolean wantsMdn) {
            this.wantsMdn = wantsMdn;
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder handshake(HandshakeHeaders handshake) {
            this.handshake = handshake;
            return this;
        }

        public MessageRecord build() {
            return new MessageRecord(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MessageRecord)) return false;
        MessageRecord that = (MessageRecord) o;
        return sortTimestamp == that.sortTimestamp
                && sentTimestamp == that.sentTimestamp
                && receivedTimestamp == that.receivedTimestamp
                && system == that.system
                && hidden == that.hidden
                && wantsMdn == that.wantsMdn
                && Objects.equals(id, that.id)
                && chatId.equals(that.chatId)
                && fromContact.equals(that.fromContact)
                && state == that.state
                && rfc724Mid.equals(that.rfc724Mid)
                && Objects.equals(serverRef, that.serverRef)
                && text.equals(that.text)
                && Objects.equals(handshake, that.handshake);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, chatId, state, rfc724Mid);
    }

    @Override
    public String toString() {
        return "MessageRecord{" + (id == null ? "unsaved" : id) + ", " + chatId + ", " + state
                + (hidden ? ", hidden" : "") + "}";
    }
}
