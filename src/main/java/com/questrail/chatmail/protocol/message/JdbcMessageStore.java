package com.questrail.chatmail.protocol.message;

import com.questrail.chatmail.api.ChatId;
import com.questrail.chatmail.api.ContactId;
import com.questrail.chatmail.api.MessageId;
import com.questrail.chatmail.api.MessageState;
import com.questrail.chatmail.store.ConnectionSupplier;
import com.questrail.chatmail.transport.HandshakeHeaders;
import com.questrail.chatmail.transport.HandshakeStep;
import com.questrail.chatmail.transport.ServerRef;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link MessageStore} over a SQL table named {@code msgs}.
 *
 * <p>Ids start above the reserved range so they never collide with special
 * message ids an embedder may use.</p>
 */
public final class JdbcMessageStore implements MessageStore {

    private static final String COLUMNS = "id, chat_id, from_id, state, timestamp_sort, timestamp_sent, "
            + "timestamp_rcvd, is_system, hidden, rfc724_mid, server_folder, server_uid, wants_mdn, txt, "
            + "hs_step, hs_invitenumber, hs_auth, hs_fingerprint, hs_group_id, hs_group_name, hs_group_verified";

    private final ConnectionSupplier connections;

    public JdbcMessageStore(ConnectionSupplier connections) {
        this.connections = Objects.requireNonNull(connections, "connections");
    }

    public void initialize() {
        try (Connection c = connections.open();
             Statement st = c.createStatement()) {
            st.execute("CREATE TABLE IF NOT EXISTS msgs ("
                    + "id BIGINT GENERATED BY DEFAULT AS IDENTITY (START WITH 10) PRIMARY KEY, "
                    + "chat_id BIGINT NOT NULL, "
                    + "from_id BIGINT NOT NULL, "
                    + "state INT NOT NULL, "
                    + "timestamp_sort BIGINT NOT NULL DEFAULT 0, "
                    + "timestamp_sent BIGINT NOT NULL DEFAULT 0, "
                    + "timestamp_rcvd BIGINT NOT NULL DEFAULT 0, "
                    + "is_system BOOLEAN NOT NULL DEFAULT FALSE, "
                    + "hidden BOOLEAN NOT NULL DEFAULT FALSE, "
                    + "rfc724_mid VARCHAR(255) NOT NULL, "
                    + "server_folder VARCHAR(255), "
                    + "server_uid BIGINT, "
                    + "wants_mdn BOOLEAN NOT NULL DEFAULT FALSE, "
                    + "txt CLOB, "
                    + "hs_step VARCHAR(64), "
                    + "hs_invitenumber VARCHAR(255), "
                    + "hs_auth VARCHAR(255), "
                    + "hs_fingerprint VARCHAR(255), "
                    + "hs_group_id VARCHAR(255), "
                    + "hs_group_name VARCHAR(255), "
                    + "hs_group_verified BOOLEAN NOT NULL DEFAULT FALSE)");
            st.execute("CREATE INDEX IF NOT EXISTS msgs_chat ON msgs(chat_id, timestamp_sort)");
            st.execute("CREATE INDEX IF NOT EXISTS msgs_mid ON msgs(rfc724_mid)");
        } catch (SQLException e) {
            throw new MessageStoreException("Failed to initialize msgs table", e);
        }
    }

    @Override
    public MessageRecord insert(MessageRecord message) {
        if (message.isStored()) {
            throw new IllegalArgumentException("message already has an id: " + message.id());
        }
        try (Connection c = connections.open();
             PreparedStatement ps = c.prepareStatement(
                     "INSERT INTO msgs(chat_id, from_id, state, timestamp_sort, timestamp_sent, timestamp_rcvd, "
                             + "is_system, hidden, rfc724_mid, server_folder, server_uid, wants_mdn, txt, "
                             + "hs_step, hs_invitenumber, hs_auth, hs_fingerprint, hs_group_id, hs_group_name, "
                             + "hs_group_verified) VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)",
                     Statement.RETURN_GENERATED_KEYS)) {
            bind(ps, message);
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("no generated key for message insert");
                }
                return message.withId(MessageId.of(keys.getLong(1)));
            }
        } catch (SQLException e) {
            throw new MessageStoreException("Failed to insert message into " + message.chatId(), e);
        }
    }

    @Override
    public boolean update(MessageRecord message) {
        try (Connection c = connections.open();
             PreparedStatement ps = c.prepareStatement(
                     "UPDATE msgs SET chat_id = ?, from_id = ?, state = ?, timestamp_sort = ?, timestamp_sent = ?, "
                             + "timestamp_rcvd = ?, is_system = ?, hidden = ?, rfc724_mid = ?, server_folder = ?, "
                             + "server_uid = ?, wants_mdn = ?, txt = ?, hs_step = ?, hs_invitenumber = ?, "
                             + "hs_auth = ?, hs_fingerprint = ?, hs_group_id = ?, hs_group_name = ?, "
                             + "hs_group_verified = ? WHERE id = ?")) {
            bind(ps, message);
            ps.setLong(21, message.id().value());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new MessageStoreException("Failed to update " + message.id(), e);
        }
    }

    private static void bind(PreparedStatement ps, MessageRecord m) throws SQLException {
        ps.setLong(1, m.chatId().value());
        ps.setLong(2, m.fromContact().value());
        ps.setInt(3, m.state().code());
        ps.setLong(4, m.sortTimestamp());
        ps.setLong(5, m.sentTimestamp());
        ps.setLong(6, m.receivedTimestamp());
        ps.setBoolean(7, m.isSystem());
        ps.setBoolean(8, m.isHidden());
        ps.setString(9, m.rfc724Mid());
        Optional<ServerRef> ref = m.serverRef();
        if (ref.isPresent()) {
            ps.setString(10, ref.get().folder());
            ps.setLong(11, ref.get().uid());
        } else {
            ps.setNull(10, Types.VARCHAR);
            ps.setNull(11, Types.BIGINT);
        }
        ps.setBoolean(12, m.wantsMdn());
        ps.setString(13, m.text());
        HandshakeHeaders hs = m.handshake().orElse(null);
        ps.setString(14, hs == null ? null : hs.step().headerValue());
        ps.setString(15, hs == null ? null : hs.inviteNumber());
        ps.setString(16, hs == null ? null : hs.auth());
        ps.setString(17, hs == null ? null : hs.fingerprint());
        ps.setString(18, hs == null ? null : hs.groupId());
        ps.setString(19, hs == null ? null : hs.groupName());
        ps.setBoolean(20, hs != null && hs.groupVerified());
    }

    @Override
    public Optional<MessageRecord> find(MessageId id) {
        List<MessageRecord> found = query("SELECT " + COLUMNS + " FROM msgs WHERE id = ?", ps -> ps.setLong(1, id.value()));
        return found.stream().findFirst();
    }

    @Override
    public Optional<MessageRecord> findByRfc724Mid(String rfc724Mid) {
        List<MessageRecord> found = query("SELECT " + COLUMNS + " FROM msgs WHERE rfc724_mid = ? ORDER BY id",
                ps -> ps.setString(1, rfc724Mid));
        return found.stream().findFirst();
    }

    @Override
    public boolean delete(MessageId id) {
        try (Connection c = connections.open();
             PreparedStatement ps = c.prepareStatement("DELETE FROM msgs WHERE id = ?")) {
            ps.setLong(1, id.value());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new MessageStoreException("Failed to delete " + id, e);
        }
    }

    @Override
    public List<MessageRecord> listByChat(ChatId chatId) {
        return query("SELECT " + COLUMNS + " FROM msgs WHERE chat_id = ? ORDER BY timestamp_sort, id",
                ps -> ps.setLong(1, chatId.value()));
    }

    @Override
    public List<MessageRecord> listFromContact(ContactId contact) {
        return query("SELECT " + COLUMNS + " FROM msgs WHERE from_id = ? ORDER BY timestamp_sort, id",
                ps -> ps.setLong(1, contact.value()));
    }

    @Override
    public List<MessageRecord> listHidden() {
        return query("SELECT " + COLUMNS + " FROM msgs WHERE hidden = TRUE ORDER BY timestamp_sort, id",
                ps -> { });
    }

    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    private List<MessageRecord> query(String sql, Binder binder) {
        try (Connection c = connections.open();
             PreparedStatement ps = c.prepareStatement(sql)) {
            binder.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                List<MessageRecord> result = new ArrayList<>();
                while (rs.next()) {
                    result.add(read(rs));
                }
                return result;
            }
        } catch (SQLException e) {
            throw new MessageStoreException("Failed to query messages", e);
        }
    }

    private static MessageRecord read(ResultSet rs) throws SQLException {
        int code = rs.getInt("state");
        MessageState state = MessageState.fromCode(code)
                .orElseThrow(() -> new SQLException("unknown message state " + code));
        MessageRecord.Builder b = MessageRecord.builder()
                .id(MessageId.of(rs.getLong("id")))
                .chatId(ChatId.of(rs.getLong("chat_id")))
                .fromContact(ContactId.of(rs.getLong("from_id")))
                .state(state)
                .sortTimestamp(rs.getLong("timestamp_sort"))
                .sentTimestamp(rs.getLong("timestamp_sent"))
                .receivedTimestamp(rs.getLong("timestamp_rcvd"))
                .system(rs.getBoolean("is_system"))
                .hidden(rs.getBoolean("hidden"))
                .rfc724Mid(rs.getString("rfc724_mid"))
                .wantsMdn(rs.getBoolean("wants_mdn"))
                .text(rs.getString("txt"));

        String folder = rs.getString("server_folder");
        long uid = rs.getLong("server_uid");
        if (folder != null && !rs.wasNull()) {
            b.serverRef(new ServerRef(folder, uid));
        }

        String step = rs.getString("hs_step");
        if (step != null) {
            HandshakeStep parsed = HandshakeStep.fromHeader(step)
                    .orElseThrow(() -> new SQLException("unknown handshake step " + step));
            b.handshake(new HandshakeHeaders(parsed,
                    rs.getString("hs_invitenumber"),
                    rs.getString("hs_auth"),
                    rs.getString("hs_fingerprint"),
                    rs.getString("hs_group_id"),
                    rs.getString("hs_group_name"),
                    rs.getBoolean("hs_group_verified")));
        }
        return b.build();
    }
}
