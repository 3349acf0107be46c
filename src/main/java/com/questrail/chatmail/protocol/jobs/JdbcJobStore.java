package com.questrail.chatmail.protocol.jobs;

import com.questrail.chatmail.api.MessageId;
import com.questrail.chatmail.api.Transport;
import com.questrail.chatmail.store.ConnectionSupplier;
import com.questrail.chatmail.transport.ServerRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

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
import java.util.OptionalLong;

/**
 * JdbcJobStore
 * =============================================================================
 * {@link JobStore} over a SQL table named {@code jobs}.
 *
 * <p>Claiming selects candidate rows and then flips each row's
 * {@code claimed} flag with a conditional {@code UPDATE ... WHERE claimed = FALSE}.
 * Only rows whose update count is 1 are returned, so two connections claiming
 * at the same time can never both win the same row.</p>
 *
 * <p>{@link #initialize()} creates the table if needed and clears claims left
 * over from a previous process.</p>
 */
public final class JdbcJobStore implements JobStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcJobStore.class);

    private static final String COLUMNS =
            "id, action, msg_id, server_folder, server_uid, also_move, tries, added_at, not_before";

    private final ConnectionSupplier connections;

    public JdbcJobStore(ConnectionSupplier connections) {
        this.connections = Objects.requireNonNull(connections, "connections");
    }

    public void initialize() {
        try (Connection c = connections.open();
             Statement st = c.createStatement()) {
            st.execute("CREATE TABLE IF NOT EXISTS jobs ("
                    + "id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, "
                    + "transport VARCHAR(32) NOT NULL, "
                    + "action VARCHAR(32) NOT NULL, "
                    + "msg_id BIGINT, "
                    + "server_folder VARCHAR(255), "
                    + "server_uid BIGINT, "
                    + "also_move BOOLEAN NOT NULL DEFAULT FALSE, "
                    + "tries INT NOT NULL DEFAULT 0, "
                    + "added_at BIGINT NOT NULL, "
                    + "not_before BIGINT NOT NULL, "
                    + "claimed BOOLEAN NOT NULL DEFAULT FALSE)");
            st.execute("CREATE INDEX IF NOT EXISTS jobs_transport_due ON jobs(transport, not_before)");
            int stale = st.executeUpdate("UPDATE jobs SET claimed = FALSE WHERE claimed = TRUE");
            if (stale > 0) {
                log.info("Released {} job claims left by a previous run", stale);
            }
        } catch (SQLException e) {
            throw new JobStoreException("Failed to initialize jobs table", e);
        }
    }

    @Override
    public Job enqueue(NewJob job, long nowMillis) {
        Objects.requireNonNull(job, "job");
        long notBefore = nowMillis + job.delay().toMillis();
        try (Connection c = connections.open()) {
            long id = insert(c, job.action(), job.params(), 0, nowMillis, notBefore);
            return new Job(id, job.action(), job.params(), 0, nowMillis, notBefore);
        } catch (SQLException e) {
            throw new JobStoreException("Failed to enqueue " + job.action(), e);
        }
    }

    private long insert(Connection c, JobAction action, JobParams params,
                        int tries, long addedAt, long notBefore) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO jobs(transport, action, msg_id, server_folder, server_uid, also_move, tries, added_at, not_before) "
                        + "VALUES(?,?,?,?,?,?,?,?,?)",
                Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, action.transport().name());
            ps.setString(2, action.name());
            if (params.messageId() != null) {
                ps.setLong(3, params.messageId().value());
            } else {
                ps.setNull(3, Types.BIGINT);
            }
            if (params.serverRef() != null) {
                ps.setString(4, params.serverRef().folder());
                ps.setLong(5, params.serverRef().uid());
            } else {
                ps.setNull(4, Types.VARCHAR);
                ps.setNull(5, Types.BIGINT);
            }
            ps.setBoolean(6, params.alsoMove());
            ps.setInt(7, tries);
            ps.setLong(8, addedAt);
            ps.setLong(9, notBefore);
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("no generated key for job insert");
                }
                return keys.getLong(1);
            }
        }
    }

    @Override
    public List<Job> claimDue(Transport transport, long nowMillis) {
        String sql = "SELECT " + COLUMNS + " FROM jobs WHERE transport = ? AND claimed = FALSE "
                + "AND not_before <= ? ORDER BY added_at, id";
        return claim(sql, transport, nowMillis);
    }

    @Override
    public List<Job> claimRetrying(Transport transport) {
        String sql = "SELECT " + COLUMNS + " FROM jobs WHERE transport = ? AND claimed = FALSE "
                + "AND tries > 0 ORDER BY not_before, id";
        return claim(sql, transport, null);
    }

    private List<Job> claim(String selectSql, Transport transport, Long nowMillis) {
        try (Connection c = connections.open()) {
            List<Job> candidates = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(selectSql)) {
                ps.setString(1, transport.name());
                if (nowMillis != null) {
                    ps.setLong(2, nowMillis);
                }
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        candidates.add(read(rs));
                    }
                }
            }
            List<Job> claimedJobs = new ArrayList<>(candidates.size());
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE jobs SET claimed = TRUE WHERE id = ? AND claimed = FALSE")) {
                for (Job j : candidates) {
                    ps.setLong(1, j.id());
                    if (ps.executeUpdate() == 1) {
                        claimedJobs.add(j);
                    }
                }
            }
            return claimedJobs;
        } catch (SQLException e) {
            throw new JobStoreException("Failed to claim jobs for " + transport, e);
        }
    }

    @Override
    public Job reschedule(Job job, int tries, long notBefore) {
        try (Connection c = connections.open()) {
            c.setAutoCommit(false);
            try {
                deleteRow(c, job.id());
                long id = insert(c, job.action(), job.params(), tries, job.addedAt(), notBefore);
                c.commit();
                return new Job(id, job.action(), job.params(), tries, job.addedAt(), notBefore);
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new JobStoreException("Failed to reschedule job " + job.id(), e);
        }
    }

    @Override
    public int makeDue(JobAction action, MessageId messageId, long nowMillis) {
        try (Connection c = connections.open();
             PreparedStatement ps = c.prepareStatement(
                     "UPDATE jobs SET not_before = ? WHERE action = ? AND msg_id = ? "
                             + "AND claimed = FALSE AND not_before > ?")) {
            ps.setLong(1, nowMillis);
            ps.setString(2, action.name());
            ps.setLong(3, messageId.value());
            ps.setLong(4, nowMillis);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new JobStoreException("Failed to expedite " + action + " for " + messageId, e);
        }
    }

    @Override
    public void release(Job job) {
        executeUpdate("UPDATE jobs SET claimed = FALSE WHERE id = ?", job.id());
    }

    @Override
    public boolean delete(Job job) {
        try (Connection c = connections.open()) {
            return deleteRow(c, job.id()) > 0;
        } catch (SQLException e) {
            throw new JobStoreException("Failed to delete job " + job.id(), e);
        }
    }

    private int deleteRow(Connection c, long id) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("DELETE FROM jobs WHERE id = ?")) {
            ps.setLong(1, id);
            return ps.executeUpdate();
        }
    }

    @Override
    public int deleteByAction(JobAction action) {
        try (Connection c = connections.open();
             PreparedStatement ps = c.prepareStatement("DELETE FROM jobs WHERE action = ?")) {
            ps.setString(1, action.name());
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new JobStoreException("Failed to delete " + action + " jobs", e);
        }
    }

    @Override
    public boolean exists(JobAction action) {
        try (Connection c = connections.open();
             PreparedStatement ps = c.prepareStatement("SELECT 1 FROM jobs WHERE action = ? LIMIT 1")) {
            ps.setString(1, action.name());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new JobStoreException("Failed to query " + action + " jobs", e);
        }
    }

    @Override
    public OptionalLong nextNotBefore(Transport transport) {
        try (Connection c = connections.open();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT MIN(not_before) FROM jobs WHERE transport = ? AND claimed = FALSE")) {
            ps.setString(1, transport.name());
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    long v = rs.getLong(1);
                    if (!rs.wasNull()) {
                        return OptionalLong.of(v);
                    }
                }
                return OptionalLong.empty();
            }
        } catch (SQLException e) {
            throw new JobStoreException("Failed to query next job time for " + transport, e);
        }
    }

    @Override
    public Optional<Job> find(long id) {
        try (Connection c = connections.open();
             PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + " FROM jobs WHERE id = ?")) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(read(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new JobStoreException("Failed to load job " + id, e);
        }
    }

    @Override
    public int count(Transport transport) {
        try (Connection c = connections.open();
             PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM jobs WHERE transport = ?")) {
            ps.setString(1, transport.name());
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return rs.getInt(1);
            }
        } catch (SQLException e) {
            throw new JobStoreException("Failed to count jobs for " + transport, e);
        }
    }

    private void executeUpdate(String sql, long id) {
        try (Connection c = connections.open();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, id);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new JobStoreException("Failed to update job " + id, e);
        }
    }

    private static Job read(ResultSet rs) throws SQLException {
        long id = rs.getLong("id");
        JobAction action = JobAction.valueOf(rs.getString("action"));
        long msgId = rs.getLong("msg_id");
        MessageId messageId = rs.wasNull() ? null : MessageId.of(msgId);
        String folder = rs.getString("server_folder");
        long uid = rs.getLong("server_uid");
        ServerRef ref = (folder == null || rs.wasNull()) ? null : new ServerRef(folder, uid);
        JobParams params = new JobParams(messageId, ref, rs.getBoolean("also_move"));
        return new Job(id, action, params, rs.getInt("tries"),
                rs.getLong("added_at"), rs.getLong("not_before"));
    }
}
