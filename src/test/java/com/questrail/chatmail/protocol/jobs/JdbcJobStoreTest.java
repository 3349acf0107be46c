package com.questrail.chatmail.protocol.jobs;

import com.questrail.chatmail.api.MessageId;
import com.questrail.chatmail.api.Transport;
import com.questrail.chatmail.store.ConnectionSupplier;
import org.junit.jupiter.api.Test;

import java.sql.DriverManager;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JdbcJobStoreTest
 * -----------------------------------------------------------------------------
 * Runs the store contract against an in-memory H2 database, plus the
 * restart behaviour only a durable store has.
 */
class JdbcJobStoreTest extends AbstractJobStoreContractTest {

    private ConnectionSupplier connections;

    @Override
    protected JobStore newStore() {
        String url = "jdbc:h2:mem:jobs-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";
        connections = () -> DriverManager.getConnection(url);
        JdbcJobStore jdbc = new JdbcJobStore(connections);
        jdbc.initialize();
        return jdbc;
    }

    @Test
    void jobsSurviveReopeningAndClaimsAreReleased() {
        Job job = store.enqueue(NewJob.of(JobAction.SEND_MESSAGE, JobParams.forMessage(MessageId.of(3))), T0);
        assertEquals(1, store.claimDue(Transport.OUTBOUND, T0).size());

        JdbcJobStore reopened = new JdbcJobStore(connections);
        reopened.initialize();

        assertEquals(1, reopened.count(Transport.OUTBOUND));
        Job again = reopened.claimDue(Transport.OUTBOUND, T0).get(0);
        assertEquals(job.id(), again.id());
        assertEquals(MessageId.of(3), again.params().messageId());
    }
}
