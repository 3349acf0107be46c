package com.questrail.chatmail.protocol.jobs.handlers;

import com.questrail.chatmail.protocol.jobs.Job;
import com.questrail.chatmail.protocol.jobs.JobHandler;
import com.questrail.chatmail.protocol.jobs.JobOutcome;
import com.questrail.chatmail.transport.ServerRef;
import com.questrail.chatmail.transport.TransportExecutor;

import java.util.Objects;
import java.util.Optional;

/**
 * Sets the seen flag on the server copy of a message the user has read.
 */
public final class MarkSeenOnServerHandler implements JobHandler {

    private final TransportExecutor transport;

    public MarkSeenOnServerHandler(TransportExecutor transport) {
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    @Override
    public JobOutcome execute(Job job) {
        Optional<ServerRef> ref = job.params().server();
        if (ref.isEmpty()) {
            return JobOutcome.terminal("no server copy to mark seen");
        }
        return TransportOutcomes.of(transport.markSeenOnServer(ref.get()));
    }
}
