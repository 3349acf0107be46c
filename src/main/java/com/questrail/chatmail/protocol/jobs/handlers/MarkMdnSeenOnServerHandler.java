package com.questrail.chatmail.protocol.jobs.handlers;

import com.questrail.chatmail.protocol.jobs.Job;
import com.questrail.chatmail.protocol.jobs.JobHandler;
import com.questrail.chatmail.protocol.jobs.JobOutcome;
import com.questrail.chatmail.transport.ServerRef;
import com.questrail.chatmail.transport.TransportExecutor;
import com.questrail.chatmail.transport.TransportResult;

import java.util.Objects;
import java.util.Optional;

/**
 * Marks a processed read receipt seen on the server and, when asked, moves it
 * out of the inbox. A failed move retries both steps.
 */
public final class MarkMdnSeenOnServerHandler implements JobHandler {

    private final TransportExecutor transport;
    private final String movedFolder;

    public MarkMdnSeenOnServerHandler(TransportExecutor transport, String movedFolder) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.movedFolder = Objects.requireNonNull(movedFolder, "movedFolder");
    }

    @Override
    public JobOutcome execute(Job job) {
        Optional<ServerRef> ref = job.params().server();
        if (ref.isEmpty()) {
            return JobOutcome.terminal("no read receipt on server");
        }
        TransportResult seen = transport.markSeenOnServer(ref.get());
        if (!(seen instanceof TransportResult.Ok) || !job.params().alsoMove()) {
            return TransportOutcomes.of(seen);
        }
        if (ref.get().folder().equals(movedFolder)) {
            return JobOutcome.SUCCESS;
        }
        return TransportOutcomes.of(transport.move(ref.get(), movedFolder));
    }
}
