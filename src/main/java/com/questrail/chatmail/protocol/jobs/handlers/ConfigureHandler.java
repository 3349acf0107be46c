package com.questrail.chatmail.protocol.jobs.handlers;

import com.questrail.chatmail.api.OngoingProcessException;
import com.questrail.chatmail.events.ChatEvent;
import com.questrail.chatmail.events.EventChannel;
import com.questrail.chatmail.events.EventKind;
import com.questrail.chatmail.protocol.jobs.Job;
import com.questrail.chatmail.protocol.jobs.JobHandler;
import com.questrail.chatmail.protocol.jobs.JobOutcome;
import com.questrail.chatmail.protocol.ongoing.OngoingProcess;
import com.questrail.chatmail.transport.TransportExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Runs account configuration with every other transport suspended.
 *
 * <p>Configuration is attempted once per request. Progress is reported as
 * permille: 1000 on success, 0 on failure.</p>
 *
 * <p>Configuring holds the {@link OngoingProcess} slot, so it fails while a
 * secure-join runs and a stop request turns it into a failure.</p>
 */
public final class ConfigureHandler implements JobHandler {
    private static final Logger log = LoggerFactory.getLogger(ConfigureHandler.class);

    private final TransportExecutor transport;
    private final EventChannel events;
    private final OngoingProcess ongoing;

    public ConfigureHandler(TransportExecutor transport, EventChannel events, OngoingProcess ongoing) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.events = Objects.requireNonNull(events, "events");
        this.ongoing = Objects.requireNonNull(ongoing, "ongoing");
    }

    @Override
    public JobOutcome execute(Job job) {
        OngoingProcess.Token token;
        try {
            token = ongoing.start("configure");
        } catch (OngoingProcessException e) {
            return JobOutcome.terminal(e.getMessage());
        }
        try (token) {
            log.info("Configuring account");
            JobOutcome outcome = TransportOutcomes.of(transport.configure());
            if (token.isCancelled()) {
                return JobOutcome.terminal("configuration cancelled");
            }
            return outcome;
        }
    }

    @Override
    public void onSuccess(Job job) {
        log.info("Account configured");
        events.emit(EventKind.CONFIGURE_PROGRESS, 1000, 0);
    }

    @Override
    public boolean onTerminalFailure(Job job, String reason) {
        events.emit(ChatEvent.withText(EventKind.ERROR, 0, "Cannot configure account: " + reason));
        events.emit(EventKind.CONFIGURE_PROGRESS, 0, 0);
        return true;
    }

    @Override
    public boolean isExclusive() {
        return true;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
