package com.questrail.chatmail.protocol.message;

import com.questrail.chatmail.events.EventChannel;
import com.questrail.chatmail.events.EventKind;
import com.questrail.chatmail.protocol.jobs.JobAction;
import com.questrail.chatmail.protocol.jobs.JobParams;
import com.questrail.chatmail.protocol.jobs.JobQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Turns message intents into embedder events and jobs.
 *
 * <p>Hidden messages never produce embedder events.</p>
 */
public final class DefaultMessageIntentExecutor implements MessageIntentExecutor {
    private static final Logger log = LoggerFactory.getLogger(DefaultMessageIntentExecutor.class);

    private final JobQueue jobs;
    private final EventChannel events;

    public DefaultMessageIntentExecutor(JobQueue jobs, EventChannel events) {
        this.jobs = Objects.requireNonNull(jobs, "jobs");
        this.events = Objects.requireNonNull(events, "events");
    }

    @Override
    public void execute(MessageRecord message, MessageIntents intents) {
        if (intents.isEmpty()) {
            return;
        }
        long chat = message.chatId().value();
        long msg = message.id().value();

        for (MessageIntents.Kind kind : intents.kinds()) {
            switch (kind) {
                case NOTIFY_CHANGED:
                    notify(message, EventKind.MSGS_CHANGED, chat, msg);
                    break;
                case NOTIFY_DELIVERED:
                    notify(message, EventKind.MSG_DELIVERED, chat, msg);
                    break;
                case NOTIFY_FAILED:
                    notify(message, EventKind.MSG_FAILED, chat, msg);
                    break;
                case NOTIFY_READ:
                    notify(message, EventKind.MSG_READ, chat, msg);
                    break;
                case MARK_SEEN_ON_SERVER:
                    message.serverRef().ifPresentOrElse(
                            ref -> jobs.enqueue(JobAction.MARK_SEEN_ON_SERVER,
                                    JobParams.forServerCopy(message.id(), ref)),
                            () -> log.debug("{} has no server copy to mark seen", message.id()));
                    break;
                case SEND_READ_RECEIPT:
                    jobs.enqueue(JobAction.SEND_MDN, JobParams.forMessage(message.id()));
                    break;
                case SCHEDULE_SEND:
                    jobs.enqueue(JobAction.SEND_MESSAGE, JobParams.forMessage(message.id()));
                    break;
                case EXPEDITE_SEND:
                    jobs.expedite(JobAction.SEND_MESSAGE, message.id());
                    break;
                default:
                    throw new IllegalStateException("Unhandled intent " + kind);
            }
        }
    }

    private void notify(MessageRecord message, EventKind kind, long chat, long msg) {
        if (!message.isHidden()) {
            events.emit(kind, chat, msg);
        }
    }
}
