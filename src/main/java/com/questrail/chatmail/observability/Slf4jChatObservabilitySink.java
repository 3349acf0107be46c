package com.questrail.chatmail.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of ChatObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jChatObservabilitySink implements ChatObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jChatObservabilitySink.class);

    @Override
    public void onMessageTransition(MessageTransitionEvent event) {
        if (event.isStateChange()) {
            log.info("{} in {}: {} -> {} ({})",
                event.newMessage().id(),
                event.newMessage().chatId(),
                event.oldMessage().state(),
                event.newMessage().state(),
                event.triggeringEvent().getClass().getSimpleName());
        } else {
            log.debug("{}: {} ignored in state {}",
                event.oldMessage().id(),
                event.triggeringEvent().getClass().getSimpleName(),
                event.oldMessage().state());
        }
    }

    @Override
    public void onSecureJoinTransition(SecureJoinTransitionEvent event) {
        if (event.isStepChange()) {
            log.info("Secure-join with {} ({}): {} -> {}",
                event.peer(),
                event.newSession().role(),
                event.oldSession().step(),
                event.newSession().step());
        } else {
            log.debug("Secure-join with {}: {} left step {} unchanged",
                event.peer(),
                event.triggeringEvent().getClass().getSimpleName(),
                event.oldSession().step());
        }
    }

    @Override
    public void onJobEvent(JobObservabilityEvent event) {
        switch (event.kind()) {
            case FAILED:
            case DROPPED:
                log.warn("Job {} {} {}: {}", event.job().id(), event.job().action(), event.kind(), event.detail());
                break;
            case RESCHEDULED:
                log.info("Job {} {} {}: {}", event.job().id(), event.job().action(), event.kind(), event.detail());
                break;
            default:
                log.debug("Job {} {} {}", event.job().id(), event.job().action(), event.kind());
        }
    }

    @Override
    public void onTransportEvent(TransportObservabilityEvent event) {
        if (event.kind() == TransportObservabilityEvent.Kind.NETWORK_ERROR) {
            log.warn("{} network error: {}", event.transport(), event.detail());
        } else {
            log.debug("{} {}: {}", event.transport(), event.kind(), event.detail());
        }
    }

    @Override
    public void onError(ChatErrorEvent event) {
        log.error("Chat core error: {}", event.message(), event.cause());
    }
}
