package com.questrail.chatmail.observability;

/**
 * Main interface for receiving chat core observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface ChatObservabilitySink {
    /**
     * Called after the message state machine applied an event to a message.
     * @param event the transition event details
     */
    void onMessageTransition(MessageTransitionEvent event);

    /**
     * Called after a secure-join session applied a handshake event.
     * @param event the transition event details
     */
    void onSecureJoinTransition(SecureJoinTransitionEvent event);

    /**
     * Called when a job is enqueued, finishes, is rescheduled, deferred or dropped.
     * @param event the job event
     */
    void onJobEvent(JobObservabilityEvent event);

    /**
     * Called when a transport thread wakes, fetches, or hits a network problem.
     * @param event the transport event
     */
    void onTransportEvent(TransportObservabilityEvent event);

    /**
     * Called when an error or anomaly occurs in the core.
     * @param event the error event
     */
    void onError(ChatErrorEvent event);
}
