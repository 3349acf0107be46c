package com.questrail.chatmail.observability;

/**
 * No-op implementation of ChatObservabilitySink.
 */
public final class NullObservabilitySink implements ChatObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onMessageTransition(MessageTransitionEvent event) {}

    @Override
    public void onSecureJoinTransition(SecureJoinTransitionEvent event) {}

    @Override
    public void onJobEvent(JobObservabilityEvent event) {}

    @Override
    public void onTransportEvent(TransportObservabilityEvent event) {}

    @Override
    public void onError(ChatErrorEvent event) {}
}
