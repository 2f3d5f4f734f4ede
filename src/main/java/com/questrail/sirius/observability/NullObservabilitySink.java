package com.questrail.sirius.observability;

/**
 * No-op implementation of LedObservabilitySink.
 */
public final class NullObservabilitySink implements LedObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onConnectionStatus(ConnectionStatusEvent event) {}

    @Override
    public void onCommandResult(CommandResultEvent event) {}

    @Override
    public void onAnimation(AnimationEvent event) {}

    @Override
    public void onStatusMessage(StatusMessageEvent event) {}

    @Override
    public void onError(LedErrorEvent event) {}
}
