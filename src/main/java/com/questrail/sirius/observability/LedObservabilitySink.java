package com.questrail.sirius.observability;

/**
 * Receives every notification the controller produces.
 *
 * <p>Callbacks arrive on controller worker threads (dispatcher, bridge,
 * choreography, scheduler) and on the thread of a caller that triggered a state
 * change directly. Implementations must be thread-safe and must not block.</p>
 */
public interface LedObservabilitySink {

    void onConnectionStatus(ConnectionStatusEvent event);

    void onCommandResult(CommandResultEvent event);

    void onAnimation(AnimationEvent event);

    void onStatusMessage(StatusMessageEvent event);

    void onError(LedErrorEvent event);
}
