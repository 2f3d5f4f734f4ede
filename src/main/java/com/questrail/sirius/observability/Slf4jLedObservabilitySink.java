package com.questrail.sirius.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of LedObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jLedObservabilitySink implements LedObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jLedObservabilitySink.class);

    @Override
    public void onConnectionStatus(ConnectionStatusEvent event) {
        log.info("{}: {}", event.device(), event.connected() ? "connected" : "disconnected");
    }

    @Override
    public void onCommandResult(CommandResultEvent event) {
        if (event.succeeded()) {
            log.debug("{} <- {}", event.device(), event.wireLine());
            return;
        }
        CommandFailure failure = event.failure().get();
        if (failure == CommandFailure.NOT_CONNECTED) {
            log.warn("{}: skipped {} ({})", event.device(), event.wireLine(), event.message());
        } else {
            log.error("{}: {} failed [{}]: {}", event.device(), event.wireLine(), failure, event.message());
        }
    }

    @Override
    public void onAnimation(AnimationEvent event) {
        log.info("Animation {}: {}", event.phase(), event.type().wireName());
    }

    @Override
    public void onStatusMessage(StatusMessageEvent event) {
        log.info("Status: {}", event.message());
    }

    @Override
    public void onError(LedErrorEvent event) {
        log.error("Controller error: {}", event.message(), event.cause());
    }
}
