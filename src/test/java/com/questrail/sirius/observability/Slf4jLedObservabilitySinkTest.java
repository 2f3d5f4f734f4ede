package com.questrail.sirius.observability;

import com.questrail.sirius.api.AnimationType;
import com.questrail.sirius.api.DeviceId;
import com.questrail.sirius.transport.LedTransportException;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Slf4jLedObservabilitySinkTest
 * -----------------------------------------------------------------------------
 * Every event kind is logged without throwing, including failures with and
 * without a cause.
 */
class Slf4jLedObservabilitySinkTest {

    private final Slf4jLedObservabilitySink sink = new Slf4jLedObservabilitySink();
    private final Instant now = Instant.EPOCH;

    @Test
    void logsEveryEventKind() {
        assertDoesNotThrow(() -> {
            sink.onConnectionStatus(new ConnectionStatusEvent(now, DeviceId.LEFT, true));
            sink.onCommandResult(CommandResultEvent.success(now, DeviceId.LEFT, "C:1,2,3"));
            sink.onCommandResult(CommandResultEvent.failure(now, DeviceId.RIGHT, "M:0",
                    CommandFailure.NOT_CONNECTED, "not connected"));
            sink.onCommandResult(CommandResultEvent.failure(now, DeviceId.RIGHT, "M:0",
                    CommandFailure.TIMEOUT, "no result within PT5S"));
            sink.onAnimation(new AnimationEvent(now, AnimationEvent.Phase.STARTED, AnimationType.HAZARD));
            sink.onStatusMessage(new StatusMessageEvent(now, "LEFT connected"));
            sink.onError(new LedErrorEvent(now, "write failed", new LedTransportException("boom")));
            sink.onError(new LedErrorEvent(now, "worker overran", null));
        });
    }

    @Test
    void nullSinkIgnoresEverything() {
        assertDoesNotThrow(() -> NullObservabilitySink.INSTANCE.onError(new LedErrorEvent(now, "x", null)));
    }
}
