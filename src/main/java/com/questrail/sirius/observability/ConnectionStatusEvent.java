package com.questrail.sirius.observability;

import com.questrail.sirius.api.DeviceId;

import java.time.Instant;

/**
 * A device's connected flag changed.
 */
public record ConnectionStatusEvent(
    Instant timestamp,
    DeviceId device,
    boolean connected
) {
}
