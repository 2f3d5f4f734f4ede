package com.questrail.sirius.observability;

import java.time.Instant;

/**
 * An error or anomaly inside the controller. {@code cause} may be null.
 */
public record LedErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
