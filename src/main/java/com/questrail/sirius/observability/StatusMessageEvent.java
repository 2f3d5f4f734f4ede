package com.questrail.sirius.observability;

import java.time.Instant;

/**
 * Free-form status line meant for an operator-facing status bar.
 */
public record StatusMessageEvent(
    Instant timestamp,
    String message
) {
}
