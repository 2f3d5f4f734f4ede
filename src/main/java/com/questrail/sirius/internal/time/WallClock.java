package com.questrail.sirius.internal.time;

import java.time.Instant;

/**
 * Wall-clock source for notification timestamps only.
 *
 * <p>May jump (NTP, manual adjustment). Never used for pacing or timeouts.</p>
 */
public interface WallClock
{
    Instant now();
}
