package com.questrail.sirius.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for pacing, timeouts and command stamps.
 *
 * <p>Wall-clock time ({@code Instant.now()}) appears only in notification
 * records. Anything that measures elapsed time uses this clock.</p>
 */
public interface MonotonicClock
{
    /**
     * Monotonically non-decreasing tick in nanoseconds. Only differences are
     * meaningful.
     */
    long nowNanos();
}
