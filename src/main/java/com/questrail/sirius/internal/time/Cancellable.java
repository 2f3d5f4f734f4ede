package com.questrail.sirius.internal.time;

/**
 * Cancellation handle for deferred work: a scheduled task or a running
 * choreography session.
 */
public interface Cancellable
{
    /**
     * Request cancellation.
     *
     * @return {@code true} if this call cancelled the work; {@code false} if it
     *         had already run, finished, or been cancelled
     */
    boolean cancel();
}
