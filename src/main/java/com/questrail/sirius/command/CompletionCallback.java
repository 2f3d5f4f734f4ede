package com.questrail.sirius.command;

/**
 * Completion hook for a single command or a fan-out batch.
 *
 * <p>Callbacks usually run on a controller worker thread. A request rejected up
 * front (nothing connected, controller stopped) is answered on the caller's
 * thread. Callbacks must not block.</p>
 */
@FunctionalInterface
public interface CompletionCallback
{
    void onComplete(boolean success);
}
