package com.questrail.sirius.transport;

import java.util.concurrent.CompletableFuture;

/**
 * TransportHandle
 * -----------------------------------------------------------------------------
 * A live link to one peripheral, returned by {@link TransportPort#connect}.
 *
 * <p>Operations are asynchronous. Failures complete the returned future
 * exceptionally, typically with {@link LedTransportException}; implementations
 * must not throw from these methods.</p>
 *
 * <p>Handles are only ever invoked from the controller's bridge worker, so
 * implementations need not guard against two writes being started on the
 * same handle concurrently from different callers.</p>
 */
public interface TransportHandle
{
    /** Address this handle was connected to. */
    String address();

    /** Whether the underlying link still reports itself usable. */
    boolean isConnected();

    /**
     * Write one command payload.
     *
     * @param payload the complete command bytes
     */
    CompletableFuture<Void> write(byte[] payload);

    /** Close the link. Completing normally means the link is released. */
    CompletableFuture<Void> disconnect();
}
