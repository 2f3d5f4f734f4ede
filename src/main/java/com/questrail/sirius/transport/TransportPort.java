package com.questrail.sirius.transport;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * TransportPort
 * -----------------------------------------------------------------------------
 * Port to the wireless link driver.
 *
 * <p>The controller never calls a port from more than one thread: all calls are
 * made from inside units of work running on the bridge worker. Implementations
 * are free to complete the returned futures on their own I/O threads.</p>
 *
 * <p>Implementations perform link I/O only. They must not interpret command
 * payloads, pace writes, or retry.</p>
 */
public interface TransportPort
{
    /**
     * Scan for advertising peripherals.
     *
     * @param timeout how long to listen for advertisements
     */
    CompletableFuture<List<DiscoveredDevice>> discover(Duration timeout);

    /**
     * Open a link to the peripheral at {@code address}.
     *
     * @param address an address previously reported by {@link #discover}
     * @param timeout upper bound on connection establishment
     */
    CompletableFuture<TransportHandle> connect(String address, Duration timeout);

    /**
     * Release any resources shared across handles. Default: nothing to release.
     */
    default void close() {
    }
}
