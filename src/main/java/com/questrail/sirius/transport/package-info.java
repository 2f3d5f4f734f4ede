/**
 * Sirius Transport Ports
 * =============================================================================
 *
 * <p>These interfaces are the boundary between the command core and a concrete
 * link driver (Netty UDP, a BLE stack, a simulator, or a test double).</p>
 *
 * <h2>What crosses the boundary</h2>
 * <ul>
 *   <li>Command payloads as {@code byte[]}, one command per write</li>
 *   <li>Addresses as opaque strings</li>
 *   <li>Completion and failure as {@link java.util.concurrent.CompletableFuture}s</li>
 * </ul>
 *
 * <h2>Constraints on implementations</h2>
 * <ul>
 *   <li>Link I/O only; no command interpretation</li>
 *   <li>No pacing, queueing, timeouts or retries (those live in the dispatcher)</li>
 *   <li>Driver types must not escape the implementation package</li>
 * </ul>
 */
package com.questrail.sirius.transport;
