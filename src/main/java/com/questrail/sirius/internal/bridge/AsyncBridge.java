package com.questrail.sirius.internal.bridge;

import com.questrail.sirius.internal.time.SystemWallClock;
import com.questrail.sirius.observability.LedErrorEvent;
import com.questrail.sirius.observability.LedObservabilitySink;
import com.questrail.sirius.observability.NullObservabilitySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * AsyncBridge
 * =============================================================================
 * The single execution context in which transport operations run.
 *
 * <h2>Purpose</h2>
 * Callers on any thread (UI actions, the dispatcher, choreography workers, an
 * ambient colour producer) hand transport work to the bridge and receive a
 * {@link CompletableFuture}. Only the bridge worker ever touches the
 * {@code TransportPort} or a {@code TransportHandle}.
 *
 * <h2>Threading Model</h2>
 * <ul>
 *   <li>{@link #execute} only enqueues; it never blocks the caller.</li>
 *   <li>The worker runs one unit at a time and waits for the unit's stage
 *       (bounded by {@code unitTimeout}) before taking the next.</li>
 *   <li>Overlap happens only inside a unit that starts several transport calls
 *       before waiting on them together (fan-out).</li>
 *   <li>Result futures are completed on the worker thread, so dependent
 *       callbacks run there too.</li>
 * </ul>
 *
 * <h2>Failure containment</h2>
 * A unit that throws, or whose stage completes exceptionally or times out,
 * fails its own future. The worker loop survives every unit failure.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   bridge.start()     → starts the worker thread (idempotent)
 *   bridge.execute(u)  → enqueues u
 *   bridge.stop()      → rejects new units, runs those already queued for at
 *                        most joinTimeout, then cancels whatever is left
 * </pre>
 */
public final class AsyncBridge {

    private static final Logger log = LoggerFactory.getLogger(AsyncBridge.class);
    private static final long POLL_MILLIS = 100;

    private final Duration unitTimeout;
    private final Duration joinTimeout;
    private final LedObservabilitySink observabilitySink;

    private final BlockingQueue<PendingUnit<?>> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private volatile Thread worker;

    public AsyncBridge(Duration unitTimeout, Duration joinTimeout, LedObservabilitySink observabilitySink) {
        this.unitTimeout = Objects.requireNonNull(unitTimeout, "unitTimeout");
        this.joinTimeout = Objects.requireNonNull(joinTimeout, "joinTimeout");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    /**
     * Starts the worker thread. Idempotent; a stopped bridge cannot be restarted.
     */
    public void start() {
        if (stopped.get()) {
            throw new IllegalStateException("AsyncBridge has been stopped");
        }
        if (running.compareAndSet(false, true)) {
            Thread t = new Thread(this::runLoop, "sirius-async-bridge");
            t.setDaemon(true);
            worker = t;
            t.start();
        }
    }

    /**
     * Enqueues a unit of work.
     *
     * @return a future completed with the unit's result or failure; already
     *         failed with {@link IllegalStateException} if the bridge is stopped
     */
    public <T> CompletableFuture<T> execute(UnitOfWork<T> unit) {
        Objects.requireNonNull(unit, "unit");
        CompletableFuture<T> handle = new CompletableFuture<>();
        if (stopped.get()) {
            handle.completeExceptionally(new IllegalStateException("AsyncBridge has been stopped"));
            return handle;
        }
        queue.offer(new PendingUnit<>(unit, handle));
        return handle;
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Stops accepting units and lets the worker drain the queue. Waits at most
     * {@code joinTimeout}; units still queued after that are cancelled.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        running.set(false);

        Thread t = worker;
        if (t != null) {
            try {
                t.join(joinTimeout.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (t.isAlive()) {
                log.warn("Bridge worker still busy after {}; abandoning in-flight unit", joinTimeout);
                t.interrupt();
            }
        }

        List<PendingUnit<?>> abandoned = new ArrayList<>();
        queue.drainTo(abandoned);
        for (PendingUnit<?> pending : abandoned) {
            pending.handle.completeExceptionally(new CancellationException("AsyncBridge stopped"));
        }
        if (!abandoned.isEmpty()) {
            log.debug("Cancelled {} queued unit(s) on stop", abandoned.size());
        }
    }

    private void runLoop() {
        while (running.get() || !queue.isEmpty()) {
            PendingUnit<?> pending;
            try {
                pending = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                if (running.get()) {
                    continue;
                }
                break;
            }
            if (pending == null) {
                continue;
            }
            try {
                runUnit(pending);
            } catch (RuntimeException e) {
                // runUnit completes the handle itself; anything here is a defect in the loop
                pending.handle.completeExceptionally(e);
                observabilitySink.onError(new LedErrorEvent(SystemWallClock.INSTANCE.now(),
                        "Bridge unit failed unexpectedly", e));
            }
        }
    }

    private <T> void runUnit(PendingUnit<T> pending) {
        CompletableFuture<T> stage;
        try {
            stage = pending.unit.begin().toCompletableFuture();
        } catch (Exception e) {
            pending.handle.completeExceptionally(e);
            return;
        }

        try {
            T result = stage.get(unitTimeout.toMillis(), TimeUnit.MILLISECONDS);
            pending.handle.complete(result);
        } catch (ExecutionException e) {
            pending.handle.completeExceptionally(e.getCause() != null ? e.getCause() : e);
        } catch (TimeoutException e) {
            pending.handle.completeExceptionally(e);
            observabilitySink.onError(new LedErrorEvent(SystemWallClock.INSTANCE.now(),
                    "Bridge unit exceeded " + unitTimeout, e));
        } catch (CancellationException e) {
            pending.handle.completeExceptionally(e);
        } catch (InterruptedException e) {
            pending.handle.completeExceptionally(new CancellationException("AsyncBridge interrupted"));
            Thread.currentThread().interrupt();
        }
    }

    private static final class PendingUnit<T> {
        private final UnitOfWork<T> unit;
        private final CompletableFuture<T> handle;

        private PendingUnit(UnitOfWork<T> unit, CompletableFuture<T> handle) {
            this.unit = unit;
            this.handle = handle;
        }
    }
}
