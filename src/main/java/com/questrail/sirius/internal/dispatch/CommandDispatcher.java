package com.questrail.sirius.internal.dispatch;

import com.questrail.sirius.api.DeviceId;
import com.questrail.sirius.command.CommandKind;
import com.questrail.sirius.command.LedCommand;
import com.questrail.sirius.command.WireCommandEncoder;
import com.questrail.sirius.config.LedTimingPolicy;
import com.questrail.sirius.internal.bridge.AsyncBridge;
import com.questrail.sirius.internal.state.ConnectionRegistry;
import com.questrail.sirius.internal.time.SystemWallClock;
import com.questrail.sirius.internal.time.WallClock;
import com.questrail.sirius.observability.CommandFailure;
import com.questrail.sirius.observability.CommandResultEvent;
import com.questrail.sirius.observability.LedErrorEvent;
import com.questrail.sirius.observability.LedObservabilitySink;
import com.questrail.sirius.observability.NullObservabilitySink;
import com.questrail.sirius.transport.TransportHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

/**
 * CommandDispatcher
 * =============================================================================
 * Drains the pending command queue on one worker thread, one command at a time.
 *
 * <h2>Per-command steps</h2>
 * <ol>
 *   <li>Device not connected: the command is dropped and its callback gets
 *       {@code false}.</li>
 *   <li>Ambient colour mode active and the command is a COLOR: dropped without
 *       a callback; the ambient producer owns the colour.</li>
 *   <li>Otherwise the command is written through the {@link AsyncBridge}. The
 *       write itself is bounded by {@code commandTimeout} once the bridge starts
 *       it; time spent queued behind another device's unit does not count. A
 *       timed-out write marks its own device disconnected. A write error counts toward
 *       {@code maxConsecutiveWriteFailures}; reaching it marks the device
 *       disconnected.</li>
 *   <li>The callback receives the outcome.</li>
 *   <li>The worker pauses {@code commandInterval} before the next command.</li>
 * </ol>
 *
 * <h2>Ordering</h2>
 * One FIFO and one worker: commands for a device reach the transport in
 * enqueue order.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   dispatcher.enqueue(cmd)  → starts the worker on first use
 *   dispatcher.stop()        → stops the worker; queued commands are discarded
 * </pre>
 */
public final class CommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    private final AsyncBridge bridge;
    private final ConnectionRegistry registry;
    private final LedTimingPolicy timing;
    private final BooleanSupplier ambientEnabled;
    private final WriteFailureTracker writeFailures;
    private final LedObservabilitySink observabilitySink;
    private final WallClock wallClock;

    private final BlockingQueue<LedCommand> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private volatile Thread worker;

    /**
     * @param ambientEnabled read before each COLOR command; true suppresses it
     */
    public CommandDispatcher(AsyncBridge bridge,
                             ConnectionRegistry registry,
                             LedTimingPolicy timing,
                             BooleanSupplier ambientEnabled,
                             WriteFailureTracker writeFailures,
                             LedObservabilitySink observabilitySink)
    {
        this.bridge = Objects.requireNonNull(bridge, "bridge");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.timing = Objects.requireNonNull(timing, "timing");
        this.ambientEnabled = Objects.requireNonNull(ambientEnabled, "ambientEnabled");
        this.writeFailures = Objects.requireNonNull(writeFailures, "writeFailures");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.wallClock = SystemWallClock.INSTANCE;
    }

    /**
     * Appends a command and starts the worker if it is not running.
     * Commands enqueued after {@link #stop()} are rejected with a {@code false}
     * callback.
     */
    public void enqueue(LedCommand command) {
        Objects.requireNonNull(command, "command");
        if (stopped.get()) {
            log.debug("Dispatcher stopped; rejecting {}", command);
            command.complete(false);
            return;
        }
        queue.offer(command);
        ensureStarted();
    }

    public int pendingCount() {
        return queue.size();
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Signals the worker to exit, waits up to {@code workerJoinTimeout} and
     * discards whatever is still queued.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        running.set(false);
        Thread t = worker;
        if (t != null) {
            t.interrupt();
            try {
                t.join(timing.workerJoinTimeout().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        List<LedCommand> discarded = new ArrayList<>();
        queue.drainTo(discarded);
        if (!discarded.isEmpty()) {
            log.info("Discarded {} queued command(s) on stop", discarded.size());
        }
    }

    private void ensureStarted() {
        if (stopped.get()) {
            return;
        }
        if (running.compareAndSet(false, true)) {
            Thread t = new Thread(this::runLoop, "sirius-command-dispatcher");
            t.setDaemon(true);
            worker = t;
            t.start();
        }
    }

    private void runLoop() {
        log.debug("Command dispatcher started");
        while (running.get()) {
            try {
                LedCommand command = queue.poll(timing.queuePollTimeout().toMillis(), TimeUnit.MILLISECONDS);
                if (command == null) {
                    continue;
                }
                if (dispatch(command)) {
                    Thread.sleep(timing.commandInterval().toMillis());
                }
            } catch (InterruptedException e) {
                if (running.get()) {
                    continue;
                }
                break;
            } catch (Exception e) {
                observabilitySink.onError(new LedErrorEvent(wallClock.now(),
                        "Unexpected error in command dispatcher", e));
            }
        }
        log.debug("Command dispatcher stopped");
    }

    /**
     * @return true if a write was attempted (the pacing pause applies)
     */
    private boolean dispatch(LedCommand command) throws InterruptedException {
        DeviceId device = command.device();

        Optional<TransportHandle> handle = registry.handle(device);
        if (handle.isEmpty()) {
            observabilitySink.onCommandResult(CommandResultEvent.failure(wallClock.now(), device,
                    command.wireLine(), CommandFailure.NOT_CONNECTED, device + " is not connected"));
            command.complete(false);
            return false;
        }

        if (command.kind() == CommandKind.COLOR && ambientEnabled.getAsBoolean()) {
            log.debug("Ambient colour mode active; dropping {}", command);
            return false;
        }

        boolean success = sendOne(command, handle.get());
        command.complete(success);
        return true;
    }

    private boolean sendOne(LedCommand command, TransportHandle handle) throws InterruptedException {
        DeviceId device = command.device();
        String line = command.wireLine();
        byte[] payload = WireCommandEncoder.encode(command.payload());

        long timeoutMillis = timing.commandTimeout().toMillis();
        CompletableFuture<Void> result = bridge.execute(() -> handle.write(payload).copy()
                .orTimeout(timeoutMillis, TimeUnit.MILLISECONDS));
        try {
            // bounded inside the unit; time spent queued behind other units does not count
            result.get();
        } catch (CancellationException e) {
            log.debug("{} not sent; bridge stopped", command);
            return false;
        } catch (ExecutionException e) {
            Throwable cause = unwrap(e.getCause() != null ? e.getCause() : e);
            if (cause instanceof TimeoutException) {
                registry.markDisconnected(device);
                writeFailures.reset(device);
                observabilitySink.onCommandResult(CommandResultEvent.failure(wallClock.now(), device, line,
                        CommandFailure.TIMEOUT, "No write result within " + timing.commandTimeout()));
                return false;
            }
            int count = writeFailures.recordFailure(device);
            observabilitySink.onCommandResult(CommandResultEvent.failure(wallClock.now(), device, line,
                    CommandFailure.TRANSPORT_ERROR, String.valueOf(cause.getMessage())));
            if (count >= timing.maxConsecutiveWriteFailures()) {
                log.warn("{} failed {} consecutive writes; marking disconnected", device, count);
                registry.markDisconnected(device);
                writeFailures.reset(device);
            }
            return false;
        }

        writeFailures.reset(device);
        observabilitySink.onCommandResult(CommandResultEvent.success(wallClock.now(), device, line));
        return true;
    }

    private static Throwable unwrap(Throwable t) {
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
