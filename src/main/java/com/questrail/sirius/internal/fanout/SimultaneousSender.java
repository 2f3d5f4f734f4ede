package com.questrail.sirius.internal.fanout;

import com.questrail.sirius.api.DeviceId;
import com.questrail.sirius.command.BatchEntry;
import com.questrail.sirius.command.CompletionCallback;
import com.questrail.sirius.command.FanOutResult;
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
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * SimultaneousSender
 * =============================================================================
 * Sends a batch of commands, one per device, so that they take effect together.
 *
 * <h2>Protocol</h2>
 * <ol>
 *   <li>Resolve each entry's handle from the registry; entries for devices that
 *       are not connected are skipped.</li>
 *   <li>Encode every surviving entry before any write starts.</li>
 *   <li>Submit a single bridge unit that starts every write and then waits for
 *       all of them.</li>
 *   <li>The batch succeeds only if every write succeeded. An empty batch is a
 *       success.</li>
 * </ol>
 *
 * <p>Bypasses the dispatcher queue and its pacing. Each write is bounded by
 * {@code commandTimeout}; a timed-out device is marked disconnected.</p>
 */
public final class SimultaneousSender {

    private static final Logger log = LoggerFactory.getLogger(SimultaneousSender.class);

    private final AsyncBridge bridge;
    private final ConnectionRegistry registry;
    private final LedTimingPolicy timing;
    private final LedObservabilitySink observabilitySink;
    private final WallClock wallClock = SystemWallClock.INSTANCE;

    public SimultaneousSender(AsyncBridge bridge,
                              ConnectionRegistry registry,
                              LedTimingPolicy timing,
                              LedObservabilitySink observabilitySink)
    {
        this.bridge = Objects.requireNonNull(bridge, "bridge");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.timing = Objects.requireNonNull(timing, "timing");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    public CompletableFuture<FanOutResult> sendSimultaneously(List<BatchEntry> batch) {
        return sendSimultaneously(batch, null);
    }

    /**
     * @param onComplete optional; receives {@link FanOutResult#success()}
     * @return completes once every write has resolved; never completes
     *         exceptionally
     */
    public CompletableFuture<FanOutResult> sendSimultaneously(List<BatchEntry> batch, CompletionCallback onComplete) {
        Objects.requireNonNull(batch, "batch");

        List<PreparedWrite> prepared = new ArrayList<>();
        Set<DeviceId> skipped = EnumSet.noneOf(DeviceId.class);
        for (BatchEntry entry : batch) {
            Optional<TransportHandle> handle = registry.handle(entry.device());
            if (handle.isEmpty()) {
                log.debug("Skipping {} in batch: not connected", entry.device());
                skipped.add(entry.device());
                continue;
            }
            prepared.add(new PreparedWrite(entry.device(), handle.get(),
                    WireCommandEncoder.encodeLine(entry.payload()),
                    WireCommandEncoder.encode(entry.payload())));
        }

        CompletableFuture<FanOutResult> result;
        if (prepared.isEmpty()) {
            result = CompletableFuture.completedFuture(FanOutResult.nothingSent(skipped));
        } else {
            result = bridge.execute(() -> writeAll(prepared, skipped))
                    .exceptionally(t -> failAll(prepared, skipped, unwrap(t)));
        }

        if (onComplete != null) {
            result = result.thenApply(r -> {
                notifyCaller(onComplete, r);
                return r;
            });
        }
        return result;
    }

    private void notifyCaller(CompletionCallback onComplete, FanOutResult result) {
        try {
            onComplete.onComplete(result.success());
        } catch (RuntimeException e) {
            observabilitySink.onError(new LedErrorEvent(wallClock.now(), "Batch completion callback failed", e));
        }
    }

    private CompletableFuture<FanOutResult> writeAll(List<PreparedWrite> prepared, Set<DeviceId> skipped) {
        long timeoutMillis = timing.commandTimeout().toMillis();
        List<CompletableFuture<Void>> writes = new ArrayList<>(prepared.size());
        for (PreparedWrite w : prepared) {
            CompletableFuture<Void> write;
            try {
                write = w.handle.write(w.payload).copy();
            } catch (RuntimeException e) {
                write = CompletableFuture.failedFuture(e);
            }
            writes.add(write.orTimeout(timeoutMillis, TimeUnit.MILLISECONDS));
        }

        return CompletableFuture.allOf(writes.stream()
                        .map(f -> f.handle((v, t) -> null))
                        .toArray(CompletableFuture[]::new))
                .thenApply(ignored -> collect(prepared, writes, skipped));
    }

    private FanOutResult collect(List<PreparedWrite> prepared,
                                 List<CompletableFuture<Void>> writes,
                                 Set<DeviceId> skipped)
    {
        Set<DeviceId> succeeded = EnumSet.noneOf(DeviceId.class);
        Map<DeviceId, Throwable> failed = new EnumMap<>(DeviceId.class);
        for (int i = 0; i < prepared.size(); i++) {
            PreparedWrite w = prepared.get(i);
            CompletableFuture<Void> f = writes.get(i);
            if (!f.isCompletedExceptionally()) {
                succeeded.add(w.device);
                observabilitySink.onCommandResult(CommandResultEvent.success(wallClock.now(), w.device, w.line));
                continue;
            }
            Throwable cause = unwrap(f.handle((v, t) -> t).join());
            failed.put(w.device, cause);
            reportFailure(w, cause);
        }
        return new FanOutResult(succeeded, failed, skipped);
    }

    private FanOutResult failAll(List<PreparedWrite> prepared, Set<DeviceId> skipped, Throwable cause) {
        Map<DeviceId, Throwable> failed = new EnumMap<>(DeviceId.class);
        for (PreparedWrite w : prepared) {
            failed.put(w.device, cause);
            reportFailure(w, cause);
        }
        return new FanOutResult(Set.of(), failed, skipped);
    }

    private void reportFailure(PreparedWrite w, Throwable cause) {
        if (cause instanceof TimeoutException) {
            registry.markDisconnected(w.device);
            observabilitySink.onCommandResult(CommandResultEvent.failure(wallClock.now(), w.device, w.line,
                    CommandFailure.TIMEOUT, "No write result within " + timing.commandTimeout()));
        } else {
            observabilitySink.onCommandResult(CommandResultEvent.failure(wallClock.now(), w.device, w.line,
                    CommandFailure.TRANSPORT_ERROR, String.valueOf(cause.getMessage())));
        }
    }

    private static Throwable unwrap(Throwable t) {
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    private static final class PreparedWrite {
        private final DeviceId device;
        private final TransportHandle handle;
        private final String line;
        private final byte[] payload;

        private PreparedWrite(DeviceId device, TransportHandle handle, String line, byte[] payload) {
            this.device = device;
            this.handle = handle;
            this.line = line;
            this.payload = payload;
        }
    }
}
