package com.questrail.sirius.runtime;

import com.questrail.sirius.api.AnimationType;
import com.questrail.sirius.api.DeviceId;
import com.questrail.sirius.api.DeviceSettings;
import com.questrail.sirius.api.LedController;
import com.questrail.sirius.api.Rgb;
import com.questrail.sirius.choreography.AnimationOptions;
import com.questrail.sirius.choreography.ChoreographyEngine;
import com.questrail.sirius.choreography.ChoreographyState;
import com.questrail.sirius.command.BatchEntry;
import com.questrail.sirius.command.CommandPayload;
import com.questrail.sirius.command.CompletionCallback;
import com.questrail.sirius.command.FanOutResult;
import com.questrail.sirius.command.LedCommand;
import com.questrail.sirius.command.WireCommandParser;
import com.questrail.sirius.config.AfterAnimationPolicy;
import com.questrail.sirius.config.LedTimingPolicy;
import com.questrail.sirius.config.SiriusRuntimeConfig;
import com.questrail.sirius.internal.bridge.AsyncBridge;
import com.questrail.sirius.internal.dispatch.CommandDispatcher;
import com.questrail.sirius.internal.dispatch.WriteFailureTracker;
import com.questrail.sirius.internal.fanout.SimultaneousSender;
import com.questrail.sirius.internal.state.AmbientColorState;
import com.questrail.sirius.internal.state.ConnectionRegistry;
import com.questrail.sirius.internal.time.MonotonicClock;
import com.questrail.sirius.internal.time.MonotonicScheduler;
import com.questrail.sirius.internal.time.ScheduledExecutorScheduler;
import com.questrail.sirius.internal.time.SystemMonotonicClock;
import com.questrail.sirius.internal.time.SystemWallClock;
import com.questrail.sirius.observability.ConnectionStatusEvent;
import com.questrail.sirius.observability.LedErrorEvent;
import com.questrail.sirius.observability.LedObservabilitySink;
import com.questrail.sirius.observability.NullObservabilitySink;
import com.questrail.sirius.observability.StatusMessageEvent;
import com.questrail.sirius.transport.DiscoveredDevice;
import com.questrail.sirius.transport.TransportHandle;
import com.questrail.sirius.transport.TransportPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * SiriusLedRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the LED command core.
 *
 * <h2>Topology</h2>
 * <pre>
 *   caller ─▶ CommandDispatcher ─┐
 *   caller ─▶ SimultaneousSender ┼─▶ AsyncBridge ─▶ TransportPort / TransportHandle
 *   caller ─▶ ChoreographyEngine ┘
 *                  ▲
 *            ConnectionRegistry (shared, single lock)
 * </pre>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   runtime.start()  → starts the bridge worker
 *   runtime.stop()   → choreography, dispatcher, scheduler, bridge, transport
 * </pre>
 * Each stop step is bounded by the timing policy.
 */
public final class SiriusLedRuntime implements LedController {

    private static final Logger log = LoggerFactory.getLogger(SiriusLedRuntime.class);

    private final SiriusRuntimeConfig config;
    private final TransportPort transport;
    private final ConnectionRegistry registry;
    private final AmbientColorState ambient;
    private final AsyncBridge bridge;
    private final CommandDispatcher dispatcher;
    private final SimultaneousSender sender;
    private final ChoreographyEngine choreography;
    private final WriteFailureTracker writeFailures;
    private final MonotonicClock clock;
    private final ScheduledExecutorService ownedSchedulerExecutor;
    private final LedObservabilitySink observabilitySink;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private SiriusLedRuntime(Builder b, MonotonicScheduler scheduler, ScheduledExecutorService ownedSchedulerExecutor) {
        this.config = b.config;
        this.transport = b.transport;
        this.clock = b.clock;
        this.observabilitySink = b.observabilitySink;
        this.ownedSchedulerExecutor = ownedSchedulerExecutor;

        LedTimingPolicy timing = config.timingPolicy();
        this.registry = new ConnectionRegistry();
        this.ambient = new AmbientColorState(config.ambientColorPolicy());
        this.writeFailures = new WriteFailureTracker();
        this.bridge = new AsyncBridge(timing.unitTimeout(), timing.workerJoinTimeout(), observabilitySink);
        this.dispatcher = new CommandDispatcher(bridge, registry, timing, ambient::enabled,
                writeFailures, observabilitySink);
        this.sender = new SimultaneousSender(bridge, registry, timing, observabilitySink);
        this.choreography = new ChoreographyEngine(sender, registry, ambient, config.animationDefaults(),
                timing, config.afterAnimationPolicy(), clock, scheduler, observabilitySink);

        registry.addListener((device, connected) -> {
            if (connected) {
                writeFailures.reset(device);
            }
            observabilitySink.onConnectionStatus(
                    new ConnectionStatusEvent(SystemWallClock.INSTANCE.now(), device, connected));
        });
    }

    public static Builder builder() {
        return new Builder();
    }

    public void start() {
        if (stopped.get()) {
            throw new IllegalStateException("Runtime has been stopped");
        }
        if (started.compareAndSet(false, true)) {
            bridge.start();
            log.info("Sirius LED runtime started");
        }
    }

    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        choreography.shutdown();
        dispatcher.stop();
        if (ownedSchedulerExecutor != null) {
            ownedSchedulerExecutor.shutdown();
            try {
                if (!ownedSchedulerExecutor.awaitTermination(
                        config.timingPolicy().workerJoinTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                    ownedSchedulerExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                ownedSchedulerExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        bridge.stop();
        transport.close();
        log.info("Sirius LED runtime stopped");
    }

    public SiriusRuntimeConfig config() {
        return config;
    }

    // -------------------------------------------------------------------------
    // Queued single-device commands
    // -------------------------------------------------------------------------

    @Override
    public void enqueueCommand(DeviceId device, CommandPayload payload, CompletionCallback onComplete) {
        dispatcher.enqueue(new LedCommand(device, payload, clock.nowNanos(), onComplete));
    }

    @Override
    public void setRgbColor(DeviceId device, Rgb color, CompletionCallback onComplete) {
        enqueueCommand(device, new CommandPayload.Color(color), onComplete);
    }

    @Override
    public void setMode(DeviceId device, boolean auto, CompletionCallback onComplete) {
        enqueueCommand(device, new CommandPayload.Mode(auto), onComplete);
    }

    @Override
    public void setHue(DeviceId device, int hue, CompletionCallback onComplete) {
        enqueueCommand(device, new CommandPayload.Hue(hue), onComplete);
    }

    @Override
    public void setTransitionColor(DeviceId device, Rgb color, int durationMs, CompletionCallback onComplete) {
        enqueueCommand(device, new CommandPayload.Transition(color, durationMs), onComplete);
    }

    @Override
    public void applySettings(DeviceId device, DeviceSettings settings, CompletionCallback onComplete) {
        enqueueCommand(device, settingsPayload(settings), onComplete);
    }

    @Override
    public void enqueueRaw(DeviceId device, String line, CompletionCallback onComplete) {
        enqueueCommand(device, WireCommandParser.parse(line), onComplete);
    }

    // -------------------------------------------------------------------------
    // Simultaneous batches
    // -------------------------------------------------------------------------

    @Override
    public void applySettingsToBoth(DeviceSettings settings, CompletionCallback onComplete) {
        Set<DeviceId> connected = registry.connectedDevices();
        if (connected.isEmpty()) {
            log.warn("No device connected; settings not applied");
            observabilitySink.onStatusMessage(new StatusMessageEvent(SystemWallClock.INSTANCE.now(),
                    "No device connected"));
            if (onComplete != null) {
                onComplete.onComplete(false);
            }
            return;
        }
        CommandPayload payload = settingsPayload(settings);
        List<BatchEntry> batch = new ArrayList<>();
        for (DeviceId d : connected) {
            batch.add(new BatchEntry(d, payload));
        }
        sender.sendSimultaneously(batch, onComplete);
    }

    @Override
    public CompletableFuture<FanOutResult> sendSimultaneously(List<BatchEntry> batch, CompletionCallback onComplete) {
        return sender.sendSimultaneously(batch, onComplete);
    }

    private static CommandPayload settingsPayload(DeviceSettings settings) {
        Objects.requireNonNull(settings, "settings");
        return settings.autoMode()
                ? new CommandPayload.Mode(true)
                : new CommandPayload.Color(settings.color());
    }

    // -------------------------------------------------------------------------
    // Choreography
    // -------------------------------------------------------------------------

    @Override
    public boolean startAnimation(AnimationType type, AnimationOptions options) {
        return choreography.start(type, options);
    }

    @Override
    public boolean startAnimation(String name, AnimationOptions options) {
        return choreography.start(name, options);
    }

    @Override
    public void stopAnimation() {
        choreography.stop();
    }

    @Override
    public ChoreographyState animationState() {
        return choreography.state();
    }

    @Override
    public void setAfterAnimationPolicy(AfterAnimationPolicy policy) {
        choreography.setAfterAnimationPolicy(policy);
    }

    @Override
    public void setCustomColor(AnimationType type, Rgb color) {
        choreography.setCustomColor(type, color);
    }

    @Override
    public Rgb customColor(AnimationType type) {
        return choreography.customColor(type);
    }

    @Override
    public void resetCustomColor(AnimationType type) {
        choreography.resetCustomColor(type);
    }

    // -------------------------------------------------------------------------
    // Ambient colour
    // -------------------------------------------------------------------------

    @Override
    public void setAmbientMode(boolean enabled) {
        boolean previous = ambient.setEnabled(enabled);
        if (previous != enabled) {
            log.info("Ambient colour mode {}", enabled ? "enabled" : "disabled");
        }
    }

    @Override
    public boolean ambientMode() {
        return ambient.enabled();
    }

    @Override
    public void updateAmbientColor(Rgb color) {
        Objects.requireNonNull(color, "color");
        if (!ambient.enabled()) {
            return;
        }
        Set<DeviceId> connected = registry.connectedDevices();
        if (connected.isEmpty()) {
            return;
        }
        CommandPayload payload = new CommandPayload.Transition(color, ambient.policy().transitionMs());
        List<BatchEntry> batch = new ArrayList<>();
        for (DeviceId d : connected) {
            batch.add(new BatchEntry(d, payload));
        }
        sender.sendSimultaneously(batch);
    }

    // -------------------------------------------------------------------------
    // Connections
    // -------------------------------------------------------------------------

    @Override
    public boolean isConnected(DeviceId device) {
        return registry.isConnected(device);
    }

    @Override
    public CompletableFuture<Boolean> scanAndConnect(DeviceId device) {
        Objects.requireNonNull(device, "device");
        LedTimingPolicy timing = config.timingPolicy();
        log.info("Scanning for {} ({})", device, device.advertisedName());

        return bridge.<Boolean>execute(() -> transport.discover(timing.discoveryTimeout())
                        .thenCompose(found -> {
                            Optional<DiscoveredDevice> match = found.stream()
                                    .filter(d -> device.advertisedName().equals(d.name()))
                                    .findFirst();
                            if (match.isEmpty()) {
                                status(device + " not found");
                                return CompletableFuture.completedFuture(false);
                            }
                            String address = match.get().address();
                            registry.rememberAddress(device, address);
                            return transport.connect(address, timing.connectTimeout())
                                    .thenApply(handle -> install(device, handle));
                        }))
                .exceptionally(t -> {
                    observabilitySink.onError(new LedErrorEvent(SystemWallClock.INSTANCE.now(),
                            "Connecting " + device + " failed", t));
                    return false;
                });
    }

    private boolean install(DeviceId device, TransportHandle handle) {
        if (!handle.isConnected()) {
            status(device + " could not be connected");
            return false;
        }
        registry.markConnected(device, handle);
        status(device + " connected at " + handle.address());
        return true;
    }

    @Override
    public CompletableFuture<Boolean> disconnect(DeviceId device) {
        Optional<TransportHandle> handle = registry.handle(device);
        if (handle.isEmpty()) {
            log.warn("{} is not connected", device);
            return CompletableFuture.completedFuture(false);
        }
        TransportHandle h = handle.get();
        return bridge.execute(h::disconnect)
                .handle((v, t) -> {
                    registry.markDisconnected(device);
                    if (t != null) {
                        observabilitySink.onError(new LedErrorEvent(SystemWallClock.INSTANCE.now(),
                                "Disconnecting " + device + " failed", t));
                        return false;
                    }
                    status(device + " disconnected");
                    return true;
                });
    }

    @Override
    public CompletableFuture<Boolean> checkConnection(DeviceId device) {
        Optional<TransportHandle> handle = registry.handle(device);
        if (handle.isEmpty()) {
            return CompletableFuture.completedFuture(false);
        }
        TransportHandle h = handle.get();
        return bridge.execute(() -> CompletableFuture.completedFuture(h.isConnected()))
                .handle((alive, t) -> {
                    boolean ok = t == null && alive;
                    if (!ok) {
                        registry.markDisconnected(device);
                    }
                    return ok;
                });
    }

    @Override
    public CompletableFuture<Map<DeviceId, Boolean>> checkAllConnections() {
        Map<DeviceId, CompletableFuture<Boolean>> checks = new EnumMap<>(DeviceId.class);
        for (DeviceId d : DeviceId.values()) {
            checks.put(d, checkConnection(d));
        }
        return CompletableFuture.allOf(checks.values().toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    Map<DeviceId, Boolean> out = new EnumMap<>(DeviceId.class);
                    checks.forEach((d, f) -> out.put(d, f.join()));
                    return out;
                });
    }

    private void status(String message) {
        log.info(message);
        observabilitySink.onStatusMessage(new StatusMessageEvent(SystemWallClock.INSTANCE.now(), message));
    }

    // -------------------------------------------------------------------------
    // Builder
    // -------------------------------------------------------------------------

    public static final class Builder {
        private SiriusRuntimeConfig config = SiriusRuntimeConfig.defaults();
        private TransportPort transport;
        private LedObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private MonotonicScheduler scheduler;

        public Builder withConfig(SiriusRuntimeConfig config) {
            this.config = config;
            return this;
        }

        public Builder withTransport(TransportPort transport) {
            this.transport = transport;
            return this;
        }

        public Builder withObservabilitySink(LedObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Scheduler for the delayed after-animation step. When absent the
         * runtime creates and owns a single-thread executor.
         */
        public Builder withScheduler(MonotonicScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public SiriusLedRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(transport, "transport");
            Objects.requireNonNull(clock, "clock");
            if (observabilitySink == null) {
                observabilitySink = NullObservabilitySink.INSTANCE;
            }

            if (scheduler != null) {
                return new SiriusLedRuntime(this, scheduler, null);
            }
            ScheduledExecutorService exec = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "sirius-scheduler");
                t.setDaemon(true);
                return t;
            });
            return new SiriusLedRuntime(this, new ScheduledExecutorScheduler(exec, clock), exec);
        }
    }
}
