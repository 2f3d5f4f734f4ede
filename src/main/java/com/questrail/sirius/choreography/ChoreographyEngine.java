package com.questrail.sirius.choreography;

import com.questrail.sirius.api.AnimationType;
import com.questrail.sirius.api.DeviceId;
import com.questrail.sirius.api.Rgb;
import com.questrail.sirius.command.CommandPayload;
import com.questrail.sirius.config.AfterAnimationPolicy;
import com.questrail.sirius.config.AnimationDefaults;
import com.questrail.sirius.config.LedTimingPolicy;
import com.questrail.sirius.command.BatchEntry;
import com.questrail.sirius.internal.fanout.SimultaneousSender;
import com.questrail.sirius.internal.state.AmbientColorState;
import com.questrail.sirius.internal.state.ConnectionRegistry;
import com.questrail.sirius.internal.time.MonotonicClock;
import com.questrail.sirius.internal.time.MonotonicScheduler;
import com.questrail.sirius.internal.time.SystemWallClock;
import com.questrail.sirius.internal.time.WallClock;
import com.questrail.sirius.observability.AnimationEvent;
import com.questrail.sirius.observability.LedErrorEvent;
import com.questrail.sirius.observability.LedObservabilitySink;
import com.questrail.sirius.observability.NullObservabilitySink;
import com.questrail.sirius.observability.StatusMessageEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * ChoreographyEngine
 * =============================================================================
 * Owns at most one running {@link ChoreographySession}.
 *
 * <h2>State machine</h2>
 * <pre>
 *   Idle ──start(t)──▶ Running(t) ──stop() / routine done──▶ Idle
 *                       │
 *                       └─start(u)──▶ (stop t, bounded wait) ──▶ Running(u)
 * </pre>
 *
 * <h2>Start</h2>
 * <ul>
 *   <li>A running session is stopped first; its worker gets
 *       {@code preemptionWait} to exit before the new one starts. A worker that
 *       does not exit in time is interrupted and reported.</li>
 *   <li>Ambient colour mode is switched off.</li>
 *   <li>Timing is resolved from the per-type defaults and the caller's options.</li>
 * </ul>
 *
 * <h2>End of a session</h2>
 * Whether stopped or run to completion, a session ends once: the state returns
 * to Idle, a STOPPED event is emitted, and the after-animation colour is applied
 * to every connected device. That application is a colour batch followed by a
 * fixed-mode batch {@code afterAnimationStepDelay} later.
 */
public final class ChoreographyEngine {

    private static final Logger log = LoggerFactory.getLogger(ChoreographyEngine.class);

    private final SimultaneousSender sender;
    private final ConnectionRegistry registry;
    private final AmbientColorState ambient;
    private final AnimationDefaults animationDefaults;
    private final LedTimingPolicy timing;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final LedObservabilitySink observabilitySink;
    private final WallClock wallClock = SystemWallClock.INSTANCE;

    private final AnimationColorTable colors = new AnimationColorTable();
    private final AtomicReference<ChoreographySession> current = new AtomicReference<>();
    private final Object startLock = new Object();
    private final SessionHooks hooks = new SessionHooks();

    private volatile AfterAnimationPolicy afterAnimationPolicy;

    public ChoreographyEngine(SimultaneousSender sender,
                              ConnectionRegistry registry,
                              AmbientColorState ambient,
                              AnimationDefaults animationDefaults,
                              LedTimingPolicy timing,
                              AfterAnimationPolicy afterAnimationPolicy,
                              MonotonicClock clock,
                              MonotonicScheduler scheduler,
                              LedObservabilitySink observabilitySink)
    {
        this.sender = Objects.requireNonNull(sender, "sender");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.ambient = Objects.requireNonNull(ambient, "ambient");
        this.animationDefaults = Objects.requireNonNull(animationDefaults, "animationDefaults");
        this.timing = Objects.requireNonNull(timing, "timing");
        this.afterAnimationPolicy = Objects.requireNonNull(afterAnimationPolicy, "afterAnimationPolicy");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    /**
     * Starts a session by external name, e.g. {@code "hazard"}.
     *
     * @return false for an unknown name; the current state is left untouched
     */
    public boolean start(String name, AnimationOptions options) {
        Optional<AnimationType> type = AnimationType.fromWireName(name);
        if (type.isEmpty()) {
            log.warn("Unknown animation type '{}'", name);
            return false;
        }
        return start(type.get(), options);
    }

    /**
     * Starts a session, pre-empting the running one.
     *
     * @return true once the new session is running
     */
    public boolean start(AnimationType type, AnimationOptions options) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(options, "options");

        synchronized (startLock) {
            ChoreographySession previous = current.get();
            if (previous != null) {
                preempt(previous);
            }

            if (ambient.setEnabled(false)) {
                log.info("Ambient colour mode disabled for {}", type.wireName());
            }

            AnimationTiming resolved = AnimationTiming.resolve(type, animationDefaults, options);
            ChoreographySession session = new ChoreographySession(
                    type, resolved, colors.colorFor(type), registry, hooks);
            current.set(session);

            observabilitySink.onAnimation(new AnimationEvent(wallClock.now(), AnimationEvent.Phase.STARTED, type));
            observabilitySink.onStatusMessage(new StatusMessageEvent(wallClock.now(),
                    "Started " + type.wireName()));
            log.debug("Starting {}", session);
            session.startWorker();
            return true;
        }
    }

    /**
     * Stops the running session. No-op when idle.
     */
    public void stop() {
        ChoreographySession session = current.get();
        if (session != null) {
            session.cancel();
        }
    }

    public ChoreographyState state() {
        ChoreographySession session = current.get();
        return session == null ? ChoreographyState.IDLE : new ChoreographyState.Running(session.type());
    }

    /**
     * Stops any session and waits up to {@code workerJoinTimeout} for its worker.
     */
    public void shutdown() {
        ChoreographySession session = current.get();
        if (session == null) {
            return;
        }
        session.cancel();
        try {
            if (!session.awaitWorkerExit(timing.workerJoinTimeout())) {
                session.abandonWorker();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Waits for the running session, if any, to end.
     *
     * @return true if idle within the timeout
     */
    boolean awaitIdle(Duration timeout) throws InterruptedException {
        ChoreographySession session = current.get();
        return session == null || session.awaitFinished(timeout);
    }

    public AfterAnimationPolicy afterAnimationPolicy() {
        return afterAnimationPolicy;
    }

    public void setAfterAnimationPolicy(AfterAnimationPolicy policy) {
        this.afterAnimationPolicy = Objects.requireNonNull(policy, "policy");
    }

    public Rgb customColor(AnimationType type) {
        return colors.colorFor(type);
    }

    /**
     * Overrides the colour of a type. Takes effect from the next session.
     */
    public void setCustomColor(AnimationType type, Rgb color) {
        colors.set(type, color);
    }

    public void resetCustomColor(AnimationType type) {
        colors.reset(type);
    }

    private void preempt(ChoreographySession previous) {
        previous.cancel();
        boolean exited;
        try {
            exited = previous.awaitWorkerExit(timing.preemptionWait());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            exited = false;
        }
        if (!exited) {
            previous.abandonWorker();
            String message = previous.type().wireName() + " worker still running after "
                    + timing.preemptionWait() + "; starting next session anyway";
            log.warn(message);
            observabilitySink.onError(new LedErrorEvent(wallClock.now(), message, null));
        }
        current.compareAndSet(previous, null);
    }

    private void applyAfterAnimation() {
        Rgb finalColor = afterAnimationPolicy.finalColor();
        sender.sendSimultaneously(allDevices(new CommandPayload.Color(finalColor)));
        scheduler.scheduleAfter(timing.afterAnimationStepDelay(), clock,
                () -> sender.sendSimultaneously(allDevices(new CommandPayload.Mode(false))));
    }

    private static List<BatchEntry> allDevices(CommandPayload payload) {
        List<BatchEntry> batch = new ArrayList<>();
        for (DeviceId d : DeviceId.values()) {
            batch.add(new BatchEntry(d, payload));
        }
        return batch;
    }

    private final class SessionHooks implements ChoreographySession.Hooks {

        @Override
        public void submit(List<BatchEntry> batch) {
            sender.sendSimultaneously(batch);
        }

        @Override
        public void statusMessage(String message) {
            observabilitySink.onStatusMessage(new StatusMessageEvent(wallClock.now(), message));
        }

        @Override
        public void onFinished(ChoreographySession session) {
            // colour batch is queued on the bridge before anyone can observe Idle
            applyAfterAnimation();
            current.compareAndSet(session, null);
            observabilitySink.onAnimation(new AnimationEvent(wallClock.now(),
                    AnimationEvent.Phase.STOPPED, session.type()));
            observabilitySink.onStatusMessage(new StatusMessageEvent(wallClock.now(),
                    "Stopped " + session.type().wireName()));
        }

        @Override
        public void onWorkerError(ChoreographySession session, RuntimeException e) {
            observabilitySink.onError(new LedErrorEvent(wallClock.now(),
                    session.type().wireName() + " worker failed", e));
        }
    }
}
