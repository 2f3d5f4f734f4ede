package com.questrail.sirius.choreography;

import com.questrail.sirius.api.AnimationType;
import com.questrail.sirius.api.DeviceId;
import com.questrail.sirius.api.Rgb;
import com.questrail.sirius.command.CommandPayload;
import com.questrail.sirius.command.BatchEntry;
import com.questrail.sirius.internal.state.ConnectionRegistry;
import com.questrail.sirius.internal.time.Cancellable;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * ChoreographySession
 * =============================================================================
 * One run of one {@link AnimationType}: its worker thread and its cancel signal.
 *
 * <h2>Cancellation</h2>
 * The cancel flag is checked before and after every hold; the hold itself wakes
 * as soon as the session is cancelled.
 *
 * <h2>Ending</h2>
 * A session ends exactly once, either when its routine runs out or when it is
 * cancelled. The first of the two runs the engine's finish hook; the other is a
 * no-op.
 *
 * <h2>Write ordering</h2>
 * Batches are submitted under {@code sendLock} after re-checking the flag, and
 * the finish hook runs under the same lock. Once the session is cancelled no
 * routine write can be queued behind the after-animation colour.
 */
final class ChoreographySession implements Cancellable
{
    /** What a session needs from its engine. */
    interface Hooks {
        void submit(List<BatchEntry> batch);

        void statusMessage(String message);

        void onFinished(ChoreographySession session);

        void onWorkerError(ChoreographySession session, RuntimeException e);
    }

    private final AnimationType type;
    private final AnimationTiming timing;
    private final Rgb color;
    private final ConnectionRegistry registry;
    private final Hooks hooks;

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicBoolean finished = new AtomicBoolean(false);
    private final CountDownLatch wakeup = new CountDownLatch(1);
    private final CountDownLatch ended = new CountDownLatch(1);
    private final Object sendLock = new Object();

    private volatile Thread worker;

    ChoreographySession(AnimationType type, AnimationTiming timing, Rgb color,
                        ConnectionRegistry registry, Hooks hooks)
    {
        this.type = Objects.requireNonNull(type, "type");
        this.timing = Objects.requireNonNull(timing, "timing");
        this.color = Objects.requireNonNull(color, "color");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.hooks = Objects.requireNonNull(hooks, "hooks");
    }

    AnimationType type() {
        return type;
    }

    void startWorker() {
        Thread t = new Thread(this::run, "sirius-choreography-" + type.wireName());
        t.setDaemon(true);
        worker = t;
        t.start();
    }

    /**
     * Cancels the session and runs the finish hook if it has not run yet.
     *
     * @return true if this call ended the session
     */
    @Override
    public boolean cancel() {
        return finish();
    }

    /**
     * Waits for the worker thread to exit.
     *
     * @return true if the worker is gone
     */
    boolean awaitWorkerExit(Duration timeout) throws InterruptedException {
        Thread t = worker;
        if (t == null || t == Thread.currentThread()) {
            return true;
        }
        t.join(Math.max(1, timeout.toMillis()));
        return !t.isAlive();
    }

    /**
     * Waits for the finish hook to have run.
     *
     * @return false if the session is still live after the timeout
     */
    boolean awaitFinished(Duration timeout) throws InterruptedException {
        return ended.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /** Interrupts a worker that did not leave on its own. */
    void abandonWorker() {
        Thread t = worker;
        if (t != null) {
            t.interrupt();
        }
    }

    private void run() {
        try {
            switch (type.routine()) {
                case TURN_SIGNAL -> runTurnSignal();
                case FLASH -> runFlash();
                case MOVE -> runMove();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            hooks.onWorkerError(this, e);
        } finally {
            finish();
        }
    }

    private void runTurnSignal() throws InterruptedException {
        DeviceId side = type.side().orElseThrow();
        if (!registry.isConnected(side)) {
            hooks.statusMessage(side + " is not connected; " + type.wireName() + " not shown");
            return;
        }
        DeviceId other = side.opposite();
        if (registry.isConnected(other)) {
            sendIfActive(List.of(new BatchEntry(other, new CommandPayload.Color(Rgb.NEAR_OFF))));
        }

        blink(List.of(side));
    }

    private void runFlash() throws InterruptedException {
        if (nothingConnected()) {
            return;
        }
        blink(List.of(DeviceId.values()));
    }

    private void blink(List<DeviceId> devices) throws InterruptedException {
        for (int i = 0; i < timing.cycles(); i++) {
            if (!sendIfActive(transition(devices, color, timing.transitionMs()))) {
                return;
            }
            if (hold(timing.speed())) {
                return;
            }
            if (!sendIfActive(transition(devices, Rgb.OFF, timing.transitionMs()))) {
                return;
            }
            if (hold(timing.speed())) {
                return;
            }
        }
    }

    private void runMove() throws InterruptedException {
        if (nothingConnected()) {
            return;
        }
        List<DeviceId> both = List.of(DeviceId.values());
        if (!sendIfActive(transition(both, color, timing.transitionMs() * 2))) {
            return;
        }
        if (hold(timing.speed().multipliedBy(2))) {
            return;
        }
        if (!sendIfActive(transition(both, Rgb.OFF, timing.transitionMs() * 3))) {
            return;
        }
        hold(timing.speed().multipliedBy(3));
    }

    private boolean nothingConnected() {
        if (registry.connectedDevices().isEmpty()) {
            hooks.statusMessage("No device connected; " + type.wireName() + " not shown");
            return true;
        }
        return false;
    }

    private static List<BatchEntry> transition(List<DeviceId> devices, Rgb rgb, int ms) {
        List<BatchEntry> batch = new ArrayList<>(devices.size());
        CommandPayload payload = new CommandPayload.Transition(rgb, ms);
        for (DeviceId d : devices) {
            batch.add(new BatchEntry(d, payload));
        }
        return batch;
    }

    /**
     * @return false if the session was cancelled and nothing was sent
     */
    private boolean sendIfActive(List<BatchEntry> batch) {
        synchronized (sendLock) {
            if (cancelled.get()) {
                return false;
            }
            hooks.submit(batch);
            return true;
        }
    }

    /**
     * @return true if the session was cancelled before or during the hold
     */
    private boolean hold(Duration d) throws InterruptedException {
        if (cancelled.get()) {
            return true;
        }
        boolean woken = wakeup.await(d.toNanos(), TimeUnit.NANOSECONDS);
        return woken || cancelled.get();
    }

    private boolean finish() {
        synchronized (sendLock) {
            cancelled.set(true);
            wakeup.countDown();
            if (!finished.compareAndSet(false, true)) {
                return false;
            }
            try {
                hooks.onFinished(this);
            } finally {
                ended.countDown();
            }
            return true;
        }
    }

    @Override
    public String toString() {
        return "ChoreographySession(" + type.wireName() + ", " + timing + ")";
    }
}
