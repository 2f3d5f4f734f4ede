package com.questrail.sirius.internal.dispatch;

import com.questrail.sirius.api.DeviceId;
import com.questrail.sirius.api.Rgb;
import com.questrail.sirius.command.CommandPayload;
import com.questrail.sirius.command.LedCommand;
import com.questrail.sirius.config.LedTimingPolicy;
import com.questrail.sirius.internal.bridge.AsyncBridge;
import com.questrail.sirius.internal.state.ConnectionRegistry;
import com.questrail.sirius.observability.CommandFailure;
import com.questrail.sirius.observability.CommandResultEvent;
import com.questrail.sirius.observability.RecordingObservabilitySink;
import com.questrail.sirius.transport.FakeTransportPort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CommandDispatcherTest
 * -----------------------------------------------------------------------------
 * Ordering, pacing, connection awareness, ambient suppression and the
 * timeout and write-failure policies of the dispatcher worker.
 */
class CommandDispatcherTest {

    private FakeTransportPort transport;
    private ConnectionRegistry registry;
    private AsyncBridge bridge;
    private AtomicBoolean ambient;
    private RecordingObservabilitySink sink;
    private CommandDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        transport = new FakeTransportPort();
        registry = new ConnectionRegistry();
        ambient = new AtomicBoolean(false);
        sink = new RecordingObservabilitySink();

        LedTimingPolicy timing = LedTimingPolicy.defaults().withCommandTimeout(Duration.ofMillis(200));
        bridge = new AsyncBridge(Duration.ofMillis(500), Duration.ofSeconds(1), sink);
        bridge.start();
        dispatcher = new CommandDispatcher(bridge, registry, timing, ambient::get,
                new WriteFailureTracker(), sink);

        registry.markConnected(DeviceId.LEFT, transport.connectNow(DeviceId.LEFT));
    }

    @AfterEach
    void tearDown() {
        dispatcher.stop();
        bridge.stop();
    }

    @Test
    void deliversInEnqueueOrderWithPacing() throws Exception {
        CompletableFuture<Boolean> colorDone = new CompletableFuture<>();
        CompletableFuture<Boolean> modeDone = new CompletableFuture<>();

        dispatcher.enqueue(new LedCommand(DeviceId.LEFT, new CommandPayload.Color(Rgb.of(255, 0, 0)), 0L,
                colorDone::complete));
        dispatcher.enqueue(new LedCommand(DeviceId.LEFT, new CommandPayload.Mode(false), 0L,
                modeDone::complete));

        assertTrue(colorDone.get(2, TimeUnit.SECONDS));
        assertTrue(modeDone.get(2, TimeUnit.SECONDS));

        List<FakeTransportPort.Write> writes = transport.writesFor(DeviceId.LEFT);
        assertEquals(List.of("C:255,0,0", "M:0"), transport.linesFor(DeviceId.LEFT));
        long gap = writes.get(1).atNanos() - writes.get(0).atNanos();
        assertTrue(gap >= TimeUnit.MILLISECONDS.toNanos(95), "Commands must be spaced, gap was " + gap);
    }

    @Test
    void longSequenceKeepsOrder() throws Exception {
        CountDownLatch done = new CountDownLatch(5);
        for (int hue = 0; hue < 5; hue++) {
            dispatcher.enqueue(new LedCommand(DeviceId.LEFT, new CommandPayload.Hue(hue * 10), 0L,
                    ok -> done.countDown()));
        }

        assertTrue(done.await(3, TimeUnit.SECONDS));
        assertEquals(List.of("H:0", "H:10", "H:20", "H:30", "H:40"), transport.linesFor(DeviceId.LEFT));
    }

    @Test
    void writesHappenOnTheBridgeThread() throws Exception {
        CompletableFuture<Boolean> done = new CompletableFuture<>();
        dispatcher.enqueue(new LedCommand(DeviceId.LEFT, new CommandPayload.Hue(1), 0L, done::complete));

        assertTrue(done.get(2, TimeUnit.SECONDS));
        assertEquals("sirius-async-bridge", transport.writes().get(0).thread());
    }

    @Test
    void disconnectedDeviceIsSkippedWithFailedCallback() throws Exception {
        CompletableFuture<Boolean> done = new CompletableFuture<>();

        dispatcher.enqueue(new LedCommand(DeviceId.RIGHT, new CommandPayload.Mode(true), 0L, done::complete));

        assertFalse(done.get(2, TimeUnit.SECONDS));
        assertTrue(transport.linesFor(DeviceId.RIGHT).isEmpty());
        CommandResultEvent result = sink.getCommandResults().get(0);
        assertEquals(Optional.of(CommandFailure.NOT_CONNECTED), result.failure());
    }

    @Test
    void ambientModeDropsColorWithoutCallback() throws Exception {
        ambient.set(true);
        AtomicInteger colorCallbacks = new AtomicInteger();
        CompletableFuture<Boolean> transitionDone = new CompletableFuture<>();

        dispatcher.enqueue(new LedCommand(DeviceId.LEFT, new CommandPayload.Color(Rgb.RED), 0L,
                ok -> colorCallbacks.incrementAndGet()));
        dispatcher.enqueue(new LedCommand(DeviceId.LEFT, new CommandPayload.Transition(Rgb.BLUE, 100), 0L,
                transitionDone::complete));

        assertTrue(transitionDone.get(2, TimeUnit.SECONDS));
        assertEquals(List.of("T:0,0,255,100"), transport.linesFor(DeviceId.LEFT));
        assertEquals(0, colorCallbacks.get());
    }

    @Test
    void timeoutMarksDeviceDisconnected() throws Exception {
        transport.hangWrites(DeviceId.LEFT, true);
        CompletableFuture<Boolean> done = new CompletableFuture<>();

        dispatcher.enqueue(new LedCommand(DeviceId.LEFT, new CommandPayload.Hue(5), 0L, done::complete));

        assertFalse(done.get(2, TimeUnit.SECONDS));
        assertFalse(registry.isConnected(DeviceId.LEFT));
        assertTrue(sink.getCommandResults().stream()
                .anyMatch(r -> r.failure().equals(Optional.of(CommandFailure.TIMEOUT))));
    }

    @Test
    void singleWriteErrorKeepsConnection() throws Exception {
        transport.failNextWrites(DeviceId.LEFT, 1);
        CompletableFuture<Boolean> first = new CompletableFuture<>();
        CompletableFuture<Boolean> second = new CompletableFuture<>();

        dispatcher.enqueue(new LedCommand(DeviceId.LEFT, new CommandPayload.Hue(1), 0L, first::complete));
        dispatcher.enqueue(new LedCommand(DeviceId.LEFT, new CommandPayload.Hue(2), 0L, second::complete));

        assertFalse(first.get(2, TimeUnit.SECONDS));
        assertTrue(second.get(2, TimeUnit.SECONDS));
        assertTrue(registry.isConnected(DeviceId.LEFT));
        assertEquals(List.of("H:2"), transport.linesFor(DeviceId.LEFT));
    }

    @Test
    void repeatedWriteErrorsDisconnect() throws Exception {
        transport.failNextWrites(DeviceId.LEFT, 3);
        CountDownLatch done = new CountDownLatch(3);

        for (int i = 0; i < 3; i++) {
            dispatcher.enqueue(new LedCommand(DeviceId.LEFT, new CommandPayload.Hue(i), 0L, ok -> done.countDown()));
        }

        assertTrue(done.await(3, TimeUnit.SECONDS));
        assertFalse(registry.isConnected(DeviceId.LEFT));
        long transportErrors = sink.getCommandResults().stream()
                .filter(r -> r.failure().equals(Optional.of(CommandFailure.TRANSPORT_ERROR)))
                .count();
        assertEquals(3, transportErrors);
    }

    @Test
    void stopDiscardsQueuedAndRejectsLater() throws Exception {
        AtomicInteger callbacks = new AtomicInteger();
        for (int i = 0; i < 20; i++) {
            dispatcher.enqueue(new LedCommand(DeviceId.LEFT, new CommandPayload.Hue(i), 0L,
                    ok -> callbacks.incrementAndGet()));
        }

        dispatcher.stop();

        assertEquals(0, dispatcher.pendingCount());
        assertTrue(transport.linesFor(DeviceId.LEFT).size() < 20);

        CompletableFuture<Boolean> late = new CompletableFuture<>();
        dispatcher.enqueue(new LedCommand(DeviceId.LEFT, new CommandPayload.Hue(99), 0L, late::complete));
        assertFalse(late.get(1, TimeUnit.SECONDS));
        assertFalse(dispatcher.isRunning());
    }

    @Test
    void hungWriteOnOneDeviceLeavesTheOtherConnected() throws Exception {
        registry.markConnected(DeviceId.RIGHT, transport.connectNow(DeviceId.RIGHT));
        transport.hangWrites(DeviceId.LEFT, true);
        CompletableFuture<Boolean> left = new CompletableFuture<>();
        CompletableFuture<Boolean> right = new CompletableFuture<>();

        dispatcher.enqueue(new LedCommand(DeviceId.LEFT, new CommandPayload.Hue(1), 0L, left::complete));
        dispatcher.enqueue(new LedCommand(DeviceId.RIGHT, new CommandPayload.Hue(2), 0L, right::complete));

        assertFalse(left.get(2, TimeUnit.SECONDS));
        assertTrue(right.get(2, TimeUnit.SECONDS));
        assertFalse(registry.isConnected(DeviceId.LEFT));
        assertTrue(registry.isConnected(DeviceId.RIGHT));
        assertEquals(List.of("H:2"), transport.linesFor(DeviceId.RIGHT));
        assertTrue(sink.getCommandResults().stream()
                .noneMatch(r -> r.device() == DeviceId.RIGHT && r.failure().isPresent()));
    }

    @Test
    void timeQueuedBehindASlowUnitIsNotATimeout() throws Exception {
        // occupies the bridge for longer than commandTimeout but within unitTimeout
        bridge.execute(() -> new CompletableFuture<Void>().completeOnTimeout(null, 350, TimeUnit.MILLISECONDS));
        CompletableFuture<Boolean> done = new CompletableFuture<>();

        dispatcher.enqueue(new LedCommand(DeviceId.LEFT, new CommandPayload.Mode(true), 0L, done::complete));

        assertTrue(done.get(2, TimeUnit.SECONDS));
        assertTrue(registry.isConnected(DeviceId.LEFT));
        assertEquals(List.of("M:1"), transport.linesFor(DeviceId.LEFT));
    }
}
