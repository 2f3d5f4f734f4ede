package com.questrail.sirius.runtime;

import com.questrail.sirius.api.AnimationType;
import com.questrail.sirius.api.DeviceId;
import com.questrail.sirius.api.DeviceSettings;
import com.questrail.sirius.api.Rgb;
import com.questrail.sirius.choreography.AnimationOptions;
import com.questrail.sirius.choreography.ChoreographyState;
import com.questrail.sirius.command.BatchEntry;
import com.questrail.sirius.command.CommandPayload;
import com.questrail.sirius.command.FanOutResult;
import com.questrail.sirius.command.WireCommandException;
import com.questrail.sirius.config.AmbientColorPolicy;
import com.questrail.sirius.config.AnimationDefaults;
import com.questrail.sirius.config.SiriusRuntimeConfig;
import com.questrail.sirius.observability.ConnectionStatusEvent;
import com.questrail.sirius.observability.RecordingObservabilitySink;
import com.questrail.sirius.time.DeterministicScheduler;
import com.questrail.sirius.time.ManualMonotonicClock;
import com.questrail.sirius.transport.FakeTransportPort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SiriusLedRuntimeTest
 * -----------------------------------------------------------------------------
 * End-to-end behaviour through the public controller surface with an in-memory
 * transport.
 */
class SiriusLedRuntimeTest {

    private FakeTransportPort transport;
    private RecordingObservabilitySink sink;
    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private SiriusLedRuntime runtime;

    @BeforeEach
    void setUp() {
        transport = new FakeTransportPort();
        sink = new RecordingObservabilitySink();
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);

        SiriusRuntimeConfig config = SiriusRuntimeConfig.builder()
                .withAnimationDefaults(new AnimationDefaults(
                        Duration.ofMillis(20), Duration.ofMillis(10), Duration.ofMillis(20), 6, 3, 300))
                .withAmbientColorPolicy(new AmbientColorPolicy(false, 250))
                .build();

        runtime = SiriusLedRuntime.builder()
                .withConfig(config)
                .withTransport(transport)
                .withObservabilitySink(sink)
                .withClock(clock)
                .withScheduler(scheduler)
                .build();
        runtime.start();
    }

    @AfterEach
    void tearDown() {
        runtime.stop();
    }

    private void connectBoth() throws Exception {
        assertTrue(runtime.scanAndConnect(DeviceId.LEFT).get(2, TimeUnit.SECONDS));
        assertTrue(runtime.scanAndConnect(DeviceId.RIGHT).get(2, TimeUnit.SECONDS));
    }

    private static CompletableFuture<Boolean> callback() {
        return new CompletableFuture<>();
    }

    @Test
    void scanAndConnectFindsDeviceByAdvertisedName() throws Exception {
        connectBoth();

        assertTrue(runtime.isConnected(DeviceId.LEFT));
        assertTrue(runtime.isConnected(DeviceId.RIGHT));
        assertEquals(2, sink.eventsOfType(ConnectionStatusEvent.class).stream()
                .filter(ConnectionStatusEvent::connected).count());
    }

    @Test
    void scanReportsFalseWhenDeviceIsNotAdvertising() throws Exception {
        transport.stopAdvertising(DeviceId.RIGHT);

        assertFalse(runtime.scanAndConnect(DeviceId.RIGHT).get(2, TimeUnit.SECONDS));
        assertFalse(runtime.isConnected(DeviceId.RIGHT));
    }

    @Test
    void queuedCommandsArriveInOrderAndPaced() throws Exception {
        connectBoth();
        CompletableFuture<Boolean> first = callback();
        CompletableFuture<Boolean> second = callback();

        runtime.setRgbColor(DeviceId.LEFT, Rgb.of(255, 0, 0), first::complete);
        runtime.setMode(DeviceId.LEFT, false, second::complete);

        assertTrue(first.get(2, TimeUnit.SECONDS));
        assertTrue(second.get(2, TimeUnit.SECONDS));

        List<FakeTransportPort.Write> writes = transport.writesFor(DeviceId.LEFT);
        assertEquals(List.of("C:255,0,0", "M:0"), transport.linesFor(DeviceId.LEFT));
        assertTrue(writes.get(1).atNanos() - writes.get(0).atNanos() >= TimeUnit.MILLISECONDS.toNanos(95));
    }

    @Test
    void simultaneousTransitionReachesBothDevices() throws Exception {
        connectBoth();
        CompletableFuture<Boolean> done = callback();
        CommandPayload blue = new CommandPayload.Transition(Rgb.BLUE, 500);

        FanOutResult result = runtime.sendSimultaneously(List.of(
                new BatchEntry(DeviceId.LEFT, blue),
                new BatchEntry(DeviceId.RIGHT, blue)), done::complete).get(2, TimeUnit.SECONDS);

        assertTrue(result.success());
        assertTrue(done.get(2, TimeUnit.SECONDS));
        assertEquals(List.of("T:0,0,255,500"), transport.linesFor(DeviceId.LEFT));
        assertEquals(List.of("T:0,0,255,500"), transport.linesFor(DeviceId.RIGHT));
    }

    @Test
    void emergencyRunsUntilStopped() throws Exception {
        connectBoth();

        assertTrue(runtime.startAnimation("emergency", AnimationOptions.defaults()
                .withSpeed(Duration.ofSeconds(5))));
        assertEquals(new ChoreographyState.Running(AnimationType.EMERGENCY), runtime.animationState());

        runtime.stopAnimation();

        assertEquals(ChoreographyState.IDLE, runtime.animationState());
        assertFalse(runtime.startAnimation("moonwalk", AnimationOptions.defaults()));
    }

    @Test
    void autoSettingsSendOnlyTheModeSwitch() throws Exception {
        connectBoth();
        CompletableFuture<Boolean> done = callback();

        runtime.applySettings(DeviceId.RIGHT, DeviceSettings.auto(), done::complete);

        assertTrue(done.get(2, TimeUnit.SECONDS));
        assertEquals(List.of("M:1"), transport.linesFor(DeviceId.RIGHT));
    }

    @Test
    void fixedSettingsToBothSendTheColour() throws Exception {
        connectBoth();
        CompletableFuture<Boolean> done = callback();

        runtime.applySettingsToBoth(DeviceSettings.fixed(Rgb.of(10, 20, 30)), done::complete);

        assertTrue(done.get(2, TimeUnit.SECONDS));
        assertEquals(List.of("C:10,20,30"), transport.linesFor(DeviceId.LEFT));
        assertEquals(List.of("C:10,20,30"), transport.linesFor(DeviceId.RIGHT));
    }

    @Test
    void settingsToBothWithNothingConnectedFails() throws Exception {
        CompletableFuture<Boolean> done = callback();

        runtime.applySettingsToBoth(DeviceSettings.fixed(Rgb.BLUE), done::complete);

        assertFalse(done.get(1, TimeUnit.SECONDS));
        assertTrue(transport.writes().isEmpty());
    }

    @Test
    void ambientUpdatesFadeConnectedDevicesOnlyWhileEnabled() throws Exception {
        connectBoth();

        runtime.updateAmbientColor(Rgb.WHITE);
        runtime.setAmbientMode(true);
        runtime.updateAmbientColor(Rgb.of(1, 2, 3));
        runtime.checkConnection(DeviceId.LEFT).get(2, TimeUnit.SECONDS);

        assertTrue(runtime.ambientMode());
        assertEquals(List.of("T:1,2,3,250"), transport.linesFor(DeviceId.LEFT));
        assertEquals(List.of("T:1,2,3,250"), transport.linesFor(DeviceId.RIGHT));
    }

    @Test
    void startingAnimationLeavesAmbientMode() throws Exception {
        connectBoth();
        runtime.setAmbientMode(true);

        runtime.startAnimation(AnimationType.HAZARD, AnimationOptions.defaults().withSpeed(Duration.ofSeconds(5)));

        assertFalse(runtime.ambientMode());
    }

    @Test
    void checkConnectionNoticesDroppedLink() throws Exception {
        connectBoth();
        transport.dropLink(DeviceId.LEFT);

        Map<DeviceId, Boolean> status = runtime.checkAllConnections().get(2, TimeUnit.SECONDS);

        assertEquals(Map.of(DeviceId.LEFT, false, DeviceId.RIGHT, true), status);
        assertFalse(runtime.isConnected(DeviceId.LEFT));
        assertTrue(runtime.isConnected(DeviceId.RIGHT));
    }

    @Test
    void disconnectReleasesTheLink() throws Exception {
        connectBoth();

        assertTrue(runtime.disconnect(DeviceId.RIGHT).get(2, TimeUnit.SECONDS));

        assertFalse(runtime.isConnected(DeviceId.RIGHT));
        assertFalse(runtime.disconnect(DeviceId.RIGHT).get(2, TimeUnit.SECONDS));
        assertFalse(runtime.checkConnection(DeviceId.RIGHT).get(2, TimeUnit.SECONDS));
    }

    @Test
    void malformedRawLineIsRejectedUpFront() {
        assertThrows(WireCommandException.class, () -> runtime.enqueueRaw(DeviceId.LEFT, "C:300,0,0", null));
        assertThrows(WireCommandException.class, () -> runtime.enqueueRaw(DeviceId.LEFT, "X:1", null));
    }

    @Test
    void rawLineIsSentVerbatim() throws Exception {
        connectBoth();
        CompletableFuture<Boolean> done = callback();

        runtime.enqueueRaw(DeviceId.LEFT, "H:128", done::complete);

        assertTrue(done.get(2, TimeUnit.SECONDS));
        assertEquals(List.of("H:128"), transport.linesFor(DeviceId.LEFT));
    }

    @Test
    void stopClosesTransportAndRejectsRestart() {
        runtime.stop();

        assertTrue(transport.isClosed());
        assertThrows(IllegalStateException.class, runtime::start);
    }
}
