package com.questrail.sirius.api;

import com.questrail.sirius.choreography.AnimationOptions;
import com.questrail.sirius.choreography.ChoreographyState;
import com.questrail.sirius.command.BatchEntry;
import com.questrail.sirius.command.CommandPayload;
import com.questrail.sirius.command.CompletionCallback;
import com.questrail.sirius.command.FanOutResult;
import com.questrail.sirius.command.WireCommandException;
import com.questrail.sirius.config.AfterAnimationPolicy;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * LedController
 * -----------------------------------------------------------------------------
 * Caller-facing boundary of the LED command core.
 *
 * <p>Every method returns without waiting for the device. Single-device commands
 * are queued and paced; batch operations go out together; outcomes arrive
 * through callbacks, futures and the observability sink.</p>
 *
 * <h2>Callbacks</h2>
 * A {@link CompletionCallback} may be {@code null}. Callbacks run on a
 * controller worker thread and must not block.
 *
 * <h2>What this interface does not do</h2>
 * <ul>
 *   <li>Retry: a failed command is reported once and dropped.</li>
 *   <li>Reconnect: a dropped device stays disconnected until
 *       {@link #scanAndConnect} is called again.</li>
 * </ul>
 */
public interface LedController
{
    // ---------------------------------------------------------------------
    // Queued single-device commands
    // ---------------------------------------------------------------------

    void enqueueCommand(DeviceId device, CommandPayload payload, CompletionCallback onComplete);

    void setRgbColor(DeviceId device, Rgb color, CompletionCallback onComplete);

    void setMode(DeviceId device, boolean auto, CompletionCallback onComplete);

    void setHue(DeviceId device, int hue, CompletionCallback onComplete);

    void setTransitionColor(DeviceId device, Rgb color, int durationMs, CompletionCallback onComplete);

    /**
     * Auto mode sends {@code M:1} only; fixed mode sends {@code C:r,g,b} only.
     */
    void applySettings(DeviceId device, DeviceSettings settings, CompletionCallback onComplete);

    /**
     * Parses a raw command line such as {@code T:0,255,0,500} and queues it.
     *
     * @throws WireCommandException if the line is malformed
     */
    void enqueueRaw(DeviceId device, String line, CompletionCallback onComplete);

    // ---------------------------------------------------------------------
    // Simultaneous batches
    // ---------------------------------------------------------------------

    /**
     * Applies settings to every connected device at once. With no device
     * connected the callback receives {@code false}.
     */
    void applySettingsToBoth(DeviceSettings settings, CompletionCallback onComplete);

    CompletableFuture<FanOutResult> sendSimultaneously(List<BatchEntry> batch, CompletionCallback onComplete);

    // ---------------------------------------------------------------------
    // Choreography
    // ---------------------------------------------------------------------

    boolean startAnimation(AnimationType type, AnimationOptions options);

    /**
     * @return false for an unknown name
     */
    boolean startAnimation(String name, AnimationOptions options);

    void stopAnimation();

    ChoreographyState animationState();

    void setAfterAnimationPolicy(AfterAnimationPolicy policy);

    void setCustomColor(AnimationType type, Rgb color);

    Rgb customColor(AnimationType type);

    /** Drops a user colour so the type's built-in colour applies again. */
    void resetCustomColor(AnimationType type);

    // ---------------------------------------------------------------------
    // Ambient colour
    // ---------------------------------------------------------------------

    void setAmbientMode(boolean enabled);

    boolean ambientMode();

    /**
     * Fades every connected device to {@code color}. Ignored while ambient mode
     * is off.
     */
    void updateAmbientColor(Rgb color);

    // ---------------------------------------------------------------------
    // Connections
    // ---------------------------------------------------------------------

    boolean isConnected(DeviceId device);

    /**
     * Discovers the device by its advertised name and connects to it.
     *
     * @return true once connected; false if not found or the link failed
     */
    CompletableFuture<Boolean> scanAndConnect(DeviceId device);

    /**
     * @return false if the device was not connected
     */
    CompletableFuture<Boolean> disconnect(DeviceId device);

    /**
     * Asks the link whether the device is still reachable and updates the
     * connected flag to match.
     */
    CompletableFuture<Boolean> checkConnection(DeviceId device);

    CompletableFuture<Map<DeviceId, Boolean>> checkAllConnections();
}
