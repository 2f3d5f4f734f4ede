package com.questrail.sirius.command;

import com.questrail.sirius.api.DeviceId;
import com.questrail.sirius.api.Rgb;

import java.util.Objects;
import java.util.Optional;

/**
 * LedCommand
 * -----------------------------------------------------------------------------
 * One instruction for one device, as held by the dispatcher queue.
 *
 * <p>Immutable. {@code enqueuedAtNanos} is a monotonic stamp taken when the
 * command was created; it is diagnostic only and never orders delivery.</p>
 */
public record LedCommand(DeviceId device,
                         CommandPayload payload,
                         long enqueuedAtNanos,
                         Optional<CompletionCallback> onComplete)
{
    public LedCommand {
        Objects.requireNonNull(device, "device");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(onComplete, "onComplete");
    }

    public LedCommand(DeviceId device, CommandPayload payload, long enqueuedAtNanos, CompletionCallback onComplete) {
        this(device, payload, enqueuedAtNanos, Optional.ofNullable(onComplete));
    }

    public static LedCommand mode(DeviceId device, boolean auto, long nowNanos) {
        return new LedCommand(device, new CommandPayload.Mode(auto), nowNanos, Optional.empty());
    }

    public static LedCommand color(DeviceId device, Rgb rgb, long nowNanos) {
        return new LedCommand(device, new CommandPayload.Color(rgb), nowNanos, Optional.empty());
    }

    public static LedCommand hue(DeviceId device, int hue, long nowNanos) {
        return new LedCommand(device, new CommandPayload.Hue(hue), nowNanos, Optional.empty());
    }

    public static LedCommand transition(DeviceId device, Rgb rgb, int durationMs, long nowNanos) {
        return new LedCommand(device, new CommandPayload.Transition(rgb, durationMs), nowNanos, Optional.empty());
    }

    public CommandKind kind() {
        return payload.kind();
    }

    /** Wire form, e.g. {@code C:255,0,0}. */
    public String wireLine() {
        return WireCommandEncoder.encodeLine(payload);
    }

    /**
     * Reports the outcome to the callback, if one was supplied.
     */
    public void complete(boolean success) {
        onComplete.ifPresent(cb -> cb.onComplete(success));
    }

    @Override
    public String toString() {
        return "LedCommand(" + device + ", " + wireLine() + ")";
    }
}
