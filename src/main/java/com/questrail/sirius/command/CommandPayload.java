package com.questrail.sirius.command;

import com.questrail.sirius.api.Rgb;

import java.util.List;
import java.util.Objects;

/**
 * CommandPayload
 * -----------------------------------------------------------------------------
 * Closed set of payload shapes, one per {@link CommandKind}.
 *
 * <p>Each payload knows its kind and its argument list in wire order. Encoding
 * to bytes lives in {@link WireCommandEncoder}; payloads carry no wire syntax.</p>
 */
public sealed interface CommandPayload
        permits CommandPayload.Mode, CommandPayload.Color, CommandPayload.Hue, CommandPayload.Transition
{
    CommandKind kind();

    /** Arguments in wire order. */
    List<Integer> arguments();

    /** Mode switch: {@code true} selects automatic hue cycling. */
    record Mode(boolean auto) implements CommandPayload {
        @Override public CommandKind kind() { return CommandKind.MODE; }
        @Override public List<Integer> arguments() { return List.of(auto ? 1 : 0); }
    }

    /** Immediate fixed colour. */
    record Color(Rgb rgb) implements CommandPayload {
        public Color {
            Objects.requireNonNull(rgb, "rgb");
        }

        @Override public CommandKind kind() { return CommandKind.COLOR; }
        @Override public List<Integer> arguments() { return List.of(rgb.r(), rgb.g(), rgb.b()); }
    }

    /** Hue on the firmware's 0-255 wheel. */
    record Hue(int hue) implements CommandPayload {
        public Hue {
            if (hue < 0 || hue > 255) {
                throw new IllegalArgumentException("hue must be 0-255, was " + hue);
            }
        }

        @Override public CommandKind kind() { return CommandKind.HUE; }
        @Override public List<Integer> arguments() { return List.of(hue); }
    }

    /** Fade to {@code rgb} over {@code durationMs} milliseconds. */
    record Transition(Rgb rgb, int durationMs) implements CommandPayload {
        public Transition {
            Objects.requireNonNull(rgb, "rgb");
            if (durationMs < 0) {
                throw new IllegalArgumentException("durationMs must be non-negative");
            }
        }

        @Override public CommandKind kind() { return CommandKind.TRANSITION; }
        @Override public List<Integer> arguments() {
            return List.of(rgb.r(), rgb.g(), rgb.b(), durationMs);
        }
    }
}
