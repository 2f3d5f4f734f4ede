package com.questrail.sirius.api;

import java.util.Objects;

/**
 * User-facing device settings applied in one step.
 *
 * <p>In auto mode the firmware cycles hue on its own and only the mode switch is
 * sent. In fixed mode only the colour is sent; the firmware leaves auto mode when
 * it receives a colour.</p>
 *
 * @param autoMode automatic hue cycling
 * @param color    fixed colour, used when {@code autoMode} is false
 * @param hue      hue 0-255, kept for callers that track it; not sent by apply
 */
public record DeviceSettings(boolean autoMode, Rgb color, int hue)
{
    public DeviceSettings {
        Objects.requireNonNull(color, "color");
        if (hue < 0 || hue > 255) {
            throw new IllegalArgumentException("hue must be 0-255, was " + hue);
        }
    }

    public static DeviceSettings auto() {
        return new DeviceSettings(true, Rgb.OFF, 0);
    }

    public static DeviceSettings fixed(Rgb color) {
        return new DeviceSettings(false, color, 0);
    }
}
