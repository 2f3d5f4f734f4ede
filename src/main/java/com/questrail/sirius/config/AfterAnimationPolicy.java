package com.questrail.sirius.config;

import com.questrail.sirius.api.Rgb;

import java.util.Objects;

/**
 * What every connected device shows once a choreography session ends.
 *
 * <p>Enabled: the user's resting colour in fixed mode. Disabled: near-off.</p>
 */
public record AfterAnimationPolicy(boolean enabled, Rgb restingColor) {

    public AfterAnimationPolicy {
        Objects.requireNonNull(restingColor, "restingColor");
    }

    public static AfterAnimationPolicy disabled() {
        return new AfterAnimationPolicy(false, Rgb.NEAR_OFF);
    }

    public static AfterAnimationPolicy resting(Rgb color) {
        return new AfterAnimationPolicy(true, color);
    }

    /** The colour to latch when a session ends. */
    public Rgb finalColor() {
        return enabled ? restingColor : Rgb.NEAR_OFF;
    }
}
