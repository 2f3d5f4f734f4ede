package com.questrail.sirius.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Base timings from which per-type animation defaults are derived.
 *
 * @param defaultSpeed        hold time per half-cycle for turn signals and hazards
 * @param fastSpeed           hold time per half-cycle for emergency flashing
 * @param slowSpeed           base hold time for motion pulses
 * @param defaultCycles       blink count for turn signals and hazards
 * @param shortCycles         blink count for lane changes and thank-you flashes
 * @param defaultTransitionMs fade duration on the device
 */
public record AnimationDefaults(
        Duration defaultSpeed,
        Duration fastSpeed,
        Duration slowSpeed,
        int defaultCycles,
        int shortCycles,
        int defaultTransitionMs
) {
    public AnimationDefaults {
        Objects.requireNonNull(defaultSpeed, "defaultSpeed");
        Objects.requireNonNull(fastSpeed, "fastSpeed");
        Objects.requireNonNull(slowSpeed, "slowSpeed");
        if (defaultSpeed.isNegative() || fastSpeed.isNegative() || slowSpeed.isNegative()) {
            throw new IllegalArgumentException("speeds must be non-negative");
        }
        if (defaultCycles < 1 || shortCycles < 1) {
            throw new IllegalArgumentException("cycle counts must be >= 1");
        }
        if (defaultTransitionMs < 0) {
            throw new IllegalArgumentException("defaultTransitionMs must be non-negative");
        }
    }

    /**
     * 0.5s / 0.25s / 0.8s, 6 and 3 cycles, 300ms fades.
     */
    public static AnimationDefaults defaults() {
        return new AnimationDefaults(
                Duration.ofMillis(500),
                Duration.ofMillis(250),
                Duration.ofMillis(800),
                6,
                3,
                300
        );
    }
}
