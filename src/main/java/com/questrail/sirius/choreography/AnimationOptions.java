package com.questrail.sirius.choreography;

import java.time.Duration;
import java.util.Optional;

/**
 * Caller overrides for one choreography session. Absent values take the
 * per-type default.
 *
 * @param speed        hold time per half-cycle
 * @param cycles       blink count; ignored by motion pulses
 * @param transitionMs on-device fade duration
 */
public record AnimationOptions(Optional<Duration> speed, Optional<Integer> cycles, Optional<Integer> transitionMs)
{
    private static final AnimationOptions DEFAULTS =
            new AnimationOptions(Optional.empty(), Optional.empty(), Optional.empty());

    public AnimationOptions {
        speed.ifPresent(s -> {
            if (s.isNegative()) {
                throw new IllegalArgumentException("speed must be non-negative");
            }
        });
        cycles.ifPresent(c -> {
            if (c < 1) {
                throw new IllegalArgumentException("cycles must be >= 1");
            }
        });
        transitionMs.ifPresent(t -> {
            if (t < 0) {
                throw new IllegalArgumentException("transitionMs must be non-negative");
            }
        });
    }

    public static AnimationOptions defaults() {
        return DEFAULTS;
    }

    public AnimationOptions withSpeed(Duration s) {
        return new AnimationOptions(Optional.of(s), cycles, transitionMs);
    }

    public AnimationOptions withCycles(int c) {
        return new AnimationOptions(speed, Optional.of(c), transitionMs);
    }

    public AnimationOptions withTransitionMs(int t) {
        return new AnimationOptions(speed, cycles, Optional.of(t));
    }
}
