package com.questrail.sirius.choreography;

import com.questrail.sirius.api.AnimationType;
import com.questrail.sirius.config.AnimationDefaults;

import java.time.Duration;
import java.util.Objects;

/**
 * Resolved timing for one session.
 *
 * <table>
 *   <caption>Per-type defaults</caption>
 *   <tr><th>type</th><th>speed</th><th>cycles</th><th>transition</th></tr>
 *   <tr><td>left/right turn, hazard</td><td>default</td><td>default</td><td>default</td></tr>
 *   <tr><td>lane change, thank you</td><td>default</td><td>short</td><td>default</td></tr>
 *   <tr><td>emergency</td><td>fast</td><td>2 x default</td><td>default / 2</td></tr>
 *   <tr><td>forward, reverse</td><td>slow</td><td>1</td><td>default</td></tr>
 * </table>
 */
public record AnimationTiming(Duration speed, int cycles, int transitionMs)
{
    public AnimationTiming {
        Objects.requireNonNull(speed, "speed");
        if (cycles < 1) {
            throw new IllegalArgumentException("cycles must be >= 1");
        }
        if (transitionMs < 0) {
            throw new IllegalArgumentException("transitionMs must be non-negative");
        }
    }

    public static AnimationTiming resolve(AnimationType type, AnimationDefaults d, AnimationOptions options) {
        Duration speed = switch (type) {
            case EMERGENCY -> d.fastSpeed();
            case FORWARD, REVERSE -> d.slowSpeed();
            default -> d.defaultSpeed();
        };
        int cycles = switch (type) {
            case LANE_CHANGE_LEFT, LANE_CHANGE_RIGHT, THANK_YOU -> d.shortCycles();
            case EMERGENCY -> d.defaultCycles() * 2;
            case FORWARD, REVERSE -> 1;
            default -> d.defaultCycles();
        };
        int transition = type == AnimationType.EMERGENCY
                ? d.defaultTransitionMs() / 2
                : d.defaultTransitionMs();

        return new AnimationTiming(
                options.speed().orElse(speed),
                options.cycles().orElse(cycles),
                options.transitionMs().orElse(transition));
    }
}
