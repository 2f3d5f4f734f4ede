package com.questrail.sirius.api;

import java.util.Locale;
import java.util.Optional;

/**
 * AnimationType
 * -----------------------------------------------------------------------------
 * The closed set of choreographed sequences.
 *
 * <p>Each type names the routine that drives it, the side it blinks (turn
 * signals only) and its built-in colour. User overrides of the colour live in
 * the choreography engine's colour table, not here.</p>
 */
public enum AnimationType
{
    LEFT_TURN("left_turn", Routine.TURN_SIGNAL, DeviceId.LEFT, Rgb.AMBER),
    RIGHT_TURN("right_turn", Routine.TURN_SIGNAL, DeviceId.RIGHT, Rgb.AMBER),
    LANE_CHANGE_LEFT("lane_change_left", Routine.TURN_SIGNAL, DeviceId.LEFT, Rgb.AMBER),
    LANE_CHANGE_RIGHT("lane_change_right", Routine.TURN_SIGNAL, DeviceId.RIGHT, Rgb.AMBER),
    HAZARD("hazard", Routine.FLASH, null, Rgb.AMBER),
    THANK_YOU("thank_you", Routine.FLASH, null, Rgb.AMBER),
    EMERGENCY("emergency", Routine.FLASH, null, Rgb.RED),
    FORWARD("forward", Routine.MOVE, null, Rgb.BLUE),
    REVERSE("reverse", Routine.MOVE, null, Rgb.WHITE);

    /** The worker shape that plays a type. */
    public enum Routine {
        /** One side blinks; the other is held dark. */
        TURN_SIGNAL,
        /** Both sides blink in lockstep. */
        FLASH,
        /** Both sides fade in once and fade out. */
        MOVE
    }

    private final String wireName;
    private final Routine routine;
    private final DeviceId side;
    private final Rgb defaultColor;

    AnimationType(String wireName, Routine routine, DeviceId side, Rgb defaultColor) {
        this.wireName = wireName;
        this.routine = routine;
        this.side = side;
        this.defaultColor = defaultColor;
    }

    /** External name, e.g. {@code "left_turn"}. */
    public String wireName() {
        return wireName;
    }

    public Routine routine() {
        return routine;
    }

    /** The blinking side; present only for {@link Routine#TURN_SIGNAL}. */
    public Optional<DeviceId> side() {
        return Optional.ofNullable(side);
    }

    public Rgb defaultColor() {
        return defaultColor;
    }

    /**
     * Resolves an external name; matching is case-insensitive.
     *
     * @return empty for an unknown name
     */
    public static Optional<AnimationType> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (AnimationType type : values()) {
            if (type.wireName.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
