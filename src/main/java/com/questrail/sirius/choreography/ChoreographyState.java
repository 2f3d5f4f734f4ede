package com.questrail.sirius.choreography;

import com.questrail.sirius.api.AnimationType;

import java.util.Objects;

/**
 * Choreography engine state: {@link Idle} or {@link Running}.
 */
public sealed interface ChoreographyState permits ChoreographyState.Idle, ChoreographyState.Running
{
    Idle IDLE = new Idle();

    default boolean isRunning() {
        return this instanceof Running;
    }

    record Idle() implements ChoreographyState {
    }

    record Running(AnimationType type) implements ChoreographyState {
        public Running {
            Objects.requireNonNull(type, "type");
        }
    }
}
