package com.questrail.sirius.observability;

import com.questrail.sirius.api.AnimationType;

import java.time.Instant;

/**
 * A choreography session started or stopped.
 */
public record AnimationEvent(
    Instant timestamp,
    Phase phase,
    AnimationType type
) {
    public enum Phase { STARTED, STOPPED }
}
