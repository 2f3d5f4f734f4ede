package com.questrail.sirius.internal.state;

import com.questrail.sirius.config.AmbientColorPolicy;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The live ambient colour policy, shared by the dispatcher (which drops COLOR
 * commands while it is enabled), the choreography engine (which switches it off)
 * and the facade.
 */
public final class AmbientColorState
{
    private final AtomicReference<AmbientColorPolicy> policy;

    public AmbientColorState(AmbientColorPolicy initial) {
        this.policy = new AtomicReference<>(Objects.requireNonNull(initial, "initial"));
    }

    public AmbientColorPolicy policy() {
        return policy.get();
    }

    public boolean enabled() {
        return policy.get().enabled();
    }

    /**
     * @return the previous enabled flag
     */
    public boolean setEnabled(boolean enabled) {
        return policy.getAndUpdate(p -> p.withEnabled(enabled)).enabled();
    }
}
