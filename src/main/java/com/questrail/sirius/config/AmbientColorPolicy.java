package com.questrail.sirius.config;

/**
 * Ambient colour mode. While enabled, an external producer owns the colour and
 * ordinary COLOR commands are dropped by the dispatcher.
 *
 * @param transitionMs fade used for each ambient colour update
 */
public record AmbientColorPolicy(boolean enabled, int transitionMs) {

    public AmbientColorPolicy {
        if (transitionMs < 0) {
            throw new IllegalArgumentException("transitionMs must be non-negative");
        }
    }

    public static AmbientColorPolicy off() {
        return new AmbientColorPolicy(false, 100);
    }

    public AmbientColorPolicy withEnabled(boolean on) {
        return new AmbientColorPolicy(on, transitionMs);
    }
}
