package com.questrail.sirius.choreography;

import com.questrail.sirius.api.AnimationType;
import com.questrail.sirius.api.Rgb;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * User colour overrides per animation type. Types without an override use
 * {@link AnimationType#defaultColor()}.
 */
public final class AnimationColorTable
{
    private final ConcurrentMap<AnimationType, Rgb> overrides = new ConcurrentHashMap<>();

    public Rgb colorFor(AnimationType type) {
        Objects.requireNonNull(type, "type");
        return overrides.getOrDefault(type, type.defaultColor());
    }

    public void set(AnimationType type, Rgb color) {
        overrides.put(Objects.requireNonNull(type, "type"), Objects.requireNonNull(color, "color"));
    }

    public void reset(AnimationType type) {
        overrides.remove(type);
    }
}
