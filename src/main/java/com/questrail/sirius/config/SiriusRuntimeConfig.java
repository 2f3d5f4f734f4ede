package com.questrail.sirius.config;

import java.util.Objects;

/**
 * Aggregated configuration for the controller runtime.
 */
public record SiriusRuntimeConfig(
    LedTimingPolicy timingPolicy,
    AnimationDefaults animationDefaults,
    AfterAnimationPolicy afterAnimationPolicy,
    AmbientColorPolicy ambientColorPolicy
) {
    public SiriusRuntimeConfig {
        Objects.requireNonNull(timingPolicy, "timingPolicy");
        Objects.requireNonNull(animationDefaults, "animationDefaults");
        Objects.requireNonNull(afterAnimationPolicy, "afterAnimationPolicy");
        Objects.requireNonNull(ambientColorPolicy, "ambientColorPolicy");
    }

    public static SiriusRuntimeConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private LedTimingPolicy timingPolicy = LedTimingPolicy.defaults();
        private AnimationDefaults animationDefaults = AnimationDefaults.defaults();
        private AfterAnimationPolicy afterAnimationPolicy = AfterAnimationPolicy.disabled();
        private AmbientColorPolicy ambientColorPolicy = AmbientColorPolicy.off();

        public Builder withTimingPolicy(LedTimingPolicy timingPolicy) {
            this.timingPolicy = timingPolicy;
            return this;
        }

        public Builder withAnimationDefaults(AnimationDefaults animationDefaults) {
            this.animationDefaults = animationDefaults;
            return this;
        }

        public Builder withAfterAnimationPolicy(AfterAnimationPolicy policy) {
            this.afterAnimationPolicy = policy;
            return this;
        }

        public Builder withAmbientColorPolicy(AmbientColorPolicy policy) {
            this.ambientColorPolicy = policy;
            return this;
        }

        public SiriusRuntimeConfig build() {
            return new SiriusRuntimeConfig(timingPolicy, animationDefaults, afterAnimationPolicy, ambientColorPolicy);
        }
    }
}
