package com.questrail.sirius.config;

import java.time.Duration;
import java.util.Objects;

/**
 * LedTimingPolicy
 * -----------------------------------------------------------------------------
 * Operational timing for the command core.
 *
 * <p>These are tuning parameters, not protocol requirements. They control
 * pacing and bounded waits only; they never change which commands are sent.</p>
 *
 * <h2>Parameters</h2>
 * <ul>
 *   <li><b>commandInterval</b> - pause after each dispatched command so the
 *       link is never saturated.</li>
 *   <li><b>commandTimeout</b> - bound on waiting for a single write. Exceeding it
 *       marks the device disconnected.</li>
 *   <li><b>queuePollTimeout</b> - how long the dispatcher blocks on an empty
 *       queue before re-checking its stop signal.</li>
 *   <li><b>unitTimeout</b> - bound on one bridge unit of work, so a driver that
 *       never completes cannot wedge the bridge.</li>
 *   <li><b>workerJoinTimeout</b> - bounded wait when stopping worker threads.</li>
 *   <li><b>preemptionWait</b> - how long a new choreography session waits for
 *       the previous worker to exit.</li>
 *   <li><b>afterAnimationStepDelay</b> - gap between the colour latch and the
 *       mode switch when a session ends.</li>
 *   <li><b>discoveryTimeout</b>, <b>connectTimeout</b> - link establishment.</li>
 *   <li><b>maxConsecutiveWriteFailures</b> - repeated write errors after which
 *       a device is treated as disconnected.</li>
 * </ul>
 */
public record LedTimingPolicy(
        Duration commandInterval,
        Duration commandTimeout,
        Duration queuePollTimeout,
        Duration unitTimeout,
        Duration workerJoinTimeout,
        Duration preemptionWait,
        Duration afterAnimationStepDelay,
        Duration discoveryTimeout,
        Duration connectTimeout,
        int maxConsecutiveWriteFailures
) {
    public LedTimingPolicy {
        requireNonNegative(commandInterval, "commandInterval");
        requirePositive(commandTimeout, "commandTimeout");
        requirePositive(queuePollTimeout, "queuePollTimeout");
        requirePositive(unitTimeout, "unitTimeout");
        requireNonNegative(workerJoinTimeout, "workerJoinTimeout");
        requireNonNegative(preemptionWait, "preemptionWait");
        requireNonNegative(afterAnimationStepDelay, "afterAnimationStepDelay");
        requirePositive(discoveryTimeout, "discoveryTimeout");
        requirePositive(connectTimeout, "connectTimeout");
        if (maxConsecutiveWriteFailures < 1) {
            throw new IllegalArgumentException("maxConsecutiveWriteFailures must be >= 1");
        }
    }

    /**
     * Defaults observed on the reference hardware:
     * <ul>
     *   <li>commandInterval: 100ms</li>
     *   <li>commandTimeout: 5s</li>
     *   <li>queuePollTimeout: 500ms</li>
     *   <li>unitTimeout: 30s</li>
     *   <li>workerJoinTimeout: 1s</li>
     *   <li>preemptionWait: 100ms</li>
     *   <li>afterAnimationStepDelay: 100ms</li>
     *   <li>discoveryTimeout: 5s, connectTimeout: 10s</li>
     *   <li>maxConsecutiveWriteFailures: 3</li>
     * </ul>
     */
    public static LedTimingPolicy defaults() {
        return new LedTimingPolicy(
                Duration.ofMillis(100),
                Duration.ofSeconds(5),
                Duration.ofMillis(500),
                Duration.ofSeconds(30),
                Duration.ofSeconds(1),
                Duration.ofMillis(100),
                Duration.ofMillis(100),
                Duration.ofSeconds(5),
                Duration.ofSeconds(10),
                3
        );
    }

    public LedTimingPolicy withCommandInterval(Duration interval) {
        return new LedTimingPolicy(interval, commandTimeout, queuePollTimeout, unitTimeout, workerJoinTimeout,
                preemptionWait, afterAnimationStepDelay, discoveryTimeout, connectTimeout, maxConsecutiveWriteFailures);
    }

    public LedTimingPolicy withCommandTimeout(Duration timeout) {
        return new LedTimingPolicy(commandInterval, timeout, queuePollTimeout, unitTimeout, workerJoinTimeout,
                preemptionWait, afterAnimationStepDelay, discoveryTimeout, connectTimeout, maxConsecutiveWriteFailures);
    }

    public LedTimingPolicy withAfterAnimationStepDelay(Duration delay) {
        return new LedTimingPolicy(commandInterval, commandTimeout, queuePollTimeout, unitTimeout, workerJoinTimeout,
                preemptionWait, delay, discoveryTimeout, connectTimeout, maxConsecutiveWriteFailures);
    }

    public LedTimingPolicy withMaxConsecutiveWriteFailures(int max) {
        return new LedTimingPolicy(commandInterval, commandTimeout, queuePollTimeout, unitTimeout, workerJoinTimeout,
                preemptionWait, afterAnimationStepDelay, discoveryTimeout, connectTimeout, max);
    }

    private static void requireNonNegative(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isNegative()) {
            throw new IllegalArgumentException(name + " must be non-negative");
        }
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isNegative() || d.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
