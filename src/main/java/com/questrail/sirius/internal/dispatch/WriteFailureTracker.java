package com.questrail.sirius.internal.dispatch;

import com.questrail.sirius.api.DeviceId;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Consecutive write failures per device.
 *
 * - Incremented on each failed write
 * - Reset on a successful write or a fresh connection
 * - Does not decide what a count means
 */
public final class WriteFailureTracker {

    private final ConcurrentMap<DeviceId, Integer> failures = new ConcurrentHashMap<>();

    /**
     * @return the updated consecutive failure count
     */
    public int recordFailure(DeviceId device) {
        return failures.merge(device, 1, Integer::sum);
    }

    public void reset(DeviceId device) {
        failures.remove(device);
    }

    /** Current count (0 if none). */
    public int failuresFor(DeviceId device) {
        return failures.getOrDefault(device, 0);
    }
}
