package com.questrail.sirius.command;

import com.questrail.sirius.api.DeviceId;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Outcome of one simultaneous batch.
 *
 * <p>Devices skipped because they were not connected are neither succeeded nor
 * failed. A batch in which every entry was skipped is a success.</p>
 *
 * @param succeeded devices whose write completed normally
 * @param failed    devices whose write failed, with the cause
 * @param skipped   devices dropped before sending because they were not connected
 */
public record FanOutResult(Set<DeviceId> succeeded, Map<DeviceId, Throwable> failed, Set<DeviceId> skipped)
{
    public FanOutResult {
        succeeded = Collections.unmodifiableSet(copyOf(succeeded));
        skipped = Collections.unmodifiableSet(copyOf(skipped));
        Map<DeviceId, Throwable> failures = new EnumMap<>(DeviceId.class);
        failures.putAll(failed);
        failed = Collections.unmodifiableMap(failures);
    }

    public static FanOutResult nothingSent(Set<DeviceId> skipped) {
        return new FanOutResult(Set.of(), Map.of(), skipped);
    }

    private static Set<DeviceId> copyOf(Set<DeviceId> devices) {
        Set<DeviceId> out = EnumSet.noneOf(DeviceId.class);
        out.addAll(devices);
        return out;
    }

    /** True when no write failed. */
    public boolean success() {
        return failed.isEmpty();
    }

    /** Some writes went out and some did not. */
    public boolean partialFailure() {
        return !failed.isEmpty() && !succeeded.isEmpty();
    }
}
