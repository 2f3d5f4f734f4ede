package com.questrail.sirius.command;

import com.questrail.sirius.api.DeviceId;

import java.util.Objects;

/**
 * One (device, payload) pair of a simultaneous batch.
 */
public record BatchEntry(DeviceId device, CommandPayload payload)
{
    public BatchEntry {
        Objects.requireNonNull(device, "device");
        Objects.requireNonNull(payload, "payload");
    }
}
