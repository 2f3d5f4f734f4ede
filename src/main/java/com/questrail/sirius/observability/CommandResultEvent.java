package com.questrail.sirius.observability;

import com.questrail.sirius.api.DeviceId;

import java.time.Instant;
import java.util.Optional;

/**
 * Outcome of a single dispatched command.
 *
 * @param failure empty on success
 */
public record CommandResultEvent(
    Instant timestamp,
    DeviceId device,
    String wireLine,
    Optional<CommandFailure> failure,
    String message
) {
    public static CommandResultEvent success(Instant timestamp, DeviceId device, String wireLine) {
        return new CommandResultEvent(timestamp, device, wireLine, Optional.empty(), "Sent " + wireLine);
    }

    public static CommandResultEvent failure(Instant timestamp, DeviceId device, String wireLine,
                                             CommandFailure failure, String message) {
        return new CommandResultEvent(timestamp, device, wireLine, Optional.of(failure), message);
    }

    public boolean succeeded() {
        return failure.isEmpty();
    }
}
