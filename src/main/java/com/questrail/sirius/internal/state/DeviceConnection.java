package com.questrail.sirius.internal.state;

import com.questrail.sirius.transport.TransportHandle;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of one device's link.
 *
 * <p>A device is connected exactly when a handle is present. The address
 * outlives the handle so a dropped device can be reconnected without a new
 * scan.</p>
 */
public record DeviceConnection(Optional<String> address, Optional<TransportHandle> handle)
{
    static final DeviceConnection INITIAL = new DeviceConnection(Optional.empty(), Optional.empty());

    public DeviceConnection {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(handle, "handle");
    }

    public boolean connected() {
        return handle.isPresent();
    }

    DeviceConnection withHandle(TransportHandle h) {
        return new DeviceConnection(Optional.of(h.address()), Optional.of(h));
    }

    DeviceConnection withoutHandle() {
        return new DeviceConnection(address, Optional.empty());
    }

    DeviceConnection withAddress(String a) {
        return new DeviceConnection(Optional.of(a), handle);
    }
}
