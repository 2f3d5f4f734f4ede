package com.questrail.sirius.transport;

import java.util.Objects;

/**
 * A peripheral seen during discovery.
 *
 * @param name    advertised name (may be empty for anonymous advertisers)
 * @param address transport-specific address string accepted by {@link TransportPort#connect}
 */
public record DiscoveredDevice(String name, String address)
{
    public DiscoveredDevice {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(address, "address");
    }
}
