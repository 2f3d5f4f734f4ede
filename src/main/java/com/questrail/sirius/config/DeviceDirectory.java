package com.questrail.sirius.config;

import com.questrail.sirius.api.DeviceId;

import java.net.InetSocketAddress;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Static peer addresses for link drivers that cannot discover devices on their
 * own (UDP). Maps each {@link DeviceId} to the socket address it listens on.
 */
public final class DeviceDirectory {
    private final Map<DeviceId, InetSocketAddress> devices;

    private DeviceDirectory(Map<DeviceId, InetSocketAddress> devices) {
        this.devices = Collections.unmodifiableMap(new EnumMap<>(devices));
    }

    /**
     * @throws IllegalArgumentException if the device is not configured
     */
    public InetSocketAddress resolve(DeviceId device) {
        InetSocketAddress addr = devices.get(device);
        if (addr == null) {
            throw new IllegalArgumentException("No address configured for " + device);
        }
        return addr;
    }

    public Set<DeviceId> configuredDevices() {
        return devices.keySet();
    }

    /**
     * The directory keyed by advertised name, in {@link DeviceId} order.
     */
    public Map<String, InetSocketAddress> byAdvertisedName() {
        Map<String, InetSocketAddress> out = new LinkedHashMap<>();
        devices.forEach((id, addr) -> out.put(id.advertisedName(), addr));
        return out;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<DeviceId, InetSocketAddress> devices = new EnumMap<>(DeviceId.class);

        public Builder addDevice(DeviceId device, InetSocketAddress address) {
            devices.put(Objects.requireNonNull(device, "device"), Objects.requireNonNull(address, "address"));
            return this;
        }

        public DeviceDirectory build() {
            if (devices.isEmpty()) {
                throw new IllegalStateException("At least one device required");
            }
            return new DeviceDirectory(devices);
        }
    }
}
