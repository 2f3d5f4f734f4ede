package com.questrail.sirius.internal.state;

import com.questrail.sirius.api.DeviceId;
import com.questrail.sirius.transport.TransportHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * ConnectionRegistry
 * =============================================================================
 * Per-device connection bookkeeping for the fixed device set.
 *
 * <p>All reads and writes go through one lock. Snapshots are immutable
 * {@link DeviceConnection} values, so callers may hold them after the lock is
 * released. A snapshot can be stale by the time it is used; the dispatcher and
 * fan-out tolerate that by treating a failed write as a failed command.</p>
 *
 * <p>Listeners are notified after the lock is released and only when the
 * connected flag actually changes.</p>
 */
public final class ConnectionRegistry
{
    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final Object lock = new Object();
    private final Map<DeviceId, DeviceConnection> connections = new EnumMap<>(DeviceId.class);
    private final List<ConnectionListener> listeners = new CopyOnWriteArrayList<>();

    public ConnectionRegistry() {
        for (DeviceId id : DeviceId.values()) {
            connections.put(id, DeviceConnection.INITIAL);
        }
    }

    public void addListener(ConnectionListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public DeviceConnection snapshot(DeviceId device) {
        Objects.requireNonNull(device, "device");
        synchronized (lock) {
            return connections.get(device);
        }
    }

    public boolean isConnected(DeviceId device) {
        return snapshot(device).connected();
    }

    public Optional<TransportHandle> handle(DeviceId device) {
        return snapshot(device).handle();
    }

    public Set<DeviceId> connectedDevices() {
        Set<DeviceId> out = EnumSet.noneOf(DeviceId.class);
        synchronized (lock) {
            connections.forEach((id, c) -> {
                if (c.connected()) {
                    out.add(id);
                }
            });
        }
        return out;
    }

    public void rememberAddress(DeviceId device, String address) {
        Objects.requireNonNull(address, "address");
        synchronized (lock) {
            connections.put(device, connections.get(device).withAddress(address));
        }
    }

    /**
     * Installs a live handle; the handle's address becomes the remembered one.
     */
    public void markConnected(DeviceId device, TransportHandle handle) {
        Objects.requireNonNull(handle, "handle");
        boolean changed;
        synchronized (lock) {
            DeviceConnection before = connections.get(device);
            connections.put(device, before.withHandle(handle));
            changed = !before.connected();
        }
        if (changed) {
            fire(device, true);
        }
    }

    /**
     * Drops the handle, keeping the address.
     *
     * @return the handle that was installed, if any
     */
    public Optional<TransportHandle> markDisconnected(DeviceId device) {
        Optional<TransportHandle> previous;
        synchronized (lock) {
            DeviceConnection before = connections.get(device);
            previous = before.handle();
            connections.put(device, before.withoutHandle());
        }
        if (previous.isPresent()) {
            fire(device, false);
        }
        return previous;
    }

    private void fire(DeviceId device, boolean connected) {
        for (ConnectionListener l : listeners) {
            try {
                l.onConnectionChanged(device, connected);
            } catch (RuntimeException e) {
                log.warn("Connection listener failed for {}", device, e);
            }
        }
    }
}
