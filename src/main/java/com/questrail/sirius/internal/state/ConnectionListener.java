package com.questrail.sirius.internal.state;

import com.questrail.sirius.api.DeviceId;

/**
 * Told when a device's connected flag flips. Invoked outside the registry lock.
 */
@FunctionalInterface
public interface ConnectionListener
{
    void onConnectionChanged(DeviceId device, boolean connected);
}
