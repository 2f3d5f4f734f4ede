package com.questrail.sirius.api;

/**
 * DeviceId
 * -----------------------------------------------------------------------------
 * The closed set of LED peripherals a controller addresses.
 *
 * <p>Each device advertises a fixed name over the wireless link. Discovery
 * matches on that name; the link address is learned at connect time and is
 * never part of the identity.</p>
 */
public enum DeviceId
{
    LEFT("Sirius3_LEFT_EAR"),
    RIGHT("Sirius3_RIGHT_EAR");

    private final String advertisedName;

    DeviceId(String advertisedName) {
        this.advertisedName = advertisedName;
    }

    /**
     * Name the peripheral advertises during discovery.
     */
    public String advertisedName() {
        return advertisedName;
    }

    /**
     * The other device of the pair.
     */
    public DeviceId opposite() {
        return this == LEFT ? RIGHT : LEFT;
    }
}
