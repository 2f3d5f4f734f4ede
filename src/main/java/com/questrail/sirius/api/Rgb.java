package com.questrail.sirius.api;

/**
 * An 8-bit-per-channel colour as understood by the LED firmware.
 *
 * <h2>Near-off</h2>
 * <p>The firmware treats an exact {@code (0,0,0)} specially, so the controller
 * never uses pure black to switch a strip off. {@link #NEAR_OFF} is used
 * wherever a device is returned to a dark resting state.</p>
 */
public record Rgb(int r, int g, int b)
{
    public static final Rgb OFF = new Rgb(0, 0, 0);
    public static final Rgb NEAR_OFF = new Rgb(1, 1, 1);
    public static final Rgb AMBER = new Rgb(255, 191, 0);
    public static final Rgb RED = new Rgb(255, 0, 0);
    public static final Rgb WHITE = new Rgb(255, 255, 255);
    public static final Rgb BLUE = new Rgb(0, 0, 255);

    public Rgb {
        requireChannel("r", r);
        requireChannel("g", g);
        requireChannel("b", b);
    }

    public static Rgb of(int r, int g, int b) {
        return new Rgb(r, g, b);
    }

    private static void requireChannel(String name, int value) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException(name + " must be 0-255, was " + value);
        }
    }
}
