package com.questrail.sirius.command;

import com.questrail.sirius.api.Rgb;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * WireCommandEncoderTest
 * -----------------------------------------------------------------------------
 * Exact wire lines for each command kind.
 */
class WireCommandEncoderTest {

    @Test
    void encodesModeAsZeroOrOne() {
        assertEquals("M:1", WireCommandEncoder.encodeLine(new CommandPayload.Mode(true)));
        assertEquals("M:0", WireCommandEncoder.encodeLine(new CommandPayload.Mode(false)));
    }

    @Test
    void encodesColorAsCommaSeparatedChannels() {
        assertEquals("C:255,0,0", WireCommandEncoder.encodeLine(new CommandPayload.Color(Rgb.RED)));
        assertEquals("C:1,1,1", WireCommandEncoder.encodeLine(new CommandPayload.Color(Rgb.NEAR_OFF)));
    }

    @Test
    void encodesHue() {
        assertEquals("H:128", WireCommandEncoder.encodeLine(new CommandPayload.Hue(128)));
    }

    @Test
    void encodesTransitionWithDurationLast() {
        assertEquals("T:0,255,0,1000",
                WireCommandEncoder.encodeLine(new CommandPayload.Transition(Rgb.of(0, 255, 0), 1000)));
    }

    @Test
    void bytesAreAsciiWithoutTerminator() {
        byte[] bytes = WireCommandEncoder.encode(new CommandPayload.Color(Rgb.of(10, 20, 30)));

        assertEquals("C:10,20,30", new String(bytes, StandardCharsets.US_ASCII));
        assertNotEquals('\n', bytes[bytes.length - 1]);
    }

    @Test
    void commandWireLineMatchesEncoder() {
        LedCommand cmd = LedCommand.transition(com.questrail.sirius.api.DeviceId.LEFT, Rgb.AMBER, 300, 0L);
        assertEquals("T:255,191,0,300", cmd.wireLine());
        assertEquals(CommandKind.TRANSITION, cmd.kind());
    }
}
