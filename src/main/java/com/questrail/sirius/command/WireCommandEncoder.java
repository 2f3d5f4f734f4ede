package com.questrail.sirius.command;

import java.nio.charset.StandardCharsets;
import java.util.stream.Collectors;

/**
 * WireCommandEncoder
 * =============================================================================
 * Serializes payloads into the firmware's ASCII command line.
 *
 * <h2>Format</h2>
 * <pre>
 *   &lt;Letter&gt;:&lt;arg&gt;[,&lt;arg&gt;...]
 *
 *   M:1
 *   C:255,0,0
 *   H:128
 *   T:0,255,0,1000
 * </pre>
 *
 * <p>No terminator is appended: one write carries exactly one command.</p>
 */
public final class WireCommandEncoder
{
    private WireCommandEncoder() {
    }

    public static String encodeLine(CommandPayload payload) {
        String args = payload.arguments().stream()
                .map(String::valueOf)
                .collect(Collectors.joining(","));
        return payload.kind().letter() + ":" + args;
    }

    public static byte[] encode(CommandPayload payload) {
        return encodeLine(payload).getBytes(StandardCharsets.US_ASCII);
    }
}
