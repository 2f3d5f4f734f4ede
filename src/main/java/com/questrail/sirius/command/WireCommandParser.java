package com.questrail.sirius.command;

import com.questrail.sirius.api.Rgb;

import java.util.Objects;

/**
 * WireCommandParser
 * -----------------------------------------------------------------------------
 * Parses a textual command line back into a {@link CommandPayload}.
 *
 * <p>Used for raw command entry (debugging a single device by hand) and by test
 * fakes that inspect what reached the transport. Accepts exactly the grammar
 * {@link WireCommandEncoder} produces; surrounding whitespace is ignored.</p>
 */
public final class WireCommandParser
{
    private WireCommandParser() {
    }

    /**
     * @throws WireCommandException if the line is malformed or out of range
     */
    public static CommandPayload parse(String line) {
        Objects.requireNonNull(line, "line");
        String trimmed = line.trim();
        if (trimmed.length() < 3 || trimmed.charAt(1) != ':') {
            throw new WireCommandException("Malformed command line: '" + line + "'");
        }

        CommandKind kind = CommandKind.fromLetter(trimmed.charAt(0));
        int[] args = parseArguments(trimmed.substring(2), line);

        try {
            return switch (kind) {
                case MODE -> {
                    requireArity(kind, args, 1, line);
                    if (args[0] != 0 && args[0] != 1) {
                        throw new WireCommandException("Mode must be 0 or 1: '" + line + "'");
                    }
                    yield new CommandPayload.Mode(args[0] == 1);
                }
                case COLOR -> {
                    requireArity(kind, args, 3, line);
                    yield new CommandPayload.Color(new Rgb(args[0], args[1], args[2]));
                }
                case HUE -> {
                    requireArity(kind, args, 1, line);
                    yield new CommandPayload.Hue(args[0]);
                }
                case TRANSITION -> {
                    requireArity(kind, args, 4, line);
                    yield new CommandPayload.Transition(new Rgb(args[0], args[1], args[2]), args[3]);
                }
            };
        } catch (IllegalArgumentException e) {
            throw new WireCommandException("Argument out of range: '" + line + "'", e);
        }
    }

    private static int[] parseArguments(String body, String line) {
        String[] parts = body.split(",", -1);
        int[] values = new int[parts.length];
        for (int i = 0; i < parts.length; i++) {
            try {
                values[i] = Integer.parseInt(parts[i].trim());
            } catch (NumberFormatException e) {
                throw new WireCommandException("Non-numeric argument in '" + line + "'", e);
            }
        }
        return values;
    }

    private static void requireArity(CommandKind kind, int[] args, int expected, String line) {
        if (args.length != expected) {
            throw new WireCommandException(
                    kind + " takes " + expected + " argument(s), got " + args.length + ": '" + line + "'");
        }
    }
}
