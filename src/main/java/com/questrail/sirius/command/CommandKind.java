package com.questrail.sirius.command;

/**
 * The four command kinds the LED firmware accepts, keyed by their wire letter.
 */
public enum CommandKind
{
    /** {@code M:0|1} - fixed colour (0) or automatic hue cycling (1). */
    MODE('M'),
    /** {@code C:r,g,b} - set a fixed colour immediately. */
    COLOR('C'),
    /** {@code H:h} - set hue 0-255. */
    HUE('H'),
    /** {@code T:r,g,b,ms} - fade to a colour over a duration. */
    TRANSITION('T');

    private final char letter;

    CommandKind(char letter) {
        this.letter = letter;
    }

    public char letter() {
        return letter;
    }

    /**
     * Looks up a kind by wire letter.
     *
     * @throws WireCommandException if the letter is not a known kind
     */
    public static CommandKind fromLetter(char letter) {
        for (CommandKind kind : values()) {
            if (kind.letter == letter) {
                return kind;
            }
        }
        throw new WireCommandException("Unknown command letter: " + letter);
    }
}
