package com.questrail.sirius.command;

/**
 * A command line could not be parsed into a valid {@link CommandPayload}.
 */
public final class WireCommandException extends RuntimeException
{
    public WireCommandException(String message) {
        super(message);
    }

    public WireCommandException(String message, Throwable cause) {
        super(message, cause);
    }
}
