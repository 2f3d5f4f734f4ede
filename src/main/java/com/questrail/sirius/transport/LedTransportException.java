package com.questrail.sirius.transport;

/**
 * A link-level failure: a write, connect, discovery or disconnect that the
 * driver reported as failed.
 */
public final class LedTransportException extends RuntimeException
{
    public LedTransportException(String message) {
        super(message);
    }

    public LedTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
