package com.questrail.sirius.observability;

/**
 * Why a command did not reach its device.
 */
public enum CommandFailure {
    /** The device was not connected when the command was dispatched; the command was dropped. */
    NOT_CONNECTED,
    /** The link driver reported the write as failed. */
    TRANSPORT_ERROR,
    /** No write outcome within the command timeout; the device is treated as disconnected. */
    TIMEOUT
}
