package com.questrail.irrigation.hardware;

/**
 * A relay or sensor could not be driven or read, typically because a GPIO
 * write failed.
 */
public final class HardwareException extends RuntimeException
{
    public HardwareException(String message) {
        super(message);
    }

    public HardwareException(String message, Throwable cause) {
        super(message, cause);
    }
}
