package com.questrail.irrigation.api;

/**
 * Indicates that a caller violated an input contract, for example by passing a
 * run status other than {@code on} or {@code off} to the archive.
 *
 * <p>Validation failures are surfaced to the immediate caller. They are never
 * logged-and-continued by the component that detects them.</p>
 */
public final class ValidationException extends IllegalArgumentException
{
    public ValidationException(String message) {
        super(message);
    }
}
