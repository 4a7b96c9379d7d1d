package com.questrail.irrigation.weather;

/**
 * The weather service could not answer: it was unreachable, returned a
 * non-success status, sent a payload without the expected fields, or the
 * calling thread was interrupted while waiting for a rate-limit slot.
 *
 * <p>Always recoverable. Callers skip the check or accrual that needed the
 * value and try again on a later tick.</p>
 */
public class UpstreamException extends Exception
{
    public UpstreamException(String message) {
        super(message);
    }

    public UpstreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
