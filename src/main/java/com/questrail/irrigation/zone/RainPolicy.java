package com.questrail.irrigation.zone;

/**
 * How a zone reacts to its rain sensor when asked to turn on.
 */
public enum RainPolicy
{
    /** The sensor is not consulted. */
    IGNORE,

    /** Rain cancels the activation; the zone stays OFF. */
    SUPPRESS_RUN,

    /**
     * Rain keeps the valve closed but the zone is still recorded as ON, so
     * schedule bookkeeping (run history, ET debit) proceeds as if it had run.
     */
    SUPPRESS_RELAY
}
