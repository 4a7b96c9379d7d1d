package com.questrail.irrigation.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source for everything that is expressed in calendar terms:
 * schedule start times, the midnight ET window and persisted run timestamps.
 *
 * <p>
 * The scheduling engine reads this clock once per tick and derives local
 * date/time from the configured zone. Tests substitute a manually driven
 * implementation so a whole day of ticks can run in milliseconds.
 * </p>
 */
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}
