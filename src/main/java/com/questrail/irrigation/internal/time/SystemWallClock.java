package com.questrail.irrigation.internal.time;

import java.time.Instant;

/**
 * SystemWallClock
 * =============================================================================
 * Production {@link WallClock} implementation backed by {@link Instant#now()}.
 *
 * <h2>Properties</h2>
 * <ul>
 *   <li>May jump forward or backward due to NTP, DST, or manual adjustments</li>
 *   <li>Used for schedule evaluation and run-history timestamps</li>
 * </ul>
 *
 * <p>Elapsed-time bookkeeping that must survive clock jumps (rate limiting,
 * cache expiry) uses {@link MonotonicClock} instead.</p>
 */
public enum SystemWallClock implements WallClock {
    /**
     * Singleton instance.
     */
    INSTANCE;

    @Override
    public Instant now() {
        return Instant.now();
    }
}
