package com.questrail.irrigation.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for elapsed-time bookkeeping.
 *
 * <h2>Binding invariant</h2>
 * Sliding windows (the weather rate limiter) and cache expiry MUST use a
 * monotonic time source. Wall-clock time is reserved for calendar decisions.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();
}
