package com.questrail.irrigation.internal.time;

import java.time.Duration;

/**
 * Sleeper
 * -----------------------------------------------------------------------------
 * Blocking pause used by sleep-and-retry loops.
 *
 * <p>Kept separate from the clocks so a test can pair a manual clock with a
 * sleeper that simply advances it.</p>
 */
@FunctionalInterface
public interface Sleeper
{
    void sleep(Duration duration) throws InterruptedException;
}
