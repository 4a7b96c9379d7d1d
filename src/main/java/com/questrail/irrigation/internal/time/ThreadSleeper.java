package com.questrail.irrigation.internal.time;

import java.time.Duration;

/**
 * Production {@link Sleeper} backed by {@link Thread#sleep(long)}.
 */
public enum ThreadSleeper implements Sleeper {
    INSTANCE;

    @Override
    public void sleep(Duration duration) throws InterruptedException {
        Thread.sleep(duration.toMillis());
    }
}
