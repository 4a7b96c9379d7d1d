package com.questrail.irrigation.weather;

import com.questrail.irrigation.internal.time.MonotonicClock;
import com.questrail.irrigation.internal.time.Sleeper;
import com.questrail.irrigation.internal.time.SystemMonotonicClock;
import com.questrail.irrigation.internal.time.ThreadSleeper;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * RateLimiter
 * =============================================================================
 * Bounds outbound calls to the weather provider to a fixed number per minute.
 *
 * <h2>Algorithm</h2>
 * A sliding one-minute window of grant timestamps. A request is granted when
 * fewer than {@code requestsPerMinute} grants happened within the trailing
 * 60 seconds; a grant that is exactly 60 seconds old has left the window.
 *
 * <h2>Blocking</h2>
 * Blocking callers are parked with sleep-and-retry (default poll 5 s) until a
 * slot frees. There is no fairness beyond retry order, so sustained overload
 * can starve a caller; the provider's quota is just as hard.
 *
 * <h2>Thread Safety</h2>
 * Window bookkeeping is guarded by the instance monitor. Sleeping happens
 * outside of it.
 */
public final class RateLimiter {

    static final Duration WINDOW = Duration.ofMinutes(1);
    static final Duration DEFAULT_POLL = Duration.ofSeconds(5);

    private final int requestsPerMinute;
    private final MonotonicClock clock;
    private final Sleeper sleeper;
    private final Duration pollInterval;

    private final Deque<Long> grants = new ArrayDeque<>();

    public RateLimiter(int requestsPerMinute) {
        this(requestsPerMinute, SystemMonotonicClock.INSTANCE, ThreadSleeper.INSTANCE, DEFAULT_POLL);
    }

    public RateLimiter(int requestsPerMinute, MonotonicClock clock, Sleeper sleeper, Duration pollInterval) {
        if (requestsPerMinute <= 0) {
            throw new IllegalArgumentException("requestsPerMinute must be > 0");
        }
        this.requestsPerMinute = requestsPerMinute;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be > 0");
        }
    }

    /**
     * Acquires a slot in the current window.
     *
     * @param blocking wait for a slot instead of failing fast
     * @return {@code true} once a slot was granted; {@code false} only when
     *         {@code blocking} is {@code false} and the window is full
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean acquire(boolean blocking) throws InterruptedException {
        while (true) {
            if (tryGrant()) {
                return true;
            }
            if (!blocking) {
                return false;
            }
            sleeper.sleep(pollInterval);
        }
    }

    /**
     * Equivalent to {@code acquire(true)}.
     */
    public boolean acquire() throws InterruptedException {
        return acquire(true);
    }

    public int requestsPerMinute() {
        return requestsPerMinute;
    }

    /**
     * Number of grants still inside the trailing window.
     */
    public synchronized int grantsInWindow() {
        evictExpired(clock.nowNanos());
        return grants.size();
    }

    private synchronized boolean tryGrant() {
        long now = clock.nowNanos();
        evictExpired(now);
        if (grants.size() < requestsPerMinute) {
            grants.addLast(now);
            return true;
        }
        return false;
    }

    private void evictExpired(long now) {
        long windowNanos = WINDOW.toNanos();
        while (!grants.isEmpty() && now - grants.peekFirst() >= windowNanos) {
            grants.removeFirst();
        }
    }
}
