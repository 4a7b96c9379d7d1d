package com.questrail.irrigation.weather;

import com.questrail.irrigation.time.ManualMonotonicClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RateLimiterTest
 * -----------------------------------------------------------------------------
 * Sliding-window quota driven by a manual monotonic clock; the sleeper
 * advances that clock instead of blocking.
 */
class RateLimiterTest {

    private final ManualMonotonicClock clock = new ManualMonotonicClock();
    private final List<Duration> sleeps = new ArrayList<>();

    private RateLimiter limiter(int rpm) {
        return new RateLimiter(rpm, clock, d -> {
            sleeps.add(d);
            clock.advance(d);
        }, Duration.ofSeconds(5));
    }

    @Test
    void grantsUpToQuotaWithoutWaiting() throws InterruptedException {
        RateLimiter limiter = limiter(10);

        for (int i = 0; i < 10; i++) {
            assertTrue(limiter.acquire(false));
        }

        assertEquals(10, limiter.grantsInWindow());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void nonBlockingAcquireFailsFastWhenWindowIsFull() throws InterruptedException {
        RateLimiter limiter = limiter(2);
        limiter.acquire(false);
        limiter.acquire(false);

        assertFalse(limiter.acquire(false));
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void eleventhRequestWaitsUntilOldestGrantLeavesTheWindow() throws InterruptedException {
        RateLimiter limiter = limiter(10);
        for (int i = 0; i < 10; i++) {
            limiter.acquire();
        }

        long before = clock.nowNanos();
        assertTrue(limiter.acquire());
        long waited = clock.nowNanos() - before;

        assertTrue(waited >= Duration.ofSeconds(60).toNanos(), "waited " + waited + "ns");
        assertEquals(12, sleeps.size());
        assertTrue(sleeps.stream().allMatch(d -> d.equals(Duration.ofSeconds(5))));
    }

    @Test
    void secondBlockingCallAtOnePerMinuteWaitsOutTheWindow() throws InterruptedException {
        RateLimiter limiter = limiter(1);
        assertTrue(limiter.acquire());
        clock.advanceSeconds(12);

        long before = clock.nowNanos();
        assertTrue(limiter.acquire());

        assertTrue(clock.nowNanos() - before >= Duration.ofSeconds(48).toNanos());
    }

    @Test
    void grantExactlyOneWindowOldNoLongerCounts() throws InterruptedException {
        RateLimiter limiter = limiter(1);
        limiter.acquire();

        clock.advance(Duration.ofSeconds(59));
        assertFalse(limiter.acquire(false));

        clock.advanceSeconds(1);
        assertTrue(limiter.acquire(false));
    }

    @Test
    void spreadOutGrantsExpireIndividually() throws InterruptedException {
        RateLimiter limiter = limiter(2);
        limiter.acquire();
        clock.advanceSeconds(30);
        limiter.acquire();
        clock.advanceSeconds(30);

        assertEquals(1, limiter.grantsInWindow());
        assertTrue(limiter.acquire(false));
        assertFalse(limiter.acquire(false));
    }

    @Test
    void concurrentCallersNeverExceedQuota() throws Exception {
        RateLimiter limiter = limiter(10);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch go = new CountDownLatch(1);
        AtomicInteger granted = new AtomicInteger();
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                futures.add(pool.submit(() -> {
                    go.await();
                    if (limiter.acquire(false)) {
                        granted.incrementAndGet();
                    }
                    return null;
                }));
            }
            go.countDown();
            for (Future<?> f : futures) {
                f.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(10, granted.get());
    }

    @Test
    void rejectsNonPositiveQuota() {
        assertThrows(IllegalArgumentException.class, () -> new RateLimiter(0));
    }
}
