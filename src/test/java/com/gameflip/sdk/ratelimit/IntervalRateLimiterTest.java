package com.gameflip.sdk.ratelimit;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class IntervalRateLimiterTest {

    private static final long INTERVAL = TimeUnit.MILLISECONDS.toNanos(1000);

    @Test
    void firstRequestIsGrantedImmediately() {
        ManualClock clock = new ManualClock(5_000);
        List<Long> sleeps = new ArrayList<>();
        IntervalRateLimiter limiter = new IntervalRateLimiter(Duration.ofMillis(1000), clock, sleeps::add);

        assertEquals(5_000, limiter.acquire());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void spacesBackToBackRequestsByInterval() {
        ManualClock clock = new ManualClock(0);
        List<Long> sleeps = new ArrayList<>();
        IntervalRateLimiter limiter = new IntervalRateLimiter(Duration.ofMillis(1000), clock, nanos -> {
            sleeps.add(nanos);
            clock.advanceNanos(nanos);
        });

        long first = limiter.acquire();
        long second = limiter.acquire();
        long third = limiter.acquire();

        assertEquals(0, first);
        assertEquals(INTERVAL, second);
        assertEquals(2 * INTERVAL, third);
        assertEquals(List.of(INTERVAL, INTERVAL), sleeps);
    }

    @Test
    void intervalIsMeasuredFromPreviousStart() {
        ManualClock clock = new ManualClock(0);
        List<Long> sleeps = new ArrayList<>();
        IntervalRateLimiter limiter = new IntervalRateLimiter(Duration.ofMillis(1000), clock, nanos -> {
            sleeps.add(nanos);
            clock.advanceNanos(nanos);
        });

        limiter.acquire();
        clock.advanceNanos(TimeUnit.MILLISECONDS.toNanos(400));
        long second = limiter.acquire();
        assertEquals(INTERVAL, second);
        assertEquals(List.of(TimeUnit.MILLISECONDS.toNanos(600)), sleeps);

        clock.advanceNanos(TimeUnit.MILLISECONDS.toNanos(5000));
        long idle = limiter.acquire();
        assertEquals(clock.nowNanos(), idle);
        assertEquals(1, sleeps.size());
    }

    @Test
    void zeroIntervalNeverWaits() {
        ManualClock clock = new ManualClock(0);
        IntervalRateLimiter limiter = new IntervalRateLimiter(Duration.ZERO, clock,
            nanos -> fail("unexpected sleep of " + nanos));

        assertEquals(0, limiter.acquire());
        assertEquals(0, limiter.acquire());
    }

    @Test
    void rejectsNegativeInterval() {
        assertThrows(IllegalArgumentException.class, () -> new IntervalRateLimiter(Duration.ofMillis(-1)));
    }

    @Test
    void concurrentCallersGetDistinctSpacedGrantsInArrivalOrder() throws Exception {
        Duration interval = Duration.ofMillis(40);
        IntervalRateLimiter limiter = new IntervalRateLimiter(interval);
        int callers = 6;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        try {
            List<Future<Long>> grants = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                CountDownLatch started = new CountDownLatch(1);
                grants.add(pool.submit(() -> {
                    started.countDown();
                    return limiter.acquire();
                }));
                assertTrue(started.await(5, TimeUnit.SECONDS));
                // lets this caller reach the lock before the next one is submitted
                Thread.sleep(5);
            }

            List<Long> times = new ArrayList<>();
            for (Future<Long> grant : grants) {
                times.add(grant.get(10, TimeUnit.SECONDS));
            }

            assertEquals(callers, new HashSet<>(times).size());
            for (int i = 1; i < times.size(); i++) {
                long gap = times.get(i) - times.get(i - 1);
                assertTrue(gap >= interval.toNanos(), "grant " + i + " only " + gap + "ns after previous");
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void waiterFinishesItsTurnDespiteInterrupt() throws Exception {
        IntervalRateLimiter limiter = new IntervalRateLimiter(Duration.ofMillis(200));
        limiter.acquire();

        long[] grant = new long[1];
        boolean[] interruptedAfter = new boolean[1];
        Thread waiter = new Thread(() -> {
            grant[0] = limiter.acquire();
            interruptedAfter[0] = Thread.currentThread().isInterrupted();
        });
        waiter.start();
        Thread.sleep(50);
        waiter.interrupt();
        waiter.join(5_000);

        assertFalse(waiter.isAlive());
        assertTrue(interruptedAfter[0]);
        assertTrue(System.nanoTime() >= grant[0]);
    }
}
