package com.gameflip.sdk.ratelimit;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Admits at most one request start per interval, measured from the start of the previous granted request.
 *
 * <p>
 * Each caller reserves its slot under a fair lock and then sleeps outside it, so grants follow the order in which
 * callers reached {@link #acquire()} and no two callers are given the same start time. With {@code N} callers
 * queued, the last one waits at most {@code N * interval}.
 * </p>
 */
public final class IntervalRateLimiter implements RateLimiter {

    public static final Duration DEFAULT_INTERVAL = Duration.ofMillis(1000);

    private final long intervalNanos;
    private final Clock clock;
    private final Sleeper sleeper;

    private final ReentrantLock lock = new ReentrantLock(true);
    private boolean granted;
    private long nextPermitNanos;

    public IntervalRateLimiter(Duration interval) {
        this(interval, SystemClock.instance(), Sleeper.uninterruptible());
    }

    public IntervalRateLimiter(Duration interval, Clock clock, Sleeper sleeper) {
        Objects.requireNonNull(interval, "interval");
        if (interval.isNegative()) {
            throw new IllegalArgumentException("interval cannot be negative");
        }
        this.intervalNanos = interval.toNanos();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    @Override
    public long acquire() {
        long grant;
        lock.lock();
        try {
            long now = clock.nowNanos();
            grant = granted && nextPermitNanos - now > 0 ? nextPermitNanos : now;
            nextPermitNanos = grant + intervalNanos;
            granted = true;
        } finally {
            lock.unlock();
        }

        long wait = grant - clock.nowNanos();
        if (wait > 0) {
            sleeper.sleepNanos(wait);
        }
        return grant;
    }

    public Duration interval() {
        return Duration.ofNanos(intervalNanos);
    }
}
