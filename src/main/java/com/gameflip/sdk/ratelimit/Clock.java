package com.gameflip.sdk.ratelimit;

/**
 * Monotonic time source, in nanoseconds.
 */
public interface Clock {
    long nowNanos();
}
