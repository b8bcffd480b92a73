package com.gameflip.sdk.ratelimit;

/**
 * Gate every outbound request passes before it is sent.
 */
public interface RateLimiter {

    /**
     * Blocks until the caller may start its request. Never fails and cannot be cancelled.
     *
     * @return time the permit was granted for, in nanoseconds of the limiter's clock.
     */
    long acquire();
}
