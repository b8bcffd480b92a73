package com.gameflip.sdk.ratelimit;

import java.util.concurrent.TimeUnit;

/**
 * Suspends the calling thread.
 */
@FunctionalInterface
public interface Sleeper {

    void sleepNanos(long nanos);

    /**
     * Sleeper that always waits out the full duration. An interrupt received while waiting is remembered and
     * re-asserted on the thread once the wait is over.
     */
    static Sleeper uninterruptible() {
        return nanos -> {
            boolean interrupted = false;
            long deadline = System.nanoTime() + nanos;
            try {
                long remaining = nanos;
                while (remaining > 0) {
                    try {
                        TimeUnit.NANOSECONDS.sleep(remaining);
                        return;
                    } catch (InterruptedException ex) {
                        interrupted = true;
                        remaining = deadline - System.nanoTime();
                    }
                }
            } finally {
                if (interrupted) {
                    Thread.currentThread().interrupt();
                }
            }
        };
    }
}
