package com.ordoAetheris.pthreadext.sync;

import java.util.concurrent.TimeUnit;

/**
 Converts a relative timeout in milliseconds into an absolute deadline.

 Deadlines are System.nanoTime() readings, so wall-clock adjustments do not stretch or shorten
 a wait. They are only comparable with each other through remainingNanos, never with epoch time.
 */
final class DeadlineClock {

    // keeps now + timeout clear of long overflow; ~146 years
    static final long MAX_TIMEOUT_NANOS = Long.MAX_VALUE / 2;

    private DeadlineClock() {}

    /** Reads the clock once and returns the deadline {@code ms} milliseconds from now. */
    static long toDeadline(long ms) {
        long now = System.nanoTime();
        return now + Math.min(TimeUnit.MILLISECONDS.toNanos(ms), MAX_TIMEOUT_NANOS);
    }

    /** Nanoseconds left until {@code deadline}; zero or negative once it has passed. */
    static long remainingNanos(long deadline) {
        return deadline - System.nanoTime();
    }
}
