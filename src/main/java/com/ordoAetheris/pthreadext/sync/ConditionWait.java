package com.ordoAetheris.pthreadext.sync;

import java.util.concurrent.locks.Condition;

/**
 One step of a predicate wait loop, shared by EventFlag and BoundedQueue.

 The caller holds the condition's lock, re-checks its own predicate around every call, and
 releases the lock in a finally block. Condition.await releases the lock while suspended and
 re-acquires it before returning or throwing InterruptedException, so an interrupted waiter
 never leaves the lock held.
 */
final class ConditionWait {

    private ConditionWait() {}

    /**
     * Waits once on {@code condition} according to the timeout mode.
     *
     * @param timeoutMs  a value already accepted by {@link Timeouts#isValid(long)}
     * @param deadline   from {@link DeadlineClock#toDeadline(long)}; ignored unless timeoutMs > 0
     * @return false when the caller must give up with TIMED_OUT (POLL, or the deadline has passed),
     *         true after a wakeup, which may be spurious
     */
    static boolean awaitStep(Condition condition, long timeoutMs, long deadline)
            throws InterruptedException {
        if (timeoutMs == Timeouts.POLL) return false;
        if (timeoutMs == Timeouts.FOREVER) {
            condition.await();
            return true;
        }
        long nanos = DeadlineClock.remainingNanos(deadline);
        if (nanos <= 0L) return false;
        condition.awaitNanos(nanos);
        return true;
    }

    static long deadlineFor(long timeoutMs) {
        return Timeouts.isBounded(timeoutMs) ? DeadlineClock.toDeadline(timeoutMs) : 0L;
    }
}
