package com.ordoAetheris.pthreadext.sync;

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 Event flag: a 32-bit mask that producers set and waiters test with ANY / ALL.

 Methods
 void set(int bits)
   mask |= bits, wakes every waiter (signalAll: waiters may wait on disjoint bits)
   ignored while the flag is reset

 void clear(int bits)
   mask &= ~bits, wakes nobody (clearing never satisfies a waiter)

 SyncResult await(int bits, EventTest test, EventAction action, long timeoutMs)
   ANY -> (mask & bits) != 0,  ALL -> (mask & bits) == bits
   timeoutMs: Timeouts.FOREVER / Timeouts.POLL / N ms
   SUCCESS           predicate satisfied; with CLEAR the requested bits are cleared atomically
   TIMED_OUT         POLL and not satisfied, or the deadline passed first
   CANCELED          the flag is (or becomes) reset; reset wins over a satisfied predicate
   INVALID_ARGUMENT  negative timeout other than FOREVER, nothing touched

 void reset()
   mask = 0, resetActive = true, wakes every waiter so they return CANCELED

 void unreset()
   resetActive = false, wakes nobody

 Invariants
 mask and resetActive change only under the lock
 every resetActive = true is paired with resetGeneration++ and signalAll
 a waiter blocked across reset() returns CANCELED even if unreset() wins the lock first
 */
public final class EventFlag implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(EventFlag.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();

    private int mask;
    private boolean resetActive;
    // bumped by every reset(); a waiter that sees it move was canceled even if unreset() already ran
    private long resetGeneration;
    private boolean destroyed;

    public EventFlag() {}

    public static EventFlag create() {
        EventFlag flag = new EventFlag();
        logger.debug("created event flag {}", flag);
        return flag;
    }

    public void set(int bits) {
        lock.lock();
        try {
            ensureAlive();
            if (resetActive) {
                logger.trace("set {} ignored, flag is reset", Integer.toBinaryString(bits));
                return;
            }
            mask |= bits;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public void clear(int bits) {
        lock.lock();
        try {
            ensureAlive();
            mask &= ~bits;
        } finally {
            lock.unlock();
        }
    }

    public int current() {
        lock.lock();
        try {
            ensureAlive();
            return mask;
        } finally {
            lock.unlock();
        }
    }

    public boolean isReset() {
        lock.lock();
        try {
            return resetActive;
        } finally {
            lock.unlock();
        }
    }

    public SyncResult await(int bits, EventTest test, EventAction action, long timeoutMs)
            throws InterruptedException {
        if (test == null || action == null) throw new IllegalArgumentException("test and action are required");
        if (!Timeouts.isValid(timeoutMs)) return SyncResult.INVALID_ARGUMENT;
        long deadline = ConditionWait.deadlineFor(timeoutMs);

        lock.lock();
        try {
            ensureAlive();
            long generation = resetGeneration;
            while (!canceled(generation) && !test.isSatisfied(mask, bits)) {
                if (!ConditionWait.awaitStep(changed, timeoutMs, deadline)) {
                    logger.trace("await {} {} timed out after {} ms", test, Integer.toBinaryString(bits), timeoutMs);
                    return SyncResult.TIMED_OUT;
                }
                ensureAlive();
            }
            if (canceled(generation)) {
                logger.trace("await {} {} canceled by reset", test, Integer.toBinaryString(bits));
                return SyncResult.CANCELED;
            }
            if (action == EventAction.CLEAR) mask &= ~bits;
            return SyncResult.SUCCESS;
        } finally {
            lock.unlock();
        }
    }

    public void reset() {
        lock.lock();
        try {
            ensureAlive();
            mask = 0;
            resetActive = true;
            resetGeneration++;
            changed.signalAll();
            logger.debug("event flag {} reset", this);
        } finally {
            lock.unlock();
        }
    }

    public void unreset() {
        lock.lock();
        try {
            ensureAlive();
            resetActive = false;
            logger.debug("event flag {} unreset", this);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks the flag unusable. Callers must make sure no thread is still waiting; a waiter that is
     * left behind is woken and fails with IllegalStateException instead of hanging. Idempotent.
     */
    public void destroy() {
        lock.lock();
        try {
            if (destroyed) return;
            destroyed = true;
            changed.signalAll();
            logger.debug("event flag {} destroyed", this);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        destroy();
    }

    private boolean canceled(long generation) {
        return resetActive || resetGeneration != generation;
    }

    private void ensureAlive() {
        if (destroyed) throw new IllegalStateException("event flag destroyed");
    }

    @Override
    public String toString() {
        return "EventFlag@" + Integer.toHexString(System.identityHashCode(this));
    }
}
