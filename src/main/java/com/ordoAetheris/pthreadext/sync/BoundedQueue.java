package com.ordoAetheris.pthreadext.sync;

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 Bounded FIFO message queue of fixed-size byte[] elements, one lock + notFull/notEmpty.

 Storage is one byte[capacity * elementSize] allocated at creation and never grown.
 Element i (0 = oldest) lives in slot (head + i) % capacity; tail == (head + count) % capacity.

 Methods
 SyncResult send(byte[] element, long timeoutMs)
   copies the first elementSize bytes of element in at tail
   full -> POLL: TIMED_OUT, FOREVER: wait, N ms: wait until the deadline
   reset (at entry or while waiting) -> CANCELED, nothing copied
   wakes one receiver (signal: one new element feeds one receiver)

 SyncResult receive(byte[] out, long timeoutMs)
   symmetric: waits on empty, copies the oldest element out, wakes one sender

 int count()
   snapshot

 void reset()
   discards every element, resetActive = true
   wakes BOTH blocked senders and blocked receivers, all of them return CANCELED,
   even when unreset() runs before they get the lock back

 void unreset()
   resetActive = false

 Invariants
 0 <= count <= capacity, head and tail in [0, capacity)
 FIFO between resets
 a negative timeout other than FOREVER returns INVALID_ARGUMENT with no state touched
 */
public final class BoundedQueue implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(BoundedQueue.class);

    // largest array most VMs will hand out
    static final int MAX_STORAGE_BYTES = Integer.MAX_VALUE - 8;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notFull = lock.newCondition();
    private final Condition notEmpty = lock.newCondition();

    private final int capacity;
    private final int elementSize;
    private byte[] storage;

    private int head;
    private int tail;
    private int count;
    private boolean resetActive;
    // bumped by every reset(); a waiter that sees it move was canceled even if unreset() already ran
    private long resetGeneration;

    private BoundedQueue(int capacity, int elementSize, byte[] storage) {
        this.capacity = capacity;
        this.elementSize = elementSize;
        this.storage = storage;
    }

    /**
     * Creates an empty queue.
     *
     * @throws IllegalArgumentException if capacity or elementSize is not positive
     * @throws SyncAllocationException  if the storage cannot be allocated
     */
    public static BoundedQueue create(int capacity, int elementSize) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0");
        if (elementSize <= 0) throw new IllegalArgumentException("elementSize must be > 0");

        long bytes = (long) capacity * elementSize;
        if (bytes > MAX_STORAGE_BYTES) {
            throw new SyncAllocationException(bytes, null);
        }
        byte[] storage;
        try {
            storage = new byte[(int) bytes];
        } catch (OutOfMemoryError e) {
            throw new SyncAllocationException(bytes, e);
        }

        BoundedQueue queue = new BoundedQueue(capacity, elementSize, storage);
        logger.debug("created queue {} capacity {} elementSize {}", queue, capacity, elementSize);
        return queue;
    }

    public int capacity() {
        return capacity;
    }

    public int elementSize() {
        return elementSize;
    }

    public SyncResult send(byte[] element, long timeoutMs) throws InterruptedException {
        checkBuffer(element, "element");
        if (!Timeouts.isValid(timeoutMs)) return SyncResult.INVALID_ARGUMENT;
        long deadline = ConditionWait.deadlineFor(timeoutMs);

        lock.lock();
        try {
            ensureAlive();
            long generation = resetGeneration;
            while (!canceled(generation) && count == capacity) {
                if (!ConditionWait.awaitStep(notFull, timeoutMs, deadline)) {
                    logger.trace("send on {} timed out after {} ms", this, timeoutMs);
                    return SyncResult.TIMED_OUT;
                }
                ensureAlive();
            }
            if (canceled(generation)) {
                logger.trace("send on {} canceled by reset", this);
                return SyncResult.CANCELED;
            }

            System.arraycopy(element, 0, storage, tail * elementSize, elementSize);
            count++;
            tail = (tail == capacity - 1) ? 0 : tail + 1;
            notEmpty.signal();
            return SyncResult.SUCCESS;
        } finally {
            lock.unlock();
        }
    }

    public SyncResult receive(byte[] out, long timeoutMs) throws InterruptedException {
        checkBuffer(out, "out");
        if (!Timeouts.isValid(timeoutMs)) return SyncResult.INVALID_ARGUMENT;
        long deadline = ConditionWait.deadlineFor(timeoutMs);

        lock.lock();
        try {
            ensureAlive();
            long generation = resetGeneration;
            while (!canceled(generation) && count == 0) {
                if (!ConditionWait.awaitStep(notEmpty, timeoutMs, deadline)) {
                    logger.trace("receive on {} timed out after {} ms", this, timeoutMs);
                    return SyncResult.TIMED_OUT;
                }
                ensureAlive();
            }
            if (canceled(generation)) {
                logger.trace("receive on {} canceled by reset", this);
                return SyncResult.CANCELED;
            }

            System.arraycopy(storage, head * elementSize, out, 0, elementSize);
            count--;
            head = (head == capacity - 1) ? 0 : head + 1;
            notFull.signal();
            return SyncResult.SUCCESS;
        } finally {
            lock.unlock();
        }
    }

    public int count() {
        lock.lock();
        try {
            ensureAlive();
            return count;
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

    public void reset() {
        lock.lock();
        try {
            ensureAlive();
            int discarded = count;
            head = 0;
            tail = 0;
            count = 0;
            resetActive = true;
            resetGeneration++;
            notFull.signalAll();
            notEmpty.signalAll();
            logger.debug("queue {} reset, discarded {} elements", this, discarded);
        } finally {
            lock.unlock();
        }
    }

    public void unreset() {
        lock.lock();
        try {
            ensureAlive();
            resetActive = false;
            logger.debug("queue {} unreset", this);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Releases the storage. Callers must make sure no thread is still blocked in send or receive;
     * a thread that is left behind is woken and fails with IllegalStateException. Idempotent.
     */
    public void destroy() {
        lock.lock();
        try {
            if (storage == null) return;
            storage = null;
            head = 0;
            tail = 0;
            count = 0;
            notFull.signalAll();
            notEmpty.signalAll();
            logger.debug("queue {} destroyed", this);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        destroy();
    }

    // test hooks
    int head() {
        lock.lock();
        try {
            return head;
        } finally {
            lock.unlock();
        }
    }

    int tail() {
        lock.lock();
        try {
            return tail;
        } finally {
            lock.unlock();
        }
    }

    private boolean canceled(long generation) {
        return resetActive || resetGeneration != generation;
    }

    private void checkBuffer(byte[] buffer, String name) {
        if (buffer == null) throw new IllegalArgumentException(name + " must not be null");
        if (buffer.length < elementSize) {
            throw new IllegalArgumentException(
                    name + " holds " + buffer.length + " bytes, elementSize is " + elementSize);
        }
    }

    private void ensureAlive() {
        if (storage == null) throw new IllegalStateException("queue destroyed");
    }

    @Override
    public String toString() {
        return "BoundedQueue@" + Integer.toHexString(System.identityHashCode(this));
    }
}
