package com.ordoAetheris.pthreadext.sync;

/**
 Timeout modes shared by EventFlag.await, BoundedQueue.send and BoundedQueue.receive.

 FOREVER (-1)  block until the operation can complete or the primitive is reset
 POLL    (0)   never block: check once, TIMED_OUT if the operation cannot complete now
 N > 0         block for at most N milliseconds, measured from call entry

 Any other negative value is rejected with SyncResult.INVALID_ARGUMENT.
 */
public final class Timeouts {

    public static final long FOREVER = -1L;
    public static final long POLL = 0L;

    private Timeouts() {}

    public static boolean isValid(long timeoutMs) {
        return timeoutMs == FOREVER || timeoutMs >= 0;
    }

    static boolean isBounded(long timeoutMs) {
        return timeoutMs > 0;
    }
}
