package com.ordoAetheris.pthreadext.sync;

/**
 * Outcome of an operation on an {@link EventFlag} or a {@link BoundedQueue}.
 *
 * <p>Each value keeps the errno a POSIX caller would see for the same outcome, so results can be
 * passed across a native boundary unchanged.
 */
public enum SyncResult {
    SUCCESS(0),
    OUT_OF_MEMORY(12),    // ENOMEM
    INVALID_ARGUMENT(22), // EINVAL
    TIMED_OUT(110),       // ETIMEDOUT
    CANCELED(125);        // ECANCELED

    private final int errno;

    SyncResult(int errno) {
        this.errno = errno;
    }

    public int errno() {
        return errno;
    }

    public boolean isSuccess() {
        return this == SUCCESS;
    }

    public static SyncResult fromErrno(int errno) {
        for (SyncResult r : values()) {
            if (r.errno == errno) return r;
        }
        throw new IllegalArgumentException("unknown errno: " + errno);
    }
}
