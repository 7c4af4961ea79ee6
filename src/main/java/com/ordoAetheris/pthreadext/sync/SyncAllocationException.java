package com.ordoAetheris.pthreadext.sync;

/**
 * {@code SyncAllocationException} is thrown when a primitive cannot allocate the storage it needs
 * at creation time. No instance is returned in that case.
 */
public class SyncAllocationException extends RuntimeException {
    private final long requestedBytes;

    public SyncAllocationException(long requestedBytes, Throwable cause) {
        super(String.format("Cannot allocate %d bytes of queue storage", requestedBytes), cause);
        this.requestedBytes = requestedBytes;
    }

    /** Size of the allocation that failed */
    public long requestedBytes() {
        return requestedBytes;
    }

    public SyncResult result() {
        return SyncResult.OUT_OF_MEMORY;
    }
}
