package com.ordoAetheris.pthreadext.sync;

/** What a successful {@link EventFlag#await} does with the bits it waited for. */
public enum EventAction {
    /** consume: clear the requested bits before returning */
    CLEAR,
    /** leave the mask as it is */
    KEEP
}
