package com.nayem.revision.session;

/**
 * Lifecycle state of a {@link UnitOfWork}.
 */
public enum UnitOfWorkStatus {

    /**
     * Accepting lifecycle events.
     */
    ACTIVE,

    /**
     * All operations were handed to the sink.
     */
    COMMITTED,

    /**
     * Discarded, either explicitly or after a failed flush.
     */
    ROLLED_BACK
}
