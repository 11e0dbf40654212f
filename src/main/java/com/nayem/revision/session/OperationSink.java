package com.nayem.revision.session;

import com.nayem.revision.core.EntityKey;
import com.nayem.revision.core.Operation;

import java.util.List;
import java.util.UUID;

/**
 * Consumer of finalized operations, typically the component writing version
 * records.
 * <p>
 * Called once per flush with the operations not yet emitted, in ledger order.
 * An operation can be emitted again by a later flush of the same unit of work
 * when new events changed it, so implementations should upsert by unit of work
 * and entity key.
 * </p>
 * <p>
 * A row emitted by an earlier flush can stop being valid before the unit of
 * work ends: the entity was deleted after its insert was flushed, or its
 * primary key changed and the entry moved to a new key. Such keys are passed
 * to {@link #retract(UUID, List)} before the next batch is written.
 * </p>
 */
public interface OperationSink {

    /**
     * Writes a batch of operations. Never receives
     * {@link com.nayem.revision.core.OperationKind#STALE_VERSION} entries.
     *
     * @param unitOfWorkId The unit of work the operations belong to
     * @param operations   The operations, never empty
     */
    void write(UUID unitOfWorkId, List<Operation> operations);

    /**
     * Removes rows previously written for the unit of work under the given
     * keys.
     *
     * @param unitOfWorkId The unit of work the rows belong to
     * @param keys         Keys written by an earlier flush, never empty
     */
    void retract(UUID unitOfWorkId, List<EntityKey> keys);
}
