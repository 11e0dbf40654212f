package com.nayem.revision.core;

import java.util.Objects;

/**
 * The finalized operation recorded for one entity within a unit of work.
 * <p>
 * An operation is replaced, never mutated, when a new lifecycle event for the
 * same entity arrives: {@link #coalesce(OperationKind)} produces the successor.
 * The only mutable part is the {@code processed} flag, which belongs to the
 * consumer of the ledger.
 * </p>
 */
public class Operation {

    private final EntityKey key;
    private final OperationKind kind;
    private final Object target;
    private boolean processed;

    public Operation(EntityKey key, OperationKind kind) {
        this(key, kind, null);
    }

    public Operation(EntityKey key, OperationKind kind, Object target) {
        this.key = Objects.requireNonNull(key, "key");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.target = target;
    }

    /**
     * Merges a newly observed lifecycle event into this operation.
     * <p>
     * Current kind + event = net kind:
     * </p>
     * <pre>
     *                 INSERT    UPDATE          DELETE
     * INSERT          INSERT    INSERT          STALE_VERSION
     * UPDATE          UPDATE    UPDATE          DELETE
     * DELETE          UPDATE    DELETE          DELETE
     * STALE_VERSION   INSERT    STALE_VERSION   STALE_VERSION
     * </pre>
     *
     * @param event the raw event kind; {@code STALE_VERSION} is not an event and
     *              leaves the kind unchanged
     * @return a new, unprocessed operation for the same key and target
     */
    public Operation coalesce(OperationKind event) {
        return new Operation(key, merge(kind, event), target);
    }

    /**
     * Same as {@link #coalesce(OperationKind)}, but the successor points to the
     * given target instance.
     */
    public Operation coalesce(OperationKind event, Object newTarget) {
        return new Operation(key, merge(kind, event), newTarget);
    }

    /**
     * Copy of this operation recorded under another key, keeping the processed
     * flag.
     */
    Operation withKey(EntityKey newKey) {
        Operation copy = new Operation(newKey, kind, target);
        copy.processed = processed;
        return copy;
    }

    static OperationKind merge(OperationKind current, OperationKind event) {
        return switch (current) {
            case INSERT -> switch (event) {
                // Never visible outside this unit of work, so it stays a creation
                case INSERT, UPDATE -> OperationKind.INSERT;
                case DELETE -> OperationKind.STALE_VERSION;
                case STALE_VERSION -> current;
            };
            case UPDATE -> switch (event) {
                case INSERT, UPDATE -> OperationKind.UPDATE;
                case DELETE -> OperationKind.DELETE;
                case STALE_VERSION -> current;
            };
            case DELETE -> switch (event) {
                // Identity deleted then reassigned to a new entity
                case INSERT -> OperationKind.UPDATE;
                case UPDATE, DELETE -> OperationKind.DELETE;
                case STALE_VERSION -> current;
            };
            case STALE_VERSION -> event == OperationKind.INSERT
                    ? OperationKind.INSERT
                    : OperationKind.STALE_VERSION;
        };
    }

    public EntityKey getKey() {
        return key;
    }

    public OperationKind getKind() {
        return kind;
    }

    /**
     * The entity instance the operation was recorded for, or {@code null} when
     * the operation was built from a key only.
     */
    public Object getTarget() {
        return target;
    }

    public boolean isProcessed() {
        return processed;
    }

    public void setProcessed(boolean processed) {
        this.processed = processed;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Operation other)) {
            return false;
        }
        return key.equals(other.key) && kind == other.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, kind);
    }

    @Override
    public String toString() {
        return "Operation{" + key + ", " + kind + (processed ? ", processed" : "") + "}";
    }
}
