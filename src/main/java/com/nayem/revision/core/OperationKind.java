package com.nayem.revision.core;

/**
 * The net effect of a unit of work on a single entity.
 * <p>
 * The numeric codes are the values stored in the operation type column of
 * version tables.
 * </p>
 */
public enum OperationKind {

    /**
     * The entity was created in this unit of work.
     */
    INSERT(0),

    /**
     * The entity existed before and was modified.
     */
    UPDATE(1),

    /**
     * The entity existed before and was removed.
     */
    DELETE(2),

    /**
     * The entity was created and removed in the same unit of work. No version
     * record is written for it.
     */
    STALE_VERSION(-1);

    private final int code;

    OperationKind(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    /**
     * Whether a version record should be written for this kind.
     */
    public boolean isPersistable() {
        return this != STALE_VERSION;
    }

    public static OperationKind fromCode(int code) {
        for (OperationKind kind : values()) {
            if (kind.code == code) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown operation code: " + code);
    }
}
