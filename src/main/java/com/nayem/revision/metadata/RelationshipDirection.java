package com.nayem.revision.metadata;

/**
 * Cardinality of a relationship attribute, seen from the owning entity.
 */
public enum RelationshipDirection {

    ONE_TO_ONE,

    MANY_TO_ONE,

    /**
     * A collection of child entities. The foreign key lives on the children.
     */
    ONE_TO_MANY,

    /**
     * A collection backed by an association table.
     */
    MANY_TO_MANY;

    /**
     * Whether changes to this attribute are expressed on the other side of the
     * relationship rather than on the owning entity.
     */
    public boolean isCollection() {
        return this == ONE_TO_MANY || this == MANY_TO_MANY;
    }
}
