package com.nayem.revision.core;

import java.util.Optional;

/**
 * Metadata capability the ledger needs from the object mapping layer.
 * <p>
 * Keeps the merge engine independent of any particular mapping
 * implementation: identities and attribute classification are supplied by the
 * caller.
 * </p>
 */
public interface EntityIntrospector {

    /**
     * Computes the key of an entity from its current primary-key values.
     * Must be side-effect free and work for entities that were never persisted.
     */
    EntityKey keyOf(Object entity);

    /**
     * Returns the identity the entity had when it was last persisted or loaded,
     * or empty if it never was.
     */
    Optional<EntityKey> persistedKeyOf(Object entity);

    /**
     * Whether the attribute is one of the entity's primary-key attributes.
     */
    boolean isPrimaryKeyAttribute(Object entity, String attribute);

    /**
     * Whether the attribute is a one-to-many or many-to-many relationship.
     * Changes to such attributes are tracked on the other side of the
     * relationship.
     */
    boolean isCollectionRelationship(Object entity, String attribute);
}
