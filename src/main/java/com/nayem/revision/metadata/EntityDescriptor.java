package com.nayem.revision.metadata;

import java.util.List;

/**
 * Describes how to identify and classify the attributes of one entity type.
 * <p>
 * Register implementations as Spring beans to override annotation-derived
 * metadata for a type.
 * </p>
 *
 * @param <T> The entity type.
 */
public interface EntityDescriptor<T> {

    /**
     * The Class of the entity this descriptor handles.
     */
    Class<T> getEntityType();

    /**
     * Names of the primary-key attributes, in key order.
     */
    List<String> getPrimaryKeyAttributes();

    /**
     * Current primary-key values of the entity, in key order.
     */
    List<Object> primaryKeyOf(T entity);

    /**
     * Whether the attribute is a one-to-many or many-to-many relationship.
     */
    boolean isCollectionRelationship(String attribute);

    default boolean isPrimaryKeyAttribute(String attribute) {
        return getPrimaryKeyAttributes().contains(attribute);
    }
}
