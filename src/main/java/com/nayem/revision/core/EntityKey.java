package com.nayem.revision.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Value identity of an entity: its type plus the current primary-key values.
 * <p>
 * Two keys are equal when the types are the same and the primary-key values are
 * equal element by element. Components are not validated, {@code null} values
 * are kept as they are.
 * </p>
 *
 * @param entityType the entity class
 * @param primaryKey the primary-key values, in primary-key column order
 */
public record EntityKey(Class<?> entityType, List<Object> primaryKey) {

    public EntityKey {
        Objects.requireNonNull(entityType, "entityType");
        primaryKey = primaryKey == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(primaryKey));
    }

    public static EntityKey of(Class<?> entityType, Object... primaryKey) {
        return new EntityKey(entityType, Arrays.asList(primaryKey));
    }

    @Override
    public String toString() {
        return entityType.getSimpleName() + primaryKey;
    }
}
