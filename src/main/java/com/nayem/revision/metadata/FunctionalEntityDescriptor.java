package com.nayem.revision.metadata;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * An {@link EntityDescriptor} defined with lambdas.
 * <p>
 * Avoids writing a descriptor class for entities whose key is easy to read:
 * </p>
 *
 * <pre>
 * EntityDescriptor&lt;Customer&gt; customers = FunctionalEntityDescriptor.builder(Customer.class)
 *         .primaryKey("id", Customer::getId)
 *         .collection("orders")
 *         .build();
 * </pre>
 *
 * @param <T> The entity type
 */
public class FunctionalEntityDescriptor<T> implements EntityDescriptor<T> {

    private final Class<T> entityType;
    private final List<String> primaryKeyAttributes;
    private final List<Function<T, Object>> primaryKeyReaders;
    private final Set<String> collectionAttributes;

    private FunctionalEntityDescriptor(Builder<T> builder) {
        this.entityType = builder.entityType;
        this.primaryKeyAttributes = List.copyOf(builder.primaryKeyAttributes);
        this.primaryKeyReaders = List.copyOf(builder.primaryKeyReaders);
        this.collectionAttributes = Set.copyOf(builder.collectionAttributes);
    }

    public static <T> Builder<T> builder(Class<T> entityType) {
        return new Builder<>(entityType);
    }

    @Override
    public Class<T> getEntityType() {
        return entityType;
    }

    @Override
    public List<String> getPrimaryKeyAttributes() {
        return primaryKeyAttributes;
    }

    @Override
    public List<Object> primaryKeyOf(T entity) {
        List<Object> values = new ArrayList<>(primaryKeyReaders.size());
        for (Function<T, Object> reader : primaryKeyReaders) {
            values.add(reader.apply(entity));
        }
        return values;
    }

    @Override
    public boolean isCollectionRelationship(String attribute) {
        return collectionAttributes.contains(attribute);
    }

    /**
     * Builder for {@link FunctionalEntityDescriptor}.
     *
     * @param <T> The entity type
     */
    public static class Builder<T> {
        private final Class<T> entityType;
        private final List<String> primaryKeyAttributes = new ArrayList<>();
        private final List<Function<T, Object>> primaryKeyReaders = new ArrayList<>();
        private final Set<String> collectionAttributes = new HashSet<>();

        private Builder(Class<T> entityType) {
            this.entityType = Objects.requireNonNull(entityType, "entityType");
        }

        /**
         * Adds a primary-key attribute. Call once per key column, in key order.
         *
         * @param attribute The attribute name
         * @param reader    Reads the current value from the entity
         * @return this builder
         */
        public Builder<T> primaryKey(String attribute, Function<T, ?> reader) {
            Objects.requireNonNull(reader, "reader");
            primaryKeyAttributes.add(attribute);
            primaryKeyReaders.add(reader::apply);
            return this;
        }

        /**
         * Declares one-to-many or many-to-many relationship attributes.
         *
         * @return this builder
         */
        public Builder<T> collection(String... attributes) {
            collectionAttributes.addAll(List.of(attributes));
            return this;
        }

        /**
         * @throws IllegalStateException if no primary-key attribute was declared
         */
        public FunctionalEntityDescriptor<T> build() {
            if (primaryKeyAttributes.isEmpty()) {
                throw new IllegalStateException(
                        "At least one primary key attribute is required for " + entityType.getName());
            }
            return new FunctionalEntityDescriptor<>(this);
        }
    }
}
