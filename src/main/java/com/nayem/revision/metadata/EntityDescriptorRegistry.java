package com.nayem.revision.metadata;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.nayem.revision.core.EntityIntrospector;
import com.nayem.revision.core.EntityKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link EntityIntrospector} backed by per-type {@link EntityDescriptor}s.
 * <p>
 * Explicitly registered descriptors win; a subclass (for example a proxy)
 * resolves to the descriptor of its closest registered superclass. Types
 * without a registered descriptor fall back to
 * {@link AnnotatedEntityDescriptor}, built on first use and cached.
 * </p>
 */
public class EntityDescriptorRegistry implements EntityIntrospector {
    private static final Logger log = LoggerFactory.getLogger(EntityDescriptorRegistry.class);

    private final Map<Class<?>, EntityDescriptor<?>> descriptors;
    private final Cache<Class<?>, EntityDescriptor<?>> resolved;
    private final IdentityTracker identities;

    public EntityDescriptorRegistry(Collection<? extends EntityDescriptor<?>> descriptors) {
        this(descriptors, 1000, new IdentityTracker());
    }

    public EntityDescriptorRegistry(Collection<? extends EntityDescriptor<?>> descriptors,
            long metadataCacheSize, IdentityTracker identities) {
        this.descriptors = new HashMap<>();
        for (EntityDescriptor<?> descriptor : descriptors) {
            EntityDescriptor<?> previous = this.descriptors.put(descriptor.getEntityType(), descriptor);
            if (previous != null) {
                throw new IllegalStateException(
                        "Duplicate EntityDescriptor for " + descriptor.getEntityType().getName());
            }
        }
        this.resolved = Caffeine.newBuilder()
                .maximumSize(metadataCacheSize)
                .build();
        this.identities = Objects.requireNonNull(identities, "identities");
        log.debug("EntityDescriptorRegistry created with {} explicit descriptors", this.descriptors.size());
    }

    public static EntityDescriptorRegistry annotationsOnly() {
        return new EntityDescriptorRegistry(List.of());
    }

    /**
     * Returns the descriptor handling the given type.
     *
     * @throws IllegalArgumentException if the type has neither a registered
     *                                  descriptor nor {@link PrimaryKey} fields
     */
    @SuppressWarnings("unchecked")
    public <T> EntityDescriptor<T> descriptorFor(Class<T> type) {
        return (EntityDescriptor<T>) resolved.get(type, this::resolve);
    }

    private EntityDescriptor<?> resolve(Class<?> type) {
        Class<?> current = type;
        while (current != null && current != Object.class) {
            EntityDescriptor<?> descriptor = descriptors.get(current);
            if (descriptor != null) {
                return descriptor;
            }
            current = current.getSuperclass();
        }
        if (AnnotatedEntityDescriptor.isAnnotated(type)) {
            log.debug("Building annotation metadata for {}", type.getName());
            return AnnotatedEntityDescriptor.of(type);
        }
        throw new IllegalArgumentException("No EntityDescriptor registered and no @PrimaryKey field found for "
                + type.getName());
    }

    @Override
    public EntityKey keyOf(Object entity) {
        EntityDescriptor<Object> descriptor = descriptorOf(entity);
        return new EntityKey(descriptor.getEntityType(), descriptor.primaryKeyOf(entity));
    }

    @Override
    public Optional<EntityKey> persistedKeyOf(Object entity) {
        return identities.persistedKeyOf(entity);
    }

    @Override
    public boolean isPrimaryKeyAttribute(Object entity, String attribute) {
        return descriptorOf(entity).isPrimaryKeyAttribute(attribute);
    }

    @Override
    public boolean isCollectionRelationship(Object entity, String attribute) {
        return descriptorOf(entity).isCollectionRelationship(attribute);
    }

    /**
     * Snapshots the entity's current key as its persisted identity. Call after
     * loading an entity from storage. Flushes of a {@code UnitOfWork} update
     * the shared {@link IdentityTracker} directly.
     */
    public void markPersisted(Object entity) {
        identities.markPersisted(entity, keyOf(entity));
    }

    public void forget(Object entity) {
        identities.forget(entity);
    }

    public IdentityTracker getIdentities() {
        return identities;
    }

    @SuppressWarnings("unchecked")
    private EntityDescriptor<Object> descriptorOf(Object entity) {
        Objects.requireNonNull(entity, "entity");
        return (EntityDescriptor<Object>) descriptorFor(entity.getClass());
    }
}
