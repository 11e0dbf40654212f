package com.nayem.revision.metadata;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.nayem.revision.core.EntityKey;

import java.util.Optional;

/**
 * Remembers the identity each entity instance had when it was last loaded or
 * persisted.
 * <p>
 * Entries are keyed by instance (reference equality), not by
 * {@code equals()}, and are released when the entity is garbage collected.
 * </p>
 */
public class IdentityTracker {

    private final Cache<Object, EntityKey> persisted = Caffeine.newBuilder()
            .weakKeys()
            .build();

    public void markPersisted(Object entity, EntityKey key) {
        persisted.put(entity, key);
    }

    public Optional<EntityKey> persistedKeyOf(Object entity) {
        return Optional.ofNullable(persisted.getIfPresent(entity));
    }

    public void forget(Object entity) {
        persisted.invalidate(entity);
    }

    public long size() {
        persisted.cleanUp();
        return persisted.estimatedSize();
    }
}
