package com.nayem.revision.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;

/**
 * Collapses the raw lifecycle events of one unit of work into a single
 * operation per entity.
 * <p>
 * Instead of a list of every insert, update and delete that happened, the
 * ledger holds one {@link Operation} per {@link EntityKey} carrying the net
 * effect so far. Iteration follows the order in which keys were first
 * recorded; replacing the operation of a key keeps its position, re-keying an
 * entry after a primary-key change moves it to the end.
 * </p>
 *
 * <p>
 * <strong>Threading:</strong> a ledger belongs to exactly one unit of work and
 * is not thread-safe.
 * </p>
 */
public class OperationLedger implements Iterable<Map.Entry<EntityKey, Operation>> {
    private static final Logger log = LoggerFactory.getLogger(OperationLedger.class);

    private final Map<EntityKey, Operation> operations = new LinkedHashMap<>();
    private final EntityIntrospector introspector;

    public OperationLedger(EntityIntrospector introspector) {
        this.introspector = Objects.requireNonNull(introspector, "introspector");
    }

    /**
     * Records that the entity was newly created.
     */
    public void recordInsert(Object entity) {
        recordEvent(introspector.keyOf(entity), OperationKind.INSERT, entity);
    }

    /**
     * Records that attributes of the entity changed.
     * <p>
     * Ignored unless at least one changed attribute is not a collection
     * relationship. When a primary-key attribute changed, the entry recorded
     * under the previous identity is moved to the new one first.
     * </p>
     *
     * @param changedAttributes names of the attributes with pending changes
     */
    public void recordUpdate(Object entity, Set<String> changedAttributes) {
        if (!hasTrackableChange(entity, changedAttributes)) {
            log.debug("Ignoring update of {} without trackable changes: {}",
                    entity.getClass().getSimpleName(), changedAttributes);
            return;
        }
        rekey(entity, changedAttributes);
        recordEvent(introspector.keyOf(entity), OperationKind.UPDATE, entity);
    }

    /**
     * Records that the entity was removed.
     */
    public void recordDelete(Object entity) {
        recordEvent(introspector.keyOf(entity), OperationKind.DELETE, entity);
    }

    private void recordEvent(EntityKey key, OperationKind event, Object entity) {
        Operation existing = operations.get(key);
        Operation next = existing == null
                ? new Operation(key, event, entity)
                : existing.coalesce(event, entity);
        operations.put(key, next);

        if (log.isDebugEnabled()) {
            log.debug("{} {}: {} -> {}", event, key,
                    existing == null ? "none" : existing.getKind(), next.getKind());
        }
    }

    private boolean hasTrackableChange(Object entity, Set<String> changedAttributes) {
        if (changedAttributes == null) {
            return false;
        }
        for (String attribute : changedAttributes) {
            if (!introspector.isCollectionRelationship(entity, attribute)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Moves the entry recorded under the entity's persisted identity to the key
     * derived from its current primary-key values.
     * <p>
     * Only runs when a primary-key attribute is among the changed attributes.
     * The moved entry goes to the end of the iteration order.
     * </p>
     *
     * @return true if an entry was moved
     */
    public boolean rekey(Object entity, Set<String> changedAttributes) {
        if (changedAttributes == null) {
            return false;
        }
        boolean primaryKeyChanged = false;
        for (String attribute : changedAttributes) {
            if (introspector.isPrimaryKeyAttribute(entity, attribute)) {
                primaryKeyChanged = true;
                break;
            }
        }
        if (!primaryKeyChanged) {
            return false;
        }

        EntityKey newKey = introspector.keyOf(entity);
        EntityKey oldKey = introspector.persistedKeyOf(entity).orElse(null);
        if (oldKey == null || oldKey.equals(newKey) || !operations.containsKey(oldKey)) {
            return false;
        }

        Operation moved = operations.remove(oldKey).withKey(newKey);
        operations.put(newKey, moved);
        log.debug("Re-keyed {} from {} to {}", moved.getKind(), oldKey, newKey);
        return true;
    }

    /**
     * Stores an operation under its own key, replacing any existing one.
     */
    public void add(Operation operation) {
        operations.put(operation.getKey(), operation);
    }

    public boolean contains(EntityKey key) {
        return operations.containsKey(key);
    }

    /**
     * Whether an operation is recorded for the entity's current key.
     */
    public boolean contains(Object entity) {
        return operations.containsKey(introspector.keyOf(entity));
    }

    /**
     * @return the operation for the key, or {@code null} if none is recorded
     */
    public Operation get(EntityKey key) {
        return operations.get(key);
    }

    public void put(EntityKey key, Operation operation) {
        operations.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(operation, "operation"));
    }

    /**
     * Removes the operation recorded for the key.
     *
     * @throws NoSuchElementException if nothing is recorded for the key
     */
    public Operation remove(EntityKey key) {
        Operation removed = operations.remove(key);
        if (removed == null) {
            throw new NoSuchElementException("No operation recorded for " + key);
        }
        return removed;
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }

    public int size() {
        return operations.size();
    }

    /**
     * Ordered, read-only view of the recorded entries.
     */
    public Set<Map.Entry<EntityKey, Operation>> entries() {
        return Collections.unmodifiableMap(operations).entrySet();
    }

    @Override
    public Iterator<Map.Entry<EntityKey, Operation>> iterator() {
        return entries().iterator();
    }

    /**
     * Distinct entity types of every recorded key, stale ones included.
     */
    public Set<Class<?>> entityTypes() {
        Set<Class<?>> types = new LinkedHashSet<>();
        for (EntityKey key : operations.keySet()) {
            types.add(key.entityType());
        }
        return types;
    }

    /**
     * Distinct entity types that have at least one operation to persist.
     */
    public Set<Class<?>> changedEntityTypes() {
        Set<Class<?>> types = new LinkedHashSet<>();
        for (Operation operation : operations.values()) {
            if (operation.getKind().isPersistable()) {
                types.add(operation.getKey().entityType());
            }
        }
        return types;
    }

    /**
     * Operations to persist, in ledger order. {@link OperationKind#STALE_VERSION}
     * entries are left out.
     */
    public List<Operation> finalizedOperations() {
        return operations.values().stream()
                .filter(operation -> operation.getKind().isPersistable())
                .toList();
    }

    @Override
    public String toString() {
        return operations.toString();
    }
}
