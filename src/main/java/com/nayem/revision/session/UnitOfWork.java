package com.nayem.revision.session;

import com.nayem.revision.core.EntityKey;
import com.nayem.revision.core.Operation;
import com.nayem.revision.core.OperationKind;
import com.nayem.revision.core.OperationLedger;
import com.nayem.revision.metadata.IdentityTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * One transaction's worth of lifecycle events and the ledger collapsing them.
 * <p>
 * The enclosing transaction forwards every insert, update and delete
 * notification here, then calls {@link #flush()} any number of times and
 * finally {@link #commit()} or {@link #rollback()}. Closing an active unit
 * rolls it back.
 * </p>
 *
 * <p>
 * <strong>Threading:</strong> confined to the thread running the transaction.
 * No method blocks or locks.
 * </p>
 */
public class UnitOfWork implements LifecycleListener, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(UnitOfWork.class);

    private final UUID id;
    private final OperationLedger ledger;
    private final OperationSink sink;
    private final RevisionMetrics metrics;
    private final IdentityTracker identities; // Optional
    private final Consumer<Throwable> errorHandler; // Optional

    // Identities as they were before this unit flushed, restored on rollback
    private final Map<Object, Optional<EntityKey>> identitySnapshots = new IdentityHashMap<>();
    // Keys currently holding a row in the sink
    private final Set<EntityKey> emitted = new LinkedHashSet<>();
    private UnitOfWorkStatus status = UnitOfWorkStatus.ACTIVE;

    public UnitOfWork(UUID id, OperationLedger ledger, OperationSink sink, RevisionMetrics metrics,
            IdentityTracker identities, Consumer<Throwable> errorHandler) {
        this.id = id;
        this.ledger = ledger;
        this.sink = sink;
        this.metrics = metrics != null ? metrics : RevisionMetrics.noOp();
        this.identities = identities;
        this.errorHandler = errorHandler;
    }

    @Override
    public void onInsert(Object entity) {
        ensureActive();
        metrics.recordEvent(OperationKind.INSERT);
        ledger.recordInsert(entity);
    }

    @Override
    public void onUpdate(Object entity, Set<String> changedAttributes) {
        ensureActive();
        metrics.recordEvent(OperationKind.UPDATE);
        ledger.recordUpdate(entity, changedAttributes);
    }

    @Override
    public void onDelete(Object entity) {
        ensureActive();
        metrics.recordEvent(OperationKind.DELETE);
        ledger.recordDelete(entity);
    }

    /**
     * Hands the finalized operations not emitted yet to the sink and marks them
     * processed.
     * <p>
     * Keys emitted by an earlier flush that no longer carry a persistable
     * operation, because the entity turned stale or was re-keyed, are retracted
     * from the sink first. If the sink fails, the error handler is notified, the
     * unit is rolled back and the failure is rethrown.
     * </p>
     *
     * @return the emitted operations, possibly empty
     * @throws IllegalStateException if the unit is no longer active
     */
    public List<Operation> flush() {
        ensureActive();

        List<Operation> finalized = ledger.finalizedOperations();
        Set<EntityKey> live = new HashSet<>();
        List<Operation> pending = new ArrayList<>();
        for (Operation operation : finalized) {
            live.add(operation.getKey());
            if (!operation.isProcessed() || !emitted.contains(operation.getKey())) {
                pending.add(operation);
            }
        }
        List<EntityKey> retracted = new ArrayList<>();
        for (EntityKey key : emitted) {
            if (!live.contains(key)) {
                retracted.add(key);
            }
        }
        if (pending.isEmpty() && retracted.isEmpty()) {
            log.debug("Nothing to flush for unit of work {}", id);
            return pending;
        }

        long start = System.nanoTime();
        try {
            if (!retracted.isEmpty()) {
                sink.retract(id, List.copyOf(retracted));
            }
            if (!pending.isEmpty()) {
                sink.write(id, List.copyOf(pending));
            }
        } catch (Throwable t) {
            log.error("Sink failed for unit of work {} with {} pending operations, rolling back",
                    id, pending.size(), t);
            if (errorHandler != null) {
                try {
                    errorHandler.accept(t);
                } catch (Exception e) {
                    log.warn("Error handler failed for unit of work {}: {}", id, e.getMessage());
                }
            }
            discard(UnitOfWorkStatus.ROLLED_BACK);
            if (t instanceof RuntimeException runtime) {
                throw runtime;
            } else if (t instanceof Error error) {
                throw error;
            } else {
                throw new IllegalStateException("Sink failed for unit of work " + id, t);
            }
        } finally {
            metrics.recordFlushDuration(System.nanoTime() - start);
        }

        retracted.forEach(emitted::remove);
        metrics.recordRetracted(retracted.size());

        Map<OperationKind, Integer> counts = new EnumMap<>(OperationKind.class);
        for (Operation operation : pending) {
            operation.setProcessed(true);
            emitted.add(operation.getKey());
            refreshIdentity(operation);
            counts.merge(operation.getKind(), 1, Integer::sum);
        }
        counts.forEach(metrics::recordEmitted);
        log.debug("Flushed {} operations for unit of work {}: {}, retracted {}",
                pending.size(), id, counts, retracted);
        return pending;
    }

    /**
     * Flushes the remaining operations and ends the unit of work.
     *
     * @throws IllegalStateException if the unit is no longer active
     */
    public void commit() {
        flush();

        int stale = 0;
        for (Map.Entry<EntityKey, Operation> entry : ledger) {
            Operation operation = entry.getValue();
            if (operation.getKind() == OperationKind.STALE_VERSION) {
                stale++;
                if (identities != null && operation.getTarget() != null) {
                    identities.forget(operation.getTarget());
                }
            }
        }
        metrics.recordStale(stale);

        identitySnapshots.clear();
        status = UnitOfWorkStatus.COMMITTED;
        metrics.recordOutcome(status);
        log.info("Unit of work {} committed: {} operations, {} stale, types {}",
                id, ledger.size() - stale, stale, ledger.changedEntityTypes());
    }

    /**
     * Discards the ledger. Identities refreshed by earlier flushes are restored.
     * Does nothing if the unit already ended.
     */
    public void rollback() {
        if (status != UnitOfWorkStatus.ACTIVE) {
            return;
        }
        discard(UnitOfWorkStatus.ROLLED_BACK);
        log.debug("Unit of work {} rolled back", id);
    }

    @Override
    public void close() {
        rollback();
    }

    private void discard(UnitOfWorkStatus outcome) {
        if (identities != null) {
            identitySnapshots.forEach((entity, previous) -> {
                if (previous.isPresent()) {
                    identities.markPersisted(entity, previous.get());
                } else {
                    identities.forget(entity);
                }
            });
        }
        identitySnapshots.clear();
        emitted.clear();
        status = outcome;
        metrics.recordOutcome(outcome);
    }

    private void refreshIdentity(Operation operation) {
        Object target = operation.getTarget();
        if (identities == null || target == null) {
            return;
        }
        identitySnapshots.computeIfAbsent(target, identities::persistedKeyOf);
        if (operation.getKind() == OperationKind.DELETE) {
            identities.forget(target);
        } else {
            identities.markPersisted(target, operation.getKey());
        }
    }

    private void ensureActive() {
        if (status != UnitOfWorkStatus.ACTIVE) {
            throw new IllegalStateException("Unit of work " + id + " is " + status);
        }
    }

    public UUID getId() {
        return id;
    }

    public UnitOfWorkStatus getStatus() {
        return status;
    }

    /**
     * The ledger of this unit of work, for callers that need the raw entries.
     */
    public OperationLedger getLedger() {
        return ledger;
    }
}
