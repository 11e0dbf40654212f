package com.nayem.revision.session;

import com.nayem.revision.core.EntityKey;
import com.nayem.revision.core.Operation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link OperationSink}.
 * <p>
 * Suitable for development and testing. Keeps the batches as written and the
 * resulting version rows, one per unit of work and entity key. Everything is
 * lost on restart.
 * </p>
 */
public class InMemoryOperationSink implements OperationSink {

    private static final Logger log = LoggerFactory.getLogger(InMemoryOperationSink.class);

    private final Map<UUID, List<List<Operation>>> batchesByUnit = new ConcurrentHashMap<>();
    private final Map<VersionRow, Operation> rows = new LinkedHashMap<>();

    @Override
    public void write(UUID unitOfWorkId, List<Operation> operations) {
        batchesByUnit.computeIfAbsent(unitOfWorkId, id -> new CopyOnWriteArrayList<>())
                .add(List.copyOf(operations));
        synchronized (rows) {
            for (Operation operation : operations) {
                rows.put(new VersionRow(unitOfWorkId, operation.getKey()), operation);
            }
        }
        log.debug("Stored {} operations for unit of work {}", operations.size(), unitOfWorkId);
    }

    @Override
    public void retract(UUID unitOfWorkId, List<EntityKey> keys) {
        int removed = 0;
        synchronized (rows) {
            for (EntityKey key : keys) {
                if (rows.remove(new VersionRow(unitOfWorkId, key)) != null) {
                    removed++;
                }
            }
        }
        log.debug("Retracted {} of {} rows for unit of work {}", removed, keys.size(), unitOfWorkId);
    }

    /**
     * Batches written for a unit of work, in flush order.
     */
    public List<List<Operation>> batches(UUID unitOfWorkId) {
        return new ArrayList<>(batchesByUnit.getOrDefault(unitOfWorkId, List.of()));
    }

    /**
     * Current version rows of every unit of work, in the order they were first
     * written.
     */
    public List<Operation> operations() {
        synchronized (rows) {
            return List.copyOf(rows.values());
        }
    }

    /**
     * Current version rows of one unit of work.
     */
    public List<Operation> operations(UUID unitOfWorkId) {
        synchronized (rows) {
            List<Operation> result = new ArrayList<>();
            rows.forEach((row, operation) -> {
                if (row.unitOfWorkId().equals(unitOfWorkId)) {
                    result.add(operation);
                }
            });
            return result;
        }
    }

    public int size() {
        synchronized (rows) {
            return rows.size();
        }
    }

    /**
     * Clears all stored batches and rows (for testing).
     */
    public void clear() {
        batchesByUnit.clear();
        synchronized (rows) {
            rows.clear();
        }
    }

    private record VersionRow(UUID unitOfWorkId, EntityKey key) {
    }
}
