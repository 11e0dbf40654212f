package com.nayem.revision.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nayem.revision.core.EntityKey;
import com.nayem.revision.core.Operation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.UUID;

/**
 * {@link OperationSink} that writes each batch to the log as one JSON line.
 * <p>
 * Used when the application does not provide its own sink. Serialization
 * failures are rethrown as {@link IllegalStateException} so the unit of work
 * rolls back instead of treating the batch as written.
 * </p>
 */
public class LoggingOperationSink implements OperationSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingOperationSink.class);

    private final ObjectMapper objectMapper;

    public LoggingOperationSink(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void write(UUID unitOfWorkId, List<Operation> operations) {
        List<OperationRecord> records = operations.stream()
                .map(OperationRecord::of)
                .toList();
        log.info("{}", serialize(unitOfWorkId, new BatchRecord(unitOfWorkId.toString(), records)));
    }

    @Override
    public void retract(UUID unitOfWorkId, List<EntityKey> keys) {
        List<KeyRecord> records = keys.stream()
                .map(KeyRecord::of)
                .toList();
        log.info("{}", serialize(unitOfWorkId, new RetractionRecord(unitOfWorkId.toString(), records)));
    }

    String render(UUID unitOfWorkId, List<Operation> operations) throws JsonProcessingException {
        List<OperationRecord> records = operations.stream()
                .map(OperationRecord::of)
                .toList();
        return objectMapper.writeValueAsString(new BatchRecord(unitOfWorkId.toString(), records));
    }

    private String serialize(UUID unitOfWorkId, Object record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} of unit of work {}", record.getClass().getSimpleName(), unitOfWorkId, e);
            throw new IllegalStateException("Failed to serialize operations of unit of work " + unitOfWorkId, e);
        }
    }

    record BatchRecord(String unitOfWork, List<OperationRecord> operations) {
    }

    record RetractionRecord(String unitOfWork, List<KeyRecord> retracted) {
    }

    record OperationRecord(String entity, List<Object> primaryKey, String kind, int code) {
        static OperationRecord of(Operation operation) {
            return new OperationRecord(
                    operation.getKey().entityType().getName(),
                    operation.getKey().primaryKey(),
                    operation.getKind().name(),
                    operation.getKind().getCode());
        }
    }

    record KeyRecord(String entity, List<Object> primaryKey) {
        static KeyRecord of(EntityKey key) {
            return new KeyRecord(key.entityType().getName(), key.primaryKey());
        }
    }
}
