package com.nayem.revision.session;

import com.nayem.revision.core.EntityKey;
import com.nayem.revision.core.Operation;
import com.nayem.revision.core.OperationKind;
import com.nayem.revision.demo.Article;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryOperationSinkTest {

    private final InMemoryOperationSink sink = new InMemoryOperationSink();

    @Test
    void testRewriteOfSameKeyReplacesRow() {
        UUID unit = UUID.randomUUID();
        EntityKey key = EntityKey.of(Article.class, 1L);

        sink.write(unit, List.of(new Operation(key, OperationKind.INSERT)));
        sink.write(unit, List.of(new Operation(key, OperationKind.UPDATE)));

        assertEquals(List.of(new Operation(key, OperationKind.UPDATE)), sink.operations(unit));
        assertEquals(2, sink.batches(unit).size());
    }

    @Test
    void testRetractOnlyTouchesItsUnitOfWork() {
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();
        EntityKey key = EntityKey.of(Article.class, 1L);
        sink.write(first, List.of(new Operation(key, OperationKind.INSERT)));
        sink.write(second, List.of(new Operation(key, OperationKind.DELETE)));

        sink.retract(first, List.of(key, EntityKey.of(Article.class, 99L)));

        assertTrue(sink.operations(first).isEmpty());
        assertEquals(List.of(new Operation(key, OperationKind.DELETE)), sink.operations());
    }

    @Test
    void testClear() {
        UUID unit = UUID.randomUUID();
        sink.write(unit, List.of(new Operation(EntityKey.of(Article.class, 1L), OperationKind.INSERT)));

        sink.clear();

        assertEquals(0, sink.size());
        assertTrue(sink.batches(unit).isEmpty());
    }
}
