package com.nayem.revision.session;

import com.nayem.revision.core.EntityKey;
import com.nayem.revision.core.Operation;
import com.nayem.revision.core.OperationKind;
import com.nayem.revision.demo.Article;
import com.nayem.revision.metadata.EntityDescriptorRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

class UnitOfWorkTest {

    private EntityDescriptorRegistry registry;
    private InMemoryOperationSink sink;
    private SimpleMeterRegistry meterRegistry;
    private RevisionEngine engine;

    @BeforeEach
    void setUp() {
        registry = EntityDescriptorRegistry.annotationsOnly();
        sink = new InMemoryOperationSink();
        meterRegistry = new SimpleMeterRegistry();
        engine = RevisionEngine.builder()
                .introspector(registry)
                .sink(sink)
                .metrics(meterRegistry)
                .build();
    }

    @Test
    void testCommitWritesNetOperations() {
        Article created = new Article(1L, "New");
        Article edited = new Article(2L, "Old");
        Article dropped = new Article(3L, "Temp");
        registry.markPersisted(edited);

        UnitOfWork unit = engine.begin();
        unit.onInsert(created);
        unit.onUpdate(created, Set.of("title"));
        unit.onUpdate(edited, Set.of("title"));
        unit.onInsert(dropped);
        unit.onDelete(dropped);
        unit.commit();

        assertEquals(UnitOfWorkStatus.COMMITTED, unit.getStatus());
        assertEquals(List.of(
                new Operation(EntityKey.of(Article.class, 1L), OperationKind.INSERT),
                new Operation(EntityKey.of(Article.class, 2L), OperationKind.UPDATE)),
                sink.operations());
        assertEquals(1, sink.batches(unit.getId()).size());
    }

    @Test
    void testFlushEmitsOnlyUnprocessedOperations() {
        Article a = new Article(1L, "A");
        Article b = new Article(2L, "B");

        UnitOfWork unit = engine.begin();
        unit.onInsert(a);
        List<Operation> first = unit.flush();

        unit.onInsert(b);
        List<Operation> second = unit.flush();

        assertEquals(List.of(new Operation(EntityKey.of(Article.class, 1L), OperationKind.INSERT)), first);
        assertEquals(List.of(new Operation(EntityKey.of(Article.class, 2L), OperationKind.INSERT)), second);
        assertTrue(first.get(0).isProcessed());
        assertTrue(unit.flush().isEmpty());
        assertEquals(2, sink.batches(unit.getId()).size());
    }

    @Test
    void testLaterEventReemitsChangedOperation() {
        Article a = new Article(1L, "A");

        UnitOfWork unit = engine.begin();
        unit.onInsert(a);
        unit.flush();
        unit.onUpdate(a, Set.of("title"));
        List<Operation> second = unit.flush();

        assertEquals(List.of(new Operation(EntityKey.of(Article.class, 1L), OperationKind.INSERT)), second);
    }

    @Test
    void testDeleteAfterFlushRetractsEmittedInsert() {
        Article article = new Article(1L, "A");

        UnitOfWork unit = engine.begin();
        unit.onInsert(article);
        unit.flush();
        assertEquals(List.of(new Operation(EntityKey.of(Article.class, 1L), OperationKind.INSERT)),
                sink.operations(unit.getId()));

        unit.onDelete(article);
        unit.commit();

        assertTrue(sink.operations(unit.getId()).isEmpty());
        assertEquals(OperationKind.STALE_VERSION, unit.getLedger().get(EntityKey.of(Article.class, 1L)).getKind());
        assertEquals(Optional.empty(), registry.persistedKeyOf(article));
        assertEquals(1.0, meterRegistry.counter("revision.operations.retracted").count());
    }

    @Test
    void testInsertAgainAfterRetractionIsWrittenAgain() {
        Article article = new Article(1L, "A");

        UnitOfWork unit = engine.begin();
        unit.onInsert(article);
        unit.flush();
        unit.onDelete(article);
        unit.flush();
        unit.onInsert(article);
        unit.commit();

        assertEquals(List.of(new Operation(EntityKey.of(Article.class, 1L), OperationKind.INSERT)),
                sink.operations(unit.getId()));
    }

    @Test
    void testPrimaryKeyChangeAfterFlushLeavesOneRow() {
        Article article = new Article(1L, "A");

        UnitOfWork unit = engine.begin();
        unit.onInsert(article);
        unit.flush();

        article.setId(2L);
        unit.onUpdate(article, Set.of("id"));
        unit.commit();

        assertEquals(List.of(new Operation(EntityKey.of(Article.class, 2L), OperationKind.INSERT)),
                sink.operations(unit.getId()));
        assertEquals(Optional.of(EntityKey.of(Article.class, 2L)), registry.persistedKeyOf(article));
    }

    @Test
    void testRekeyKeepingProcessedFlagIsStillWritten() {
        Article article = new Article(1L, "A");
        OperationSink mockSink = mock(OperationSink.class);
        UnitOfWork unit = RevisionEngine.builder().introspector(registry).sink(mockSink).build().begin();

        unit.onInsert(article);
        unit.flush();
        article.setId(2L);
        assertTrue(unit.getLedger().rekey(article, Set.of("id")));
        List<Operation> emitted = unit.flush();

        assertEquals(List.of(new Operation(EntityKey.of(Article.class, 2L), OperationKind.INSERT)), emitted);
        InOrder inOrder = inOrder(mockSink);
        inOrder.verify(mockSink).retract(unit.getId(), List.of(EntityKey.of(Article.class, 1L)));
        inOrder.verify(mockSink).write(unit.getId(), emitted);
    }

    @Test
    void testRetractionFailureRollsBack() {
        OperationSink failing = mock(OperationSink.class);
        doThrow(new IllegalStateException("version table unavailable"))
                .when(failing).retract(any(UUID.class), anyList());
        UnitOfWork unit = RevisionEngine.builder().introspector(registry).sink(failing).build().begin();
        Article article = new Article(1L, "A");

        unit.onInsert(article);
        unit.flush();
        unit.onDelete(article);

        assertThrows(IllegalStateException.class, unit::commit);
        assertEquals(UnitOfWorkStatus.ROLLED_BACK, unit.getStatus());
        assertEquals(Optional.empty(), registry.persistedKeyOf(article));
    }

    @Test
    void testEmptyFlushDoesNotCallSink() {
        OperationSink mockSink = mock(OperationSink.class);
        UnitOfWork unit = RevisionEngine.builder().introspector(registry).sink(mockSink).build().begin();

        Article a = new Article(1L, "A");
        unit.onInsert(a);
        unit.onDelete(a);
        unit.commit();

        verify(mockSink, never()).write(any(UUID.class), anyList());
        verify(mockSink, never()).retract(any(UUID.class), anyList());
    }

    @Test
    void testCommitRefreshesIdentitiesForLaterRekey() {
        Article article = new Article(1L, "A");

        UnitOfWork first = engine.begin();
        first.onInsert(article);
        first.commit();
        assertEquals(Optional.of(EntityKey.of(Article.class, 1L)), registry.persistedKeyOf(article));

        UnitOfWork second = engine.begin();
        second.onUpdate(article, Set.of("title"));
        article.setId(10L);
        second.onUpdate(article, Set.of("id"));
        second.commit();

        assertEquals(List.of(new Operation(EntityKey.of(Article.class, 10L), OperationKind.UPDATE)),
                sink.batches(second.getId()).get(0));
        assertEquals(Optional.of(EntityKey.of(Article.class, 10L)), registry.persistedKeyOf(article));
    }

    @Test
    void testDeleteForgetsIdentity() {
        Article article = new Article(1L, "A");
        registry.markPersisted(article);

        UnitOfWork unit = engine.begin();
        unit.onDelete(article);
        unit.commit();

        assertEquals(Optional.empty(), registry.persistedKeyOf(article));
    }

    @Test
    void testRollbackRestoresIdentitiesRefreshedByFlush() {
        Article article = new Article(1L, "A");
        registry.markPersisted(article);

        UnitOfWork unit = engine.begin();
        article.setId(2L);
        unit.onUpdate(article, Set.of("id"));
        unit.flush();
        assertEquals(Optional.of(EntityKey.of(Article.class, 2L)), registry.persistedKeyOf(article));

        unit.rollback();

        assertEquals(UnitOfWorkStatus.ROLLED_BACK, unit.getStatus());
        assertEquals(Optional.of(EntityKey.of(Article.class, 1L)), registry.persistedKeyOf(article));
    }

    @Test
    void testSinkFailureRollsBackAndRethrows() {
        AtomicReference<Throwable> handled = new AtomicReference<>();
        OperationSink failing = mock(OperationSink.class);
        doThrow(new IllegalStateException("version table unavailable"))
                .when(failing).write(any(UUID.class), anyList());
        UnitOfWork unit = RevisionEngine.builder()
                .introspector(registry)
                .sink(failing)
                .onError(handled::set)
                .build()
                .begin();
        Article article = new Article(1L, "A");
        unit.onInsert(article);

        IllegalStateException exception = assertThrows(IllegalStateException.class, unit::commit);

        assertEquals("version table unavailable", exception.getMessage());
        assertSame(exception, handled.get());
        assertEquals(UnitOfWorkStatus.ROLLED_BACK, unit.getStatus());
        assertEquals(Optional.empty(), registry.persistedKeyOf(article));
    }

    @Test
    void testFinishedUnitRejectsEvents() {
        UnitOfWork unit = engine.begin();
        unit.commit();

        assertThrows(IllegalStateException.class, () -> unit.onInsert(new Article(1L, "A")));
        assertThrows(IllegalStateException.class, unit::flush);
        assertThrows(IllegalStateException.class, unit::commit);
    }

    @Test
    void testCloseRollsBackActiveUnit() {
        UnitOfWork unit = engine.begin();
        try (unit) {
            unit.onInsert(new Article(1L, "A"));
        }

        assertEquals(UnitOfWorkStatus.ROLLED_BACK, unit.getStatus());
        assertEquals(0, sink.size());
    }

    @Test
    void testCloseAfterCommitKeepsCommittedStatus() {
        UnitOfWork unit = engine.begin();
        unit.commit();
        unit.close();

        assertEquals(UnitOfWorkStatus.COMMITTED, unit.getStatus());
    }

    @Test
    void testTrackingDisabledLeavesIdentitiesAlone() {
        RevisionEngine untracked = RevisionEngine.builder()
                .introspector(registry)
                .sink(sink)
                .trackIdentities(false)
                .build();
        Article article = new Article(1L, "A");

        UnitOfWork unit = untracked.begin();
        unit.onInsert(article);
        unit.commit();

        assertEquals(Optional.empty(), registry.persistedKeyOf(article));
    }

    @Test
    void testMetrics() {
        Article a = new Article(1L, "A");
        Article b = new Article(2L, "B");

        UnitOfWork unit = engine.begin();
        unit.onInsert(a);
        unit.onInsert(b);
        unit.onDelete(b);
        unit.commit();
        engine.begin().rollback();

        assertEquals(2.0, meterRegistry.counter("revision.events", "event", "insert").count());
        assertEquals(1.0, meterRegistry.counter("revision.events", "event", "delete").count());
        assertEquals(1.0, meterRegistry.counter("revision.operations.emitted", "kind", "insert").count());
        assertEquals(1.0, meterRegistry.counter("revision.operations.stale").count());
        assertEquals(1.0, meterRegistry.counter("revision.units", "outcome", "committed").count());
        assertEquals(1.0, meterRegistry.counter("revision.units", "outcome", "rolled_back").count());
        assertEquals(1, meterRegistry.timer("revision.flush.duration").count());
    }

    @Test
    void testChangedEntityTypesAvailableBeforeCommit() {
        UnitOfWork unit = engine.begin();
        unit.onInsert(new Article(1L, "A"));
        unit.onUpdate(new Article(2L, "B"), Set.of("comments"));

        assertEquals(Set.of(Article.class), unit.getLedger().changedEntityTypes());
        assertEquals(1, unit.getLedger().size());
    }
}
