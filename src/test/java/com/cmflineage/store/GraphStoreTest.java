package com.cmflineage.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.cmflineage.identity.ContentHasher;
import com.cmflineage.identity.NodeId;
import com.cmflineage.model.Artifact;
import com.cmflineage.model.ArtifactKind;
import com.cmflineage.model.Context;
import com.cmflineage.model.Event;
import com.cmflineage.model.EventDirection;
import com.cmflineage.model.Execution;
import com.cmflineage.model.Pipeline;

class GraphStoreTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    @Test
    void shouldDeduplicateArtifactsByContentHash() {
        GraphStore store = GraphStore.inMemory("site-a", CLOCK);
        String hash = hash("a,b\n1,2\n");

        ArtifactResolution first = store.getOrCreateArtifact(hash, "data/raw.csv", ArtifactKind.DATASET, Map.of("rows", 1));
        ArtifactResolution second = store.getOrCreateArtifact(hash, "copy/raw.csv", ArtifactKind.DATASET, Map.of("rows", 5, "owner", "ml"));

        assertTrue(first.created());
        assertFalse(second.created());
        assertEquals(first.artifact().id(), second.artifact().id());
        assertEquals("data/raw.csv", second.artifact().logicalPath());
        assertEquals(1.0, second.artifact().properties().get("rows").value());
        assertEquals("ml", second.artifact().properties().get("owner").value());
        assertEquals(1, count(store, GraphView::artifacts));
    }

    @Test
    void shouldTreatDuplicateEventsAsNoOp() {
        GraphStore store = GraphStore.inMemory("site-a", CLOCK);
        Execution execution = newExecution(store, "train");
        Artifact artifact = store.getOrCreateArtifact(hash("x"), "x.bin", ArtifactKind.MODEL, Map.of()).artifact();

        Event first = store.recordEvent(execution, artifact, EventDirection.OUTPUT);
        long revision = store.revision();
        Event second = store.recordEvent(execution, artifact, EventDirection.OUTPUT);

        assertEquals(first, second);
        assertEquals(revision, store.revision());
        assertEquals(1, count(store, GraphView::events));
    }

    @Test
    void shouldRejectWritesReferencingUnknownNodes() {
        GraphStore store = GraphStore.inMemory("site-a", CLOCK);
        Context foreign = new Context(NodeId.of("elsewhere", 3), NodeId.of("elsewhere", 1), "train", "train",
                Map.of(), CLOCK.instant(), NodeId.of("elsewhere", 3), 3);

        assertThrows(InvalidReferenceException.class, () -> store.createExecution(foreign, "trainer", Map.of()));
        assertThrows(InvalidReferenceException.class, () -> store.transact(
                tx -> tx.importEvent(NodeId.of("site-a", 99), NodeId.of("site-a", 100), EventDirection.INPUT, null)));
        assertEquals(0L, store.revision());
    }

    @Test
    void shouldDiscardEverythingWhenWorkFails() {
        GraphStore store = GraphStore.inMemory("site-a", CLOCK);
        store.createPipeline("existing");
        long revision = store.revision();

        assertThrows(IllegalStateException.class, () -> store.transact(tx -> {
            Pipeline pipeline = tx.createPipeline("doomed");
            tx.getOrCreateContext(pipeline, "prepare", "prepare");
            throw new IllegalStateException("boom");
        }));

        assertEquals(revision, store.revision());
        assertTrue(store.read(view -> view.pipelineByName("doomed")).isEmpty());
        assertEquals(1, count(store, GraphView::pipelines));
    }

    @Test
    void shouldDiscardCancelledTransactions() {
        GraphStore store = GraphStore.inMemory("site-a", CLOCK);
        CancellationToken token = CancellationToken.create();

        assertThrows(TransactionCancelledException.class, () -> store.transact(token, tx -> {
            tx.createPipeline("first");
            token.cancel();
            return tx.createPipeline("second");
        }));

        assertEquals(0, count(store, GraphView::pipelines));
        assertEquals(0L, store.revision());
    }

    @Test
    void shouldCancelTransactionsPastTheirDeadline() {
        GraphStore store = GraphStore.inMemory("site-a", CLOCK);
        CancellationToken expired = CancellationToken.withTimeout(Duration.ZERO, CLOCK);

        assertThrows(TransactionCancelledException.class, () -> store.transact(expired, tx -> tx.createPipeline("late")));
        assertEquals(0, count(store, GraphView::pipelines));
    }

    @Test
    void shouldHideUncommittedWritesFromConcurrentReaders() throws Exception {
        GraphStore store = GraphStore.inMemory("site-a", CLOCK);
        ExecutorService reader = Executors.newSingleThreadExecutor();
        try {
            boolean visibleDuringWrite = store.transact(tx -> {
                tx.createPipeline("pending");
                Future<Boolean> seen = reader.submit(() -> store.read(view -> view.pipelineByName("pending").isPresent()));
                try {
                    return seen.get();
                } catch (Exception e) {
                    throw new IllegalStateException(e);
                }
            });

            assertFalse(visibleDuringWrite);
            assertTrue(reader.submit(() -> store.read(view -> view.pipelineByName("pending").isPresent())).get());
        } finally {
            reader.shutdownNow();
        }
    }

    @Test
    void shouldAllocateMonotonicRevisionsForUpdates() {
        GraphStore store = GraphStore.inMemory("site-a", CLOCK);
        Execution execution = newExecution(store, "train");

        Execution updated = store.updateExecutionProperties(execution, Map.of("epochs", 10));

        assertEquals(execution.id(), updated.id());
        assertTrue(updated.revision() > execution.revision());
        assertEquals(updated.revision(), store.revision());
        assertEquals(10.0, store.read(view -> view.execution(execution.id())).orElseThrow().properties().get("epochs").value());
    }

    @Test
    void shouldRejectEventsThatCloseACycle() {
        GraphStore store = GraphStore.inMemory("site-a", CLOCK);
        Execution prepare = newExecution(store, "prepare");
        Execution train = store.createExecution(store.read(view -> view.context(prepare.contextId())).orElseThrow(), "trainer", Map.of());
        Artifact raw = store.getOrCreateArtifact(hash("raw"), "raw.csv", ArtifactKind.DATASET, Map.of()).artifact();
        Artifact model = store.getOrCreateArtifact(hash("model"), "model.pt", ArtifactKind.MODEL, Map.of()).artifact();
        store.recordEvent(prepare, raw, EventDirection.OUTPUT);
        store.recordEvent(train, raw, EventDirection.INPUT);
        store.recordEvent(train, model, EventDirection.OUTPUT);

        assertThrows(LineageCycleException.class, () -> store.recordEvent(prepare, model, EventDirection.INPUT));
        assertThrows(LineageCycleException.class, () -> store.recordEvent(train, raw, EventDirection.OUTPUT));
        assertEquals(3, count(store, GraphView::events));
    }

    @Test
    void shouldReopenFromSnapshotWithSameContentAndContinueSequence() throws IOException {
        Path snapshot = tempDir.resolve("store").resolve("graph.json");
        GraphStore store = GraphStore.open("site-a", snapshot, CLOCK);
        Execution execution = newExecution(store, "train");
        Artifact model = store.getOrCreateArtifact(hash("m"), "model.pt", ArtifactKind.MODEL, Map.of("accuracy", 0.91)).artifact();
        store.recordEvent(execution, model, EventDirection.OUTPUT);

        GraphStore reopened = GraphStore.open("site-a", snapshot, CLOCK);

        assertEquals(store.revision(), reopened.revision());
        assertEquals(store.snapshot(), reopened.snapshot());
        assertEquals(execution, reopened.read(view -> view.executionByOrigin(execution.origin())).orElseThrow());
        Pipeline next = reopened.createPipeline("second");
        assertTrue(next.id().sequence() > store.revision());
    }

    @Test
    void shouldGenerateStoreIdOnceAndKeepItAcrossReopen() throws IOException {
        Path snapshot = tempDir.resolve("generated").resolve("graph.json");
        GraphStore created = GraphStore.open(snapshot, CLOCK);

        assertTrue(created.storeId().startsWith("store-"));
        assertTrue(Files.exists(snapshot));
        GraphStore other = GraphStore.open(tempDir.resolve("other.json"), CLOCK);
        assertFalse(created.storeId().equals(other.storeId()));

        created.createPipeline("p");
        GraphStore reopened = GraphStore.open(snapshot, CLOCK);

        assertEquals(created.storeId(), reopened.storeId());
        assertTrue(reopened.read(view -> view.pipelineByName("p")).isPresent());
    }

    @Test
    void shouldRefuseSnapshotOfAnotherStore() throws IOException {
        Path snapshot = tempDir.resolve("graph.json");
        GraphStore.open("site-a", snapshot, CLOCK).createPipeline("p");

        assertThrows(IllegalStateException.class, () -> GraphStore.open("site-b", snapshot, CLOCK));
    }

    @Test
    void shouldReturnExistingPipelineWithoutAllocatingRevision() {
        GraphStore store = GraphStore.inMemory("site-a", CLOCK);
        Pipeline pipeline = store.createPipeline("p");
        long revision = store.revision();

        Pipeline again = store.transact(tx -> tx.createPipeline("p"));

        assertEquals(pipeline, again);
        assertEquals(revision, store.revision());
        assertEquals(1, count(store, GraphView::pipelines));
    }

    private static Execution newExecution(GraphStore store, String stage) {
        Pipeline pipeline = store.createPipeline("churn");
        Context context = store.getOrCreateContext(pipeline, stage, stage);
        return store.createExecution(context, stage + "-tool", Map.of());
    }

    private static String hash(String content) {
        return ContentHasher.fingerprint(content.getBytes(StandardCharsets.UTF_8));
    }

    private static int count(GraphStore store, Function<GraphView, ? extends Collection<?>> items) {
        return store.read(view -> items.apply(view).size());
    }
}
