package com.cmflineage.writer;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.cmflineage.blob.FileSystemBlobStore;
import com.cmflineage.blob.InMemoryBlobStore;
import com.cmflineage.identity.ContentHasher;
import com.cmflineage.model.Artifact;
import com.cmflineage.model.ArtifactKind;
import com.cmflineage.model.Context;
import com.cmflineage.model.Event;
import com.cmflineage.model.EventDirection;
import com.cmflineage.model.Execution;
import com.cmflineage.store.GraphStore;
import com.cmflineage.store.GraphView;

class LineageWriterTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC);
    private static final byte[] RAW = "id,label\n1,cat\n2,dog\n".getBytes(StandardCharsets.UTF_8);

    @TempDir
    Path tempDir;

    @Test
    void shouldShareOneArtifactBetweenProducerAndConsumer() throws IOException {
        GraphStore store = GraphStore.inMemory("site-a", CLOCK);
        LineageWriter writer = new LineageWriter(store, new InMemoryBlobStore());

        writer.createContext("churn", "prepare", "prepare", Map.of());
        Execution prepare = writer.createExecution("prepare.py", Map.of());
        LoggedArtifact produced = writer.logArtifact("data/raw.csv", RAW, EventDirection.OUTPUT, ArtifactKind.DATASET, Map.of());

        writer.createContext("churn", "train", "train", Map.of("framework", "torch"));
        Execution train = writer.createExecution("train.py", Map.of("epochs", 3));
        LoggedArtifact consumed = writer.logArtifact("data/raw.csv", RAW, EventDirection.INPUT, ArtifactKind.DATASET, Map.of());
        writer.logArtifact("model.pt", "weights".getBytes(StandardCharsets.UTF_8), EventDirection.OUTPUT, ArtifactKind.MODEL, Map.of());

        assertTrue(produced.created());
        assertTrue(consumed.deduplicated());
        Artifact raw = produced.artifact();
        assertEquals(ContentHasher.fingerprint(RAW), raw.hash());
        assertEquals(raw.id(), consumed.artifact().id());

        List<Event> rawEvents = store.read(view -> view.eventsOfArtifact(raw.id()));
        assertEquals(2, rawEvents.size());
        assertEquals(prepare.id(), rawEvents.get(0).executionId());
        assertEquals(EventDirection.OUTPUT, rawEvents.get(0).direction());
        assertEquals(train.id(), rawEvents.get(1).executionId());
        assertEquals(EventDirection.INPUT, rawEvents.get(1).direction());
        assertEquals(2, count(store, GraphView::artifacts));
    }

    @Test
    void shouldWarnWhenPathIsReloggedWithDifferentContent() throws IOException {
        GraphStore store = GraphStore.inMemory("site-a", CLOCK);
        LineageWriter writer = new LineageWriter(store);
        writer.createContext("churn", "prepare", "prepare", Map.of());
        writer.createExecution("prepare.py", Map.of());

        LoggedArtifact first = writer.logArtifact("data/raw.csv", RAW, EventDirection.OUTPUT, ArtifactKind.DATASET, Map.of());
        LoggedArtifact second = writer.logArtifact("data/raw.csv", "changed".getBytes(StandardCharsets.UTF_8),
                EventDirection.OUTPUT, ArtifactKind.DATASET, Map.of());

        assertTrue(first.warnings().isEmpty());
        assertEquals(1, second.warnings().size());
        assertEquals(LineageWarning.Kind.HASH_MISMATCH, second.warnings().get(0).kind());
        assertEquals(first.artifact(), store.read(view -> view.artifact(first.artifact().id())).orElseThrow());
        assertEquals(2, count(store, GraphView::artifacts));
    }

    @Test
    void shouldHashFilesAndUploadThemToBlobStore() throws IOException {
        GraphStore store = GraphStore.inMemory("site-a", CLOCK);
        FileSystemBlobStore blobs = new FileSystemBlobStore(tempDir.resolve("blobs"));
        LineageWriter writer = new LineageWriter(store, blobs);
        Path file = tempDir.resolve("raw.csv");
        Files.write(file, RAW);
        writer.createContext("churn", "prepare", null, Map.of());
        writer.createExecution("prepare.py", Map.of());

        LoggedArtifact logged = writer.logArtifact(file, EventDirection.OUTPUT, ArtifactKind.DATASET, Map.of("rows", 2));

        assertTrue(blobs.contains(logged.artifact().hash()));
        assertArrayEquals(RAW, blobs.get(logged.artifact().hash()).orElseThrow());
        assertEquals(2.0, logged.artifact().properties().get("rows").value());
    }

    @Test
    void shouldLogMetricsAsDeduplicatedMetricArtifacts() throws IOException {
        GraphStore store = GraphStore.inMemory("site-a", CLOCK);
        LineageWriter writer = new LineageWriter(store);
        writer.createContext("churn", "evaluate", "evaluate", Map.of());
        writer.createExecution("eval.py", Map.of());

        LoggedArtifact first = writer.logMetrics("eval", Map.of("auc", 0.93, "loss", 0.21));
        LoggedArtifact second = writer.logMetrics("eval", Map.of("loss", 0.21, "auc", 0.93));

        assertEquals(ArtifactKind.METRIC, first.artifact().kind());
        assertEquals("metrics/eval", first.artifact().logicalPath());
        assertEquals(first.artifact().id(), second.artifact().id());
        assertEquals(0.93, first.artifact().properties().get("auc").value());
        assertEquals(1, count(store, GraphView::events));
    }

    @Test
    void shouldReuseContextAndStartNewExecutionsPerRun() {
        GraphStore store = GraphStore.inMemory("site-a", CLOCK);
        LineageWriter writer = new LineageWriter(store);

        Context first = writer.createContext("churn", "train", "train", Map.of());
        Execution run1 = writer.createExecution("train.py", Map.of());
        Context second = writer.createContext("churn", "train", "train", Map.of());
        Execution run2 = writer.createExecution("train.py", Map.of());

        assertEquals(first.id(), second.id());
        assertFalse(run1.id().equals(run2.id()));
        assertFalse(run1.uuid().equals(run2.uuid()));
        assertEquals(2, count(store, view -> view.executionsOf(first.id())));
    }

    @Test
    void shouldRequireContextAndExecutionBeforeLogging() {
        LineageWriter writer = new LineageWriter(GraphStore.inMemory("site-a", CLOCK));

        assertThrows(IllegalStateException.class, () -> writer.createExecution("train.py", Map.of()));
        writer.createContext("churn", "train", "train", Map.of());
        assertThrows(IllegalStateException.class,
                () -> writer.logArtifact("x", RAW, EventDirection.INPUT, ArtifactKind.DATASET, Map.of()));
    }

    @Test
    void shouldUpdatePropertiesOfCurrentExecution() {
        LineageWriter writer = new LineageWriter(GraphStore.inMemory("site-a", CLOCK));
        writer.createContext("churn", "train", "train", Map.of());
        writer.createExecution("train.py", Map.of("epochs", 3));

        Execution updated = writer.updateExecutionProperties(Map.of("epochs", 5, "status", "done"));

        assertEquals(5.0, updated.properties().get("epochs").value());
        assertEquals("done", updated.properties().get("status").value());
        assertEquals(updated, writer.currentExecution().orElseThrow());
    }

    private static int count(GraphStore store, Function<GraphView, ? extends Collection<?>> items) {
        return store.read(view -> items.apply(view).size());
    }
}
