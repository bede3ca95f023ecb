package com.cmflineage.sync;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.cmflineage.model.ArtifactKind;
import com.cmflineage.model.EventDirection;
import com.cmflineage.store.GraphStore;
import com.cmflineage.writer.LineageWriter;
import com.fasterxml.jackson.databind.ObjectMapper;

class BatchBuilderTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC);

    @Test
    void shouldOrderEntriesParentsFirst() throws IOException {
        GraphStore store = GraphStore.inMemory("site-a", CLOCK);
        LineageWriter writer = new LineageWriter(store);
        writer.createContext("churn", "train", "train", Map.of());
        writer.createExecution("train.py", Map.of());
        writer.logArtifact("model.pt", bytes("weights"), EventDirection.OUTPUT, ArtifactKind.MODEL, Map.of());

        SyncBatch batch = store.read(view -> BatchBuilder.forPush(view, Map.of("churn", 0L)));

        assertEquals("site-a", batch.sourceStoreId());
        assertEquals(store.revision(), batch.highWaterMark());
        List<BatchEntry> entries = batch.entries();
        assertEquals(5, entries.size());
        assertInstanceOf(BatchEntry.PipelineEntry.class, entries.get(0));
        assertInstanceOf(BatchEntry.ContextEntry.class, entries.get(1));
        assertInstanceOf(BatchEntry.ExecutionEntry.class, entries.get(2));
        assertInstanceOf(BatchEntry.ArtifactEntry.class, entries.get(3));
        assertInstanceOf(BatchEntry.EventEntry.class, entries.get(4));
    }

    @Test
    void shouldCloseIncrementalBatchesOverTheirParents() throws IOException {
        GraphStore store = GraphStore.inMemory("site-a", CLOCK);
        LineageWriter writer = new LineageWriter(store);
        writer.createContext("churn", "train", "train", Map.of());
        writer.createExecution("train.py", Map.of());
        writer.logArtifact("raw.csv", bytes("raw"), EventDirection.INPUT, ArtifactKind.DATASET, Map.of());
        long pushed = store.revision();
        writer.logArtifact("model.pt", bytes("weights"), EventDirection.OUTPUT, ArtifactKind.MODEL, Map.of());

        SyncBatch batch = store.read(view -> BatchBuilder.forPush(view, Map.of("churn", pushed)));

        assertEquals(5, batch.size());
        BatchEntry.EventEntry event = (BatchEntry.EventEntry) batch.entries().get(4);
        assertEquals(EventDirection.OUTPUT, event.direction());
        assertTrue(batch.entries().stream()
                .filter(BatchEntry.ArtifactEntry.class::isInstance)
                .map(entry -> ((BatchEntry.ArtifactEntry) entry).logicalPath())
                .allMatch("model.pt"::equals));
    }

    @Test
    void shouldBeEmptyWhenNothingChangedOrPipelineUnknown() throws IOException {
        GraphStore store = GraphStore.inMemory("site-a", CLOCK);
        LineageWriter writer = new LineageWriter(store);
        writer.createContext("churn", "train", "train", Map.of());
        writer.createExecution("train.py", Map.of());

        assertTrue(store.read(view -> BatchBuilder.forPush(view, Map.of("churn", store.revision()))).isEmpty());
        assertTrue(store.read(view -> BatchBuilder.forPull(view, List.of("missing"), 0L)).isEmpty());
    }

    @Test
    void shouldSurviveJsonRoundTrip() throws IOException {
        GraphStore store = GraphStore.inMemory("site-a", CLOCK);
        LineageWriter writer = new LineageWriter(store);
        writer.createContext("churn", "train", "train", Map.of("framework", "torch"));
        writer.createExecution("train.py", Map.of("epochs", 3, "resume", false));
        writer.logArtifact("model.pt", bytes("weights"), EventDirection.OUTPUT, ArtifactKind.MODEL, Map.of("accuracy", 0.9));
        SyncBatch batch = store.read(view -> BatchBuilder.forPush(view, Map.of("churn", 0L)));
        ObjectMapper mapper = SyncJson.mapper();

        SyncBatch decoded = mapper.readValue(mapper.writeValueAsString(batch), SyncBatch.class);

        assertEquals(batch, decoded);
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
