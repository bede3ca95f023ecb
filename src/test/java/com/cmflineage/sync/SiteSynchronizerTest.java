package com.cmflineage.sync;

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
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.cmflineage.identity.NodeId;
import com.cmflineage.model.Artifact;
import com.cmflineage.model.ArtifactKind;
import com.cmflineage.model.EventDirection;
import com.cmflineage.model.Execution;
import com.cmflineage.query.NotFoundException;
import com.cmflineage.store.GraphStore;
import com.cmflineage.store.GraphView;
import com.cmflineage.writer.LineageWriter;
import com.cmflineage.writer.LoggedArtifact;

class SiteSynchronizerTest {

    private static final Clock CENTRAL_CLOCK = Clock.fixed(Instant.parse("2024-03-01T12:00:00Z"), ZoneOffset.UTC);
    private static final Clock SITE_A_CLOCK = Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC);
    private static final Clock SITE_B_CLOCK = Clock.fixed(Instant.parse("2024-03-01T11:00:00Z"), ZoneOffset.UTC);
    private static final byte[] RAW = "id,label\n1,cat\n".getBytes(StandardCharsets.UTF_8);

    @TempDir
    Path tempDir;

    @Test
    void shouldMergeIdenticalContentFromTwoSitesIntoOneArtifact() throws Exception {
        CentralSyncService central = central();
        GraphStore siteA = GraphStore.inMemory("site-a", SITE_A_CLOCK);
        GraphStore siteB = GraphStore.inMemory("site-b", SITE_B_CLOCK);
        logRawOutput(siteA, "prepare.py");
        logRawOutput(siteB, "prepare.py");

        synchronizer(siteA, new InProcessSyncTransport(central, 100), null).push(List.of());
        synchronizer(siteB, new InProcessSyncTransport(central, 100), null).push(List.of());

        GraphStore store = central.store();
        assertEquals(1, count(store, GraphView::pipelines));
        NodeId pipelineId = store.read(view -> view.pipelineByName("churn")).orElseThrow().id();
        assertEquals(1, count(store, view -> view.contextsOf(pipelineId)));
        assertEquals(2, count(store, view -> view.executionsOfPipeline(pipelineId)));
        assertEquals(1, count(store, GraphView::artifacts));
        assertEquals(2, count(store, GraphView::events));
        List<Execution> executions = store.read(view -> view.executionsOfPipeline(pipelineId));
        assertTrue(executions.get(0).originatedIn("site-a"));
        assertTrue(executions.get(1).originatedIn("site-b"));
    }

    @Test
    void shouldTreatRepeatedPushOfSameBatchAsOne() throws IOException {
        CentralSyncService central = central();
        GraphStore site = GraphStore.inMemory("site-a", SITE_A_CLOCK);
        logRawOutput(site, "prepare.py");
        SyncBatch batch = site.read(view -> BatchBuilder.forPush(view, Map.of("churn", 0L)));

        PushReceipt first = central.push(batch);
        var afterFirst = central.store().snapshot();
        PushReceipt second = central.push(batch);

        assertEquals(afterFirst, central.store().snapshot());
        assertEquals(first.idMapping(), second.idMapping());
        assertEquals(5, first.stats().created());
        assertEquals(0, second.stats().created());
        assertEquals(1, second.stats().executionsSkipped());
        assertEquals(1, second.stats().eventsCollapsed());
    }

    @Test
    void shouldExposeNothingUntilInterruptedPushIsResent() throws Exception {
        CentralSyncService central = central();
        GraphStore site = GraphStore.inMemory("site-a", SITE_A_CLOCK);
        logRawOutput(site, "prepare.py");
        AtomicInteger chunks = new AtomicInteger();
        InProcessSyncTransport flaky = new InProcessSyncTransport(central, 1) {
            @Override
            protected void sendChunk(String sessionId, List<BatchEntry> chunk) {
                if (chunks.incrementAndGet() == 4) {
                    throw new SyncTransportException("connection reset after 3 entries", true);
                }
                super.sendChunk(sessionId, chunk);
            }
        };
        SiteSynchronizer synchronizer = synchronizer(site, flaky, null);

        assertThrows(SyncTransportException.class, () -> synchronizer.push(List.of("churn")));

        assertEquals(0, central.openSessions());
        assertEquals(0, count(central.store(), GraphView::pipelines));
        assertEquals(0L, central.store().revision());
        assertEquals(PipelineSyncStatus.DIRTY, synchronizer.status("churn"));
        assertEquals(0L, synchronizer.pushedRevision("churn"));

        SiteSynchronizer.PushOutcome outcome = synchronizer.push(List.of("churn"));

        assertEquals(5, outcome.entriesSent());
        assertEquals(1, count(central.store(), GraphView::artifacts));
        assertEquals(1, count(central.store(), GraphView::events));
        assertEquals(PipelineSyncStatus.CLEAN, synchronizer.status("churn"));
        assertEquals(site.revision(), synchronizer.pushedRevision("churn"));
    }

    @Test
    void shouldRetryRetriableFailuresWithWholeBatch() throws Exception {
        CentralSyncService central = central();
        GraphStore site = GraphStore.inMemory("site-a", SITE_A_CLOCK);
        logRawOutput(site, "prepare.py");
        AtomicInteger attempts = new AtomicInteger();
        SyncTransport flaky = new SyncTransport() {
            @Override
            public PushReceipt push(SyncBatch batch) {
                if (attempts.incrementAndGet() < 3) {
                    throw new SyncTransportException("timeout", true);
                }
                return central.push(batch);
            }

            @Override
            public SyncBatch pull(PullRequest request) {
                return central.pull(request);
            }
        };
        SiteSynchronizer synchronizer = new SiteSynchronizer(site, flaky, new SyncStateStore(null),
                new SyncRetrier(3, Duration.ZERO, millis -> {
                }));

        synchronizer.push(List.of());

        assertEquals(3, attempts.get());
        assertEquals(1, count(central.store(), GraphView::artifacts));
        assertEquals(PipelineSyncStatus.CLEAN, synchronizer.status("churn"));
    }

    @Test
    void shouldPullRemoteExecutionsWithoutPushingThemBack() throws Exception {
        CentralSyncService central = central();
        GraphStore siteA = GraphStore.inMemory("site-a", SITE_A_CLOCK);
        GraphStore siteB = GraphStore.inMemory("site-b", SITE_B_CLOCK);
        Execution produced = logRawOutput(siteA, "prepare.py");
        synchronizer(siteA, new InProcessSyncTransport(central, 100), null).push(List.of());
        SiteSynchronizer synchronizerB = synchronizer(siteB, new InProcessSyncTransport(central, 100), null);

        SiteSynchronizer.PullOutcome pulled = synchronizerB.pull(List.of("churn"));

        assertEquals(5, pulled.entriesReceived());
        Execution copy = siteB.read(view -> view.executionByOrigin(produced.origin())).orElseThrow();
        assertEquals(produced.uuid(), copy.uuid());
        assertFalse(copy.originatedIn("site-b"));
        assertEquals(central.store().revision(), synchronizerB.pulledRevision("churn"));
        assertEquals(PipelineSyncStatus.CLEAN, synchronizerB.status("churn"));
        assertFalse(synchronizerB.push(List.of("churn")).sent());
        assertEquals(0, synchronizerB.pull(List.of("churn")).entriesReceived());
    }

    @Test
    void shouldPersistHighWaterMarksAndIdMapping() throws Exception {
        CentralSyncService central = central();
        GraphStore site = GraphStore.inMemory("site-a", SITE_A_CLOCK);
        Execution execution = logRawOutput(site, "prepare.py");
        Path statePath = tempDir.resolve("sync").resolve("state.json");
        synchronizer(site, new InProcessSyncTransport(central, 100), statePath).push(List.of());

        SiteSynchronizer reloaded = synchronizer(site, new InProcessSyncTransport(central, 100), statePath);

        assertTrue(Files.exists(statePath));
        assertEquals(site.revision(), reloaded.pushedRevision("churn"));
        NodeId centralId = reloaded.centralIdOf(execution.id()).orElseThrow();
        assertEquals("central", centralId.storeId());
        assertEquals(execution.origin(), central.store().read(view -> view.execution(centralId)).orElseThrow().origin());
        assertEquals(Map.of("churn", PipelineSyncStatus.CLEAN), reloaded.statuses());
    }

    @Test
    void shouldMarkPipelineDirtyAfterNewLocalWrites() throws Exception {
        CentralSyncService central = central();
        GraphStore site = GraphStore.inMemory("site-a", SITE_A_CLOCK);
        logRawOutput(site, "prepare.py");
        SiteSynchronizer synchronizer = synchronizer(site, new InProcessSyncTransport(central, 100), null);
        synchronizer.push(List.of());

        logRawOutput(site, "prepare-v2.py");

        assertEquals(PipelineSyncStatus.DIRTY, synchronizer.status("churn"));
        SiteSynchronizer.PushOutcome outcome = synchronizer.push(List.of());
        assertEquals(5, outcome.entriesSent());
        assertEquals(2, count(central.store(), GraphView::events));
        assertEquals(1, count(central.store(), GraphView::artifacts));
    }

    @Test
    void shouldReportConflictingArtifactPropertiesAndKeepLatest() throws Exception {
        CentralSyncService central = central();
        GraphStore siteA = GraphStore.inMemory("site-a", SITE_A_CLOCK);
        GraphStore siteB = GraphStore.inMemory("site-b", SITE_B_CLOCK);
        Artifact fromA = logRawOutput(siteA, "prepare.py", Map.of("owner", "alice"));
        logRawOutput(siteB, "prepare.py", Map.of("owner", "bob"));
        synchronizer(siteA, new InProcessSyncTransport(central, 100), null).push(List.of());

        SiteSynchronizer.PushOutcome outcome = synchronizer(siteB, new InProcessSyncTransport(central, 100), null).push(List.of());

        assertEquals(1, outcome.receipt().conflicts().size());
        assertEquals("owner", outcome.receipt().conflicts().get(0).key());
        Artifact merged = central.store().read(view -> view.artifactByHash(fromA.hash())).orElseThrow();
        assertEquals("bob", merged.properties().get("owner").value());
    }

    @Test
    void shouldPushSingleExecutionWithoutMovingHighWaterMark() throws Exception {
        CentralSyncService central = central();
        GraphStore site = GraphStore.inMemory("site-a", SITE_A_CLOCK);
        logRawOutput(site, "prepare.py");
        Execution rerun = logRawOutput(site, "prepare-v2.py");
        SiteSynchronizer synchronizer = synchronizer(site, new InProcessSyncTransport(central, 100), null);

        SiteSynchronizer.PushOutcome outcome = synchronizer.pushExecution("churn", rerun.uuid());

        assertEquals(5, outcome.entriesSent());
        assertEquals(1, count(central.store(), GraphView::events));
        assertTrue(central.store().read(view -> view.executionByOrigin(rerun.origin())).isPresent());
        assertEquals(0L, synchronizer.pushedRevision("churn"));
        assertEquals(PipelineSyncStatus.DIRTY, synchronizer.status("churn"));

        synchronizer.push(List.of());

        assertEquals(2, count(central.store(), GraphView::events));
        assertEquals(PipelineSyncStatus.CLEAN, synchronizer.status("churn"));
    }

    @Test
    void shouldPullSingleExecutionFromCentral() throws Exception {
        CentralSyncService central = central();
        GraphStore siteA = GraphStore.inMemory("site-a", SITE_A_CLOCK);
        GraphStore siteB = GraphStore.inMemory("site-b", SITE_B_CLOCK);
        Execution first = logRawOutput(siteA, "prepare.py");
        Execution second = logRawOutput(siteA, "prepare-v2.py");
        synchronizer(siteA, new InProcessSyncTransport(central, 100), null).push(List.of());
        SiteSynchronizer synchronizerB = synchronizer(siteB, new InProcessSyncTransport(central, 100), null);

        synchronizerB.pullExecution("churn", first.uuid());

        assertTrue(siteB.read(view -> view.executionByOrigin(first.origin())).isPresent());
        assertFalse(siteB.read(view -> view.executionByOrigin(second.origin())).isPresent());
        assertEquals(1, count(siteB, GraphView::events));
        assertEquals(0L, synchronizerB.pulledRevision("churn"));
    }

    @Test
    void shouldRejectUnknownExecutionUuid() throws Exception {
        CentralSyncService central = central();
        GraphStore site = GraphStore.inMemory("site-a", SITE_A_CLOCK);
        logRawOutput(site, "prepare.py");
        SiteSynchronizer synchronizer = synchronizer(site, new InProcessSyncTransport(central, 100), null);

        assertThrows(NotFoundException.class, () -> synchronizer.pushExecution("churn", "no-such-run"));
        assertThrows(NotFoundException.class, () -> synchronizer.pullExecution("churn", "no-such-run"));
        assertEquals(0L, central.store().revision());
    }

    private CentralSyncService central() {
        return new CentralSyncService(GraphStore.inMemory("central", CENTRAL_CLOCK), Duration.ofMinutes(10), Duration.ZERO);
    }

    private static SiteSynchronizer synchronizer(GraphStore store, SyncTransport transport, Path statePath) throws IOException {
        return new SiteSynchronizer(store, transport, new SyncStateStore(statePath), SyncRetrier.none());
    }

    private static Execution logRawOutput(GraphStore store, String tool) throws IOException {
        LineageWriter writer = new LineageWriter(store);
        writer.createContext("churn", "prepare", "prepare", Map.of());
        Execution execution = writer.createExecution(tool, Map.of());
        writer.logArtifact("data/raw.csv", RAW, EventDirection.OUTPUT, ArtifactKind.DATASET, Map.of());
        return execution;
    }

    private static Artifact logRawOutput(GraphStore store, String tool, Map<String, ?> properties) throws IOException {
        LineageWriter writer = new LineageWriter(store);
        writer.createContext("churn", "prepare", "prepare", Map.of());
        writer.createExecution(tool, Map.of());
        LoggedArtifact logged = writer.logArtifact("data/raw.csv", RAW, EventDirection.OUTPUT, ArtifactKind.DATASET, properties);
        return logged.artifact();
    }

    private static int count(GraphStore store, Function<GraphView, ? extends Collection<?>> items) {
        return store.read(view -> items.apply(view).size());
    }
}
