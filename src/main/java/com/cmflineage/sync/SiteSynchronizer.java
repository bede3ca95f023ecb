package com.cmflineage.sync;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cmflineage.identity.NodeId;
import com.cmflineage.model.Pipeline;
import com.cmflineage.store.GraphStore;
import com.cmflineage.store.LineageException;

/**
 * Site side of synchronization. High-water marks move only after the other side acknowledged, so any
 * failure leaves them where they were and the next round re-sends the same entities.
 */
public class SiteSynchronizer {
    private static final Logger log = LoggerFactory.getLogger(SiteSynchronizer.class);

    private final GraphStore store;
    private final SyncTransport transport;
    private final SyncStateStore stateStore;
    private final SyncRetrier retrier;
    private final Clock clock;
    private final SyncState state;

    public SiteSynchronizer(GraphStore store, SyncTransport transport, SyncStateStore stateStore, SyncRetrier retrier) throws IOException {
        this.store = store;
        this.transport = transport;
        this.stateStore = stateStore;
        this.retrier = retrier;
        this.clock = store.clock();
        this.state = stateStore.load(store.storeId());
    }

    public synchronized PushOutcome push(Collection<String> pipelines) throws IOException, InterruptedException {
        List<String> names = resolve(pipelines);
        Map<String, Long> since = new LinkedHashMap<>();
        names.forEach(name -> since.put(name, state.pipeline(name).pushedRevision));
        SyncBatch batch = store.read(view -> BatchBuilder.forPush(view, since));
        if (batch.isEmpty()) {
            for (String name : names) {
                SyncState.PipelineState pipelineState = state.pipeline(name);
                pipelineState.pushedRevision = Math.max(pipelineState.pushedRevision, batch.highWaterMark());
                pipelineState.status = computeStatus(name, pipelineState);
            }
            stateStore.save(state);
            log.info("sync.push.skipped pipelines={} reason=no-changes", names);
            return new PushOutcome(names, 0, null);
        }

        mark(names, PipelineSyncStatus.PUSHING);
        PushReceipt receipt;
        try {
            receipt = retrier.run("push", () -> transport.push(batch));
        } catch (LineageException e) {
            fail(names, e);
            throw e;
        }

        long now = clock.millis();
        receipt.idMapping().entries().forEach(entry -> state.idMapping.put(entry.source().toString(), entry.target().toString()));
        for (String name : names) {
            SyncState.PipelineState pipelineState = state.pipeline(name);
            pipelineState.pushedRevision = Math.max(pipelineState.pushedRevision, batch.highWaterMark());
            pipelineState.lastPushAtEpochMs = now;
            pipelineState.lastError = null;
            pipelineState.status = computeStatus(name, pipelineState);
        }
        stateStore.save(state);
        log.info("sync.push.accepted source={} pipelines={} entries={} centralRevision={} conflicts={}",
                store.storeId(), names, batch.size(), receipt.centralRevision(), receipt.conflicts().size());
        return new PushOutcome(names, batch.size(), receipt);
    }

    public synchronized PullOutcome pull(Collection<String> pipelines) throws IOException, InterruptedException {
        List<String> names = resolve(pipelines);
        Map<Long, List<String>> bySince = new TreeMap<>();
        names.forEach(name -> bySince.computeIfAbsent(state.pipeline(name).pulledRevision, ignored -> new ArrayList<>()).add(name));

        int received = 0;
        List<MergeResult> results = new ArrayList<>();
        for (Map.Entry<Long, List<String>> group : bySince.entrySet()) {
            List<String> groupNames = group.getValue();
            mark(groupNames, PipelineSyncStatus.PULLING);
            SyncBatch batch;
            MergeResult result;
            try {
                batch = retrier.run("pull", () -> transport.pull(new PullRequest(group.getKey(), groupNames, null)));
                result = store.transact(tx -> BatchMerger.apply(tx, batch));
            } catch (LineageException e) {
                fail(groupNames, e);
                throw e;
            }
            long now = clock.millis();
            for (String name : groupNames) {
                SyncState.PipelineState pipelineState = state.pipeline(name);
                pipelineState.pulledRevision = Math.max(pipelineState.pulledRevision, batch.highWaterMark());
                pipelineState.lastPullAtEpochMs = now;
                pipelineState.lastError = null;
                pipelineState.status = computeStatus(name, pipelineState);
            }
            stateStore.save(state);
            log.info("sync.pull.applied pipelines={} since={} entries={} created={} conflicts={} centralRevision={}",
                    groupNames, group.getKey(), batch.size(), result.stats().created(), result.conflicts().size(),
                    batch.highWaterMark());
            received += batch.size();
            results.add(result);
        }
        return new PullOutcome(names, received, results);
    }

    /**
     * Pushes one execution with its parents, inputs and outputs. Pipeline high-water marks stay where
     * they are, since other changes of the pipeline were not sent.
     */
    public synchronized PushOutcome pushExecution(String pipeline, String executionUuid) throws IOException, InterruptedException {
        SyncBatch batch = store.read(view -> BatchBuilder.forPush(view, Map.of(pipeline, 0L), executionUuid));
        List<String> names = List.of(pipeline);
        PushReceipt receipt;
        try {
            receipt = retrier.run("push", () -> transport.push(batch));
        } catch (LineageException e) {
            fail(names, e);
            throw e;
        }
        receipt.idMapping().entries().forEach(entry -> state.idMapping.put(entry.source().toString(), entry.target().toString()));
        SyncState.PipelineState pipelineState = state.pipeline(pipeline);
        pipelineState.lastPushAtEpochMs = clock.millis();
        pipelineState.lastError = null;
        pipelineState.status = computeStatus(pipeline, pipelineState);
        stateStore.save(state);
        log.info("sync.push.accepted source={} pipelines={} execution={} entries={} centralRevision={} conflicts={}",
                store.storeId(), names, executionUuid, batch.size(), receipt.centralRevision(), receipt.conflicts().size());
        return new PushOutcome(names, batch.size(), receipt);
    }

    public synchronized PullOutcome pullExecution(String pipeline, String executionUuid) throws IOException, InterruptedException {
        List<String> names = List.of(pipeline);
        SyncBatch batch;
        MergeResult result;
        try {
            batch = retrier.run("pull", () -> transport.pull(new PullRequest(0L, names, executionUuid)));
            result = store.transact(tx -> BatchMerger.apply(tx, batch));
        } catch (LineageException e) {
            fail(names, e);
            throw e;
        }
        SyncState.PipelineState pipelineState = state.pipeline(pipeline);
        pipelineState.lastPullAtEpochMs = clock.millis();
        pipelineState.lastError = null;
        pipelineState.status = computeStatus(pipeline, pipelineState);
        stateStore.save(state);
        log.info("sync.pull.applied pipelines={} execution={} entries={} created={} conflicts={}",
                names, executionUuid, batch.size(), result.stats().created(), result.conflicts().size());
        return new PullOutcome(names, batch.size(), List.of(result));
    }

    public synchronized PipelineSyncStatus status(String pipeline) {
        SyncState.PipelineState pipelineState = state.pipelines.get(pipeline);
        if (pipelineState == null) {
            return store.read(view -> view.pipelineByName(pipeline).isPresent())
                    ? PipelineSyncStatus.DIRTY
                    : PipelineSyncStatus.CLEAN;
        }
        if (pipelineState.status == PipelineSyncStatus.PUSHING || pipelineState.status == PipelineSyncStatus.PULLING) {
            return pipelineState.status;
        }
        return computeStatus(pipeline, pipelineState);
    }

    public synchronized Map<String, PipelineSyncStatus> statuses() {
        Map<String, PipelineSyncStatus> statuses = new TreeMap<>();
        TreeSet<String> names = new TreeSet<>(state.pipelines.keySet());
        names.addAll(localPipelines());
        names.forEach(name -> statuses.put(name, status(name)));
        return statuses;
    }

    public synchronized Optional<NodeId> centralIdOf(NodeId localId) {
        return Optional.ofNullable(state.idMapping.get(localId.toString())).map(NodeId::parse);
    }

    public synchronized long pushedRevision(String pipeline) {
        SyncState.PipelineState pipelineState = state.pipelines.get(pipeline);
        return pipelineState == null ? 0L : pipelineState.pushedRevision;
    }

    public synchronized long pulledRevision(String pipeline) {
        SyncState.PipelineState pipelineState = state.pipelines.get(pipeline);
        return pipelineState == null ? 0L : pipelineState.pulledRevision;
    }

    private List<String> resolve(Collection<String> pipelines) {
        if (pipelines != null && !pipelines.isEmpty()) {
            return List.copyOf(new TreeSet<>(pipelines));
        }
        return localPipelines();
    }

    private List<String> localPipelines() {
        return store.read(view -> view.pipelines().stream().map(Pipeline::name).sorted().toList());
    }

    private PipelineSyncStatus computeStatus(String name, SyncState.PipelineState pipelineState) {
        boolean pending = store.read(view -> !BatchBuilder.forPush(view, Map.of(name, pipelineState.pushedRevision)).isEmpty());
        return pending ? PipelineSyncStatus.DIRTY : PipelineSyncStatus.CLEAN;
    }

    private void mark(List<String> names, PipelineSyncStatus status) throws IOException {
        names.forEach(name -> state.pipeline(name).status = status);
        stateStore.save(state);
    }

    private void fail(List<String> names, LineageException e) throws IOException {
        log.warn("sync.failed pipelines={} reason={}", names, e.getMessage());
        for (String name : names) {
            SyncState.PipelineState pipelineState = state.pipeline(name);
            pipelineState.lastError = e.getMessage();
            pipelineState.status = computeStatus(name, pipelineState);
        }
        stateStore.save(state);
    }

    public record PushOutcome(List<String> pipelines, int entriesSent, PushReceipt receipt) {
        public boolean sent() {
            return receipt != null;
        }
    }

    public record PullOutcome(List<String> pipelines, int entriesReceived, List<MergeResult> results) {
    }
}
