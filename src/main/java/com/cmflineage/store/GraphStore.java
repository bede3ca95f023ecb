package com.cmflineage.store;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cmflineage.model.Artifact;
import com.cmflineage.model.ArtifactKind;
import com.cmflineage.model.Context;
import com.cmflineage.model.Event;
import com.cmflineage.model.EventDirection;
import com.cmflineage.model.Execution;
import com.cmflineage.model.Pipeline;

/**
 * Embedded transactional store of pipelines, contexts, executions, artifacts and events.
 *
 * <p>One transaction writes at a time. Its writes are staged privately and published under a short
 * exclusive lock, so readers see either none or all of a transaction. A store opened with a snapshot
 * file persists each transaction before publishing it.
 */
public class GraphStore {
    private static final Logger log = LoggerFactory.getLogger(GraphStore.class);

    private final GraphState committed;
    private final Clock clock;
    private final GraphSnapshotFile snapshotFile;
    private final ReentrantLock writerLock = new ReentrantLock();
    private final ReentrantReadWriteLock publishLock = new ReentrantReadWriteLock();

    GraphStore(GraphState committed, Clock clock, GraphSnapshotFile snapshotFile) {
        this.committed = committed;
        this.clock = clock;
        this.snapshotFile = snapshotFile;
    }

    public static GraphStore inMemory(String storeId) {
        return inMemory(storeId, Clock.systemUTC());
    }

    public static GraphStore inMemory(String storeId, Clock clock) {
        return new GraphStore(new GraphState(storeId, 0L), clock, null);
    }

    public static GraphStore open(String storeId, Path snapshotPath, Clock clock) throws IOException {
        GraphSnapshotFile file = new GraphSnapshotFile(snapshotPath);
        Optional<GraphSnapshot> snapshot = file.load();
        if (snapshot.isPresent() && !snapshot.get().storeId().equals(storeId)) {
            throw new IllegalStateException("Snapshot " + snapshotPath + " belongs to store " + snapshot.get().storeId()
                    + ", not " + storeId);
        }
        GraphState state = snapshot.map(GraphSnapshot::restore).orElseGet(() -> new GraphState(storeId, 0L));
        log.info("store.open storeId={} snapshot={} revision={}", storeId, snapshotPath, state.revision());
        return new GraphStore(state, clock, file);
    }

    public static GraphStore open(Path snapshotPath, Clock clock) throws IOException {
        GraphSnapshotFile file = new GraphSnapshotFile(snapshotPath);
        Optional<GraphSnapshot> snapshot = file.load();
        if (snapshot.isPresent()) {
            return open(snapshot.get().storeId(), snapshotPath, clock);
        }
        GraphState state = new GraphState(newStoreId(), 0L);
        file.save(GraphSnapshot.capture(state));
        log.info("store.created storeId={} snapshot={}", state.storeId(), snapshotPath);
        return new GraphStore(state, clock, file);
    }

    public static String newStoreId() {
        return "store-" + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }

    public String storeId() {
        return committed.storeId();
    }

    public Clock clock() {
        return clock;
    }

    public <T> T transact(TransactionWork<T> work) {
        return transact(CancellationToken.NONE, work);
    }

    /**
     * Runs {@code work} in a write transaction. The transaction is published only if {@code work}
     * returns normally and the token is still live; otherwise every staged write is dropped.
     */
    public <T> T transact(CancellationToken token, TransactionWork<T> work) {
        writerLock.lock();
        Transaction tx = new Transaction(committed, clock, token);
        try {
            T result = work.apply(tx);
            token.throwIfCancelled();
            publish(tx);
            return result;
        } finally {
            tx.close();
            writerLock.unlock();
        }
    }

    public <T> T read(Function<GraphView, T> query) {
        publishLock.readLock().lock();
        try {
            return query.apply(committed);
        } finally {
            publishLock.readLock().unlock();
        }
    }

    public GraphSnapshot snapshot() {
        return read(GraphSnapshot::capture);
    }

    public long revision() {
        return read(GraphView::revision);
    }

    public Pipeline createPipeline(String name) {
        return transact(tx -> tx.createPipeline(name));
    }

    public Context getOrCreateContext(Pipeline pipeline, String stageName, String type) {
        return transact(tx -> tx.getOrCreateContext(pipeline, stageName, type));
    }

    public Execution createExecution(Context context, String toolName, Map<String, ?> properties) {
        return transact(tx -> tx.createExecution(context, toolName, properties));
    }

    public ArtifactResolution getOrCreateArtifact(String hash, String logicalPath, ArtifactKind kind, Map<String, ?> properties) {
        return transact(tx -> tx.getOrCreateArtifact(hash, logicalPath, kind, properties));
    }

    public Artifact updateArtifactProperties(Artifact artifact, Map<String, ?> properties) {
        return transact(tx -> tx.updateArtifactProperties(artifact.id(), properties));
    }

    public Execution updateExecutionProperties(Execution execution, Map<String, ?> properties) {
        return transact(tx -> tx.updateExecutionProperties(execution.id(), properties));
    }

    public Event recordEvent(Execution execution, Artifact artifact, EventDirection direction) {
        return transact(tx -> tx.recordEvent(execution, artifact, direction));
    }

    private void publish(Transaction tx) {
        if (!tx.hasChanges()) {
            return;
        }
        if (snapshotFile != null) {
            try {
                snapshotFile.save(GraphSnapshot.capture(tx));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to persist store " + storeId() + " to " + snapshotFile.path(), e);
            }
        }
        publishLock.writeLock().lock();
        try {
            committed.absorb(tx.delta());
        } finally {
            publishLock.writeLock().unlock();
        }
        log.debug("store.commit storeId={} revision={}", storeId(), committed.revision());
    }
}
