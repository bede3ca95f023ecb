package com.cmflineage.sync;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cmflineage.store.CancellationToken;
import com.cmflineage.store.GraphStore;

/**
 * Receiving side of synchronization. A push is merged in a single transaction, so the central store
 * shows either all of a batch or none of it. Large batches can be uploaded in pieces through a push
 * session; staged entries stay outside the store until the session is committed.
 */
public class CentralSyncService {
    private static final Logger log = LoggerFactory.getLogger(CentralSyncService.class);

    private final GraphStore store;
    private final Clock clock;
    private final Duration sessionTtl;
    private final Duration mergeTimeout;
    private final Map<String, PushSession> sessions = new ConcurrentHashMap<>();

    public CentralSyncService(GraphStore store, Duration sessionTtl, Duration mergeTimeout) {
        this(store, sessionTtl, mergeTimeout, store.clock());
    }

    CentralSyncService(GraphStore store, Duration sessionTtl, Duration mergeTimeout, Clock clock) {
        this.store = store;
        this.sessionTtl = sessionTtl;
        this.mergeTimeout = mergeTimeout;
        this.clock = clock;
    }

    public GraphStore store() {
        return store;
    }

    public PushReceipt push(SyncBatch batch) {
        CancellationToken token = mergeTimeout == null || mergeTimeout.isZero()
                ? CancellationToken.NONE
                : CancellationToken.withTimeout(mergeTimeout, clock);
        return push(batch, token);
    }

    public PushReceipt push(SyncBatch batch, CancellationToken token) {
        long started = System.nanoTime();
        MergeResult result = store.transact(token, tx -> BatchMerger.apply(tx, batch));
        MergeStats stats = result.stats();
        log.info("sync.push.merged source={} entries={} created={} executionsSkipped={} artifactsDeduplicated={} conflicts={} revision={} elapsedMs={}",
                batch.sourceStoreId(), batch.size(), stats.created(), stats.executionsSkipped(),
                stats.artifactsDeduplicated(), result.conflicts().size(), result.revision(),
                (System.nanoTime() - started) / 1_000_000L);
        return PushReceipt.of(result);
    }

    public SyncBatch pull(PullRequest request) {
        SyncBatch batch = store.read(view -> BatchBuilder.forPull(view, request.pipelines(), request.sinceRevision(),
                request.executionUuid()));
        log.info("sync.pull.served pipelines={} execution={} since={} entries={} highWaterMark={}",
                request.pipelines(), request.executionUuid(), request.sinceRevision(), batch.size(), batch.highWaterMark());
        return batch;
    }

    public String openPush(String sourceStoreId) {
        expireSessions();
        String sessionId = UUID.randomUUID().toString();
        sessions.put(sessionId, new PushSession(sourceStoreId, clock.instant()));
        log.debug("sync.session.open id={} source={}", sessionId, sourceStoreId);
        return sessionId;
    }

    public int appendEntries(String sessionId, List<BatchEntry> entries) {
        PushSession session = activeSession(sessionId);
        synchronized (session) {
            session.entries.addAll(entries);
            session.touchedAt = clock.instant();
            return session.entries.size();
        }
    }

    public PushReceipt commitPush(String sessionId, long highWaterMark) {
        PushSession session = activeSession(sessionId);
        sessions.remove(sessionId);
        List<BatchEntry> staged;
        synchronized (session) {
            staged = List.copyOf(session.entries);
        }
        return push(new SyncBatch(session.sourceStoreId, highWaterMark, staged));
    }

    public void abortPush(String sessionId) {
        PushSession removed = sessions.remove(sessionId);
        if (removed != null) {
            log.info("sync.session.aborted id={} source={} staged={}", sessionId, removed.sourceStoreId, removed.entries.size());
        }
    }

    public int openSessions() {
        expireSessions();
        return sessions.size();
    }

    private PushSession activeSession(String sessionId) {
        expireSessions();
        PushSession session = sessions.get(sessionId);
        if (session == null) {
            throw new UnknownPushSessionException(sessionId);
        }
        return session;
    }

    private void expireSessions() {
        Instant cutoff = clock.instant().minus(sessionTtl);
        sessions.entrySet().removeIf(entry -> {
            boolean expired = entry.getValue().touchedAt.isBefore(cutoff);
            if (expired) {
                log.warn("sync.session.expired id={} source={} staged={}", entry.getKey(),
                        entry.getValue().sourceStoreId, entry.getValue().entries.size());
            }
            return expired;
        });
    }

    private static final class PushSession {
        private final String sourceStoreId;
        private final List<BatchEntry> entries = new ArrayList<>();
        private Instant touchedAt;

        PushSession(String sourceStoreId, Instant openedAt) {
            this.sourceStoreId = sourceStoreId;
            this.touchedAt = openedAt;
        }
    }
}
