package com.cmflineage.sync;

import java.util.List;

public class InProcessSyncTransport implements SyncTransport {
    private final CentralSyncService central;
    private final int chunkSize;

    public InProcessSyncTransport(CentralSyncService central, int chunkSize) {
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be >= 1");
        }
        this.central = central;
        this.chunkSize = chunkSize;
    }

    @Override
    public PushReceipt push(SyncBatch batch) {
        if (batch.size() <= chunkSize) {
            return central.push(batch);
        }
        String sessionId = central.openPush(batch.sourceStoreId());
        List<BatchEntry> entries = batch.entries();
        try {
            for (int from = 0; from < entries.size(); from += chunkSize) {
                sendChunk(sessionId, entries.subList(from, Math.min(entries.size(), from + chunkSize)));
            }
        } catch (RuntimeException e) {
            central.abortPush(sessionId);
            throw e;
        }
        return central.commitPush(sessionId, batch.highWaterMark());
    }

    @Override
    public SyncBatch pull(PullRequest request) {
        return central.pull(request);
    }

    protected void sendChunk(String sessionId, List<BatchEntry> chunk) {
        central.appendEntries(sessionId, chunk);
    }
}
