package com.cmflineage.sync;

public interface SyncTransport {
    PushReceipt push(SyncBatch batch);

    SyncBatch pull(PullRequest request);
}
