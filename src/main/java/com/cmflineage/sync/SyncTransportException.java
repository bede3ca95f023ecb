package com.cmflineage.sync;

import com.cmflineage.store.LineageException;

public class SyncTransportException extends LineageException {
    private final boolean retriable;

    public SyncTransportException(String message, boolean retriable) {
        super(message);
        this.retriable = retriable;
    }

    public SyncTransportException(String message, Throwable cause) {
        super(message, cause);
        this.retriable = true;
    }

    public boolean isRetriable() {
        return retriable;
    }
}
