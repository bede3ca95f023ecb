package com.cmflineage.sync;

import com.cmflineage.store.LineageException;

public class UnknownPushSessionException extends LineageException {
    public UnknownPushSessionException(String sessionId) {
        super("Unknown or expired push session " + sessionId);
    }
}
