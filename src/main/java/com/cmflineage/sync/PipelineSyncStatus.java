package com.cmflineage.sync;

public enum PipelineSyncStatus {
    CLEAN,
    DIRTY,
    PUSHING,
    PULLING
}
