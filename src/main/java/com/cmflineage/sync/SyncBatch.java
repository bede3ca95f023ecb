package com.cmflineage.sync;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record SyncBatch(String sourceStoreId, long highWaterMark, List<BatchEntry> entries) {
    public SyncBatch {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }
}
