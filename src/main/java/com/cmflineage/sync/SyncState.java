package com.cmflineage.sync;

import java.util.Map;
import java.util.TreeMap;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class SyncState {
    public String storeId;
    public Map<String, PipelineState> pipelines = new TreeMap<>();
    public Map<String, String> idMapping = new TreeMap<>();

    public PipelineState pipeline(String name) {
        return pipelines.computeIfAbsent(name, ignored -> new PipelineState());
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PipelineState {
        public PipelineSyncStatus status = PipelineSyncStatus.DIRTY;
        public long pushedRevision;
        public long pulledRevision;
        public long lastPushAtEpochMs;
        public long lastPullAtEpochMs;
        public String lastError;
    }
}
