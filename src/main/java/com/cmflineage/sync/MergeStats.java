package com.cmflineage.sync;

public record MergeStats(
        int pipelinesCreated,
        int contextsCreated,
        int executionsCreated,
        int executionsSkipped,
        int artifactsCreated,
        int artifactsDeduplicated,
        int eventsCreated,
        int eventsCollapsed) {

    public static MergeStats empty() {
        return new MergeStats(0, 0, 0, 0, 0, 0, 0, 0);
    }

    public int created() {
        return pipelinesCreated + contextsCreated + executionsCreated + artifactsCreated + eventsCreated;
    }
}
