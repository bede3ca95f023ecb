package com.cmflineage.sync;

import java.util.List;

public record PullRequest(long sinceRevision, List<String> pipelines, String executionUuid) {
    public PullRequest {
        if (sinceRevision < 0) {
            throw new IllegalArgumentException("sinceRevision must be >= 0");
        }
        pipelines = pipelines == null ? List.of() : List.copyOf(pipelines);
        executionUuid = executionUuid == null || executionUuid.isBlank() ? null : executionUuid;
    }
}
