package com.cmflineage.query;

import java.time.Instant;
import java.util.Map;

import com.cmflineage.identity.NodeId;

public record ExecutionRow(
        NodeId id,
        String executionUuid,
        String pipelineName,
        String contextName,
        String contextType,
        String toolName,
        Instant startedAt,
        Map<String, Object> properties,
        NodeId origin) {
}
