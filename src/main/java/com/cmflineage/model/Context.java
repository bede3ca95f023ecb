package com.cmflineage.model;

import java.time.Instant;
import java.util.Map;

import com.cmflineage.identity.NodeId;

public record Context(
        NodeId id,
        NodeId pipelineId,
        String stageName,
        String type,
        Map<String, PropertyValue> properties,
        Instant createdAt,
        NodeId origin,
        long revision) {
    public Context {
        properties = properties == null ? Map.of() : Map.copyOf(properties);
    }

    public Context withProperties(Map<String, PropertyValue> updated, long newRevision) {
        return new Context(id, pipelineId, stageName, type, updated, createdAt, origin, newRevision);
    }
}
