package com.cmflineage.model;

import java.time.Instant;
import java.util.Map;

import com.cmflineage.identity.NodeId;

public record Artifact(
        NodeId id,
        String hash,
        String logicalPath,
        ArtifactKind kind,
        Map<String, PropertyValue> properties,
        Instant createdAt,
        long revision) {
    public Artifact {
        properties = properties == null ? Map.of() : Map.copyOf(properties);
    }

    public Artifact withProperties(Map<String, PropertyValue> updated, long newRevision) {
        return new Artifact(id, hash, logicalPath, kind, updated, createdAt, newRevision);
    }
}
