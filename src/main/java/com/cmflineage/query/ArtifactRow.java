package com.cmflineage.query;

import java.time.Instant;
import java.util.Map;

import com.cmflineage.identity.NodeId;
import com.cmflineage.model.ArtifactKind;

public record ArtifactRow(
        NodeId id,
        String hash,
        String logicalPath,
        ArtifactKind kind,
        Instant createdAt,
        Map<String, Object> properties,
        int inputEvents,
        int outputEvents) {
}
