package com.cmflineage.sync;

import java.time.Instant;
import java.util.Map;

import com.cmflineage.identity.NodeId;
import com.cmflineage.model.ArtifactKind;
import com.cmflineage.model.EventDirection;
import com.cmflineage.model.PropertyValue;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One entity in a sync batch. Parents are referenced by natural keys (pipeline name, stage name,
 * execution origin, artifact hash) so that a receiver can resolve them without knowing sender ids;
 * {@code sourceId} is the sender's id and only feeds the returned id mapping.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "entity")
@JsonSubTypes({
        @JsonSubTypes.Type(value = BatchEntry.PipelineEntry.class, name = "pipeline"),
        @JsonSubTypes.Type(value = BatchEntry.ContextEntry.class, name = "context"),
        @JsonSubTypes.Type(value = BatchEntry.ExecutionEntry.class, name = "execution"),
        @JsonSubTypes.Type(value = BatchEntry.ArtifactEntry.class, name = "artifact"),
        @JsonSubTypes.Type(value = BatchEntry.EventEntry.class, name = "event")
})
public interface BatchEntry {
    NodeId sourceId();

    static int dependencyRank(BatchEntry entry) {
        if (entry instanceof PipelineEntry) {
            return 0;
        }
        if (entry instanceof ContextEntry) {
            return 1;
        }
        if (entry instanceof ExecutionEntry) {
            return 2;
        }
        if (entry instanceof ArtifactEntry) {
            return 3;
        }
        return 4;
    }

    record PipelineEntry(NodeId sourceId, String name, Instant createdAt, NodeId origin) implements BatchEntry {
    }

    record ContextEntry(
            NodeId sourceId,
            String pipelineName,
            String stageName,
            String type,
            Map<String, PropertyValue> properties,
            Instant createdAt,
            NodeId origin) implements BatchEntry {
        public ContextEntry {
            properties = properties == null ? Map.of() : Map.copyOf(properties);
        }
    }

    record ExecutionEntry(
            NodeId sourceId,
            String pipelineName,
            String stageName,
            String toolName,
            String uuid,
            Instant startedAt,
            Map<String, PropertyValue> properties,
            NodeId origin) implements BatchEntry {
        public ExecutionEntry {
            properties = properties == null ? Map.of() : Map.copyOf(properties);
        }
    }

    record ArtifactEntry(
            NodeId sourceId,
            String hash,
            String logicalPath,
            ArtifactKind kind,
            Map<String, PropertyValue> properties,
            Instant createdAt) implements BatchEntry {
        public ArtifactEntry {
            properties = properties == null ? Map.of() : Map.copyOf(properties);
        }
    }

    record EventEntry(
            NodeId sourceId,
            NodeId executionOrigin,
            String artifactHash,
            EventDirection direction,
            Instant timestamp) implements BatchEntry {
    }
}
