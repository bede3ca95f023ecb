package com.cmflineage.model;

import java.time.Instant;

import com.cmflineage.identity.NodeId;

public record Event(NodeId id, NodeId executionId, NodeId artifactId, EventDirection direction, Instant timestamp, long revision) {
}
