package com.cmflineage.model;

import java.time.Instant;

import com.cmflineage.identity.NodeId;

public record Pipeline(NodeId id, String name, Instant createdAt, NodeId origin, long revision) {
}
