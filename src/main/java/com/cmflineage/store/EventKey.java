package com.cmflineage.store;

import com.cmflineage.identity.NodeId;
import com.cmflineage.model.EventDirection;

record EventKey(NodeId executionId, NodeId artifactId, EventDirection direction) {
}
