package com.cmflineage.sync;

import com.cmflineage.identity.NodeId;
import com.cmflineage.model.EventDirection;

/**
 * A merged event that made an artifact its own ancestor. The event is kept; queries walk with visited sets.
 */
public record CycleWarning(NodeId executionOrigin, String artifactHash, EventDirection direction) {
}
