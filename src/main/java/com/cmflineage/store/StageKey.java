package com.cmflineage.store;

import com.cmflineage.identity.NodeId;

record StageKey(NodeId pipelineId, String stageName) {
}
