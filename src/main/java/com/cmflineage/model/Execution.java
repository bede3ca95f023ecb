package com.cmflineage.model;

import java.time.Instant;
import java.util.Map;

import com.cmflineage.identity.NodeId;

/**
 * One run of a context. {@code origin} is the id the execution received in the store that created it
 * and is the only key used to recognise the same run in another store.
 */
public record Execution(
        NodeId id,
        NodeId contextId,
        String toolName,
        String uuid,
        Instant startedAt,
        Map<String, PropertyValue> properties,
        NodeId origin,
        long revision) {
    public Execution {
        properties = properties == null ? Map.of() : Map.copyOf(properties);
    }

    public Execution withProperties(Map<String, PropertyValue> updated, long newRevision) {
        return new Execution(id, contextId, toolName, uuid, startedAt, updated, origin, newRevision);
    }

    public boolean originatedIn(String storeId) {
        return origin.storeId().equals(storeId);
    }
}
