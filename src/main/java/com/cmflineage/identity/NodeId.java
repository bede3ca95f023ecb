package com.cmflineage.identity;

import java.util.Comparator;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Identifier of a graph node: the store that allocated it plus that store's local sequence number.
 * Ids allocated independently by different stores never collide.
 */
public record NodeId(String storeId, long sequence) implements Comparable<NodeId> {
    private static final Comparator<NodeId> ORDER = Comparator.comparing(NodeId::storeId)
            .thenComparingLong(NodeId::sequence);

    public NodeId {
        validateStoreId(storeId);
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence must be >= 0");
        }
    }

    public static NodeId of(String storeId, long sequence) {
        return new NodeId(storeId, sequence);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static NodeId parse(String value) {
        Objects.requireNonNull(value, "value");
        int separator = value.lastIndexOf(':');
        if (separator <= 0 || separator == value.length() - 1) {
            throw new IllegalArgumentException("Malformed node id: " + value);
        }
        try {
            return new NodeId(value.substring(0, separator), Long.parseLong(value.substring(separator + 1)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed node id: " + value, e);
        }
    }

    public static void validateStoreId(String storeId) {
        if (storeId == null || storeId.isBlank()) {
            throw new IllegalArgumentException("storeId is required");
        }
        if (storeId.indexOf(':') >= 0) {
            throw new IllegalArgumentException("storeId must not contain ':' but was " + storeId);
        }
    }

    @JsonValue
    @Override
    public String toString() {
        return storeId + ":" + sequence;
    }

    @Override
    public int compareTo(NodeId other) {
        return ORDER.compare(this, other);
    }
}
