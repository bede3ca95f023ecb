package com.cmflineage.sync;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.cmflineage.identity.NodeId;

public record IdMapping(List<Entry> entries) {
    public IdMapping {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public static IdMapping of(Map<NodeId, NodeId> mapping) {
        return new IdMapping(mapping.entrySet().stream()
                .map(entry -> new Entry(entry.getKey(), entry.getValue()))
                .toList());
    }

    public Map<NodeId, NodeId> asMap() {
        Map<NodeId, NodeId> map = new LinkedHashMap<>();
        entries.forEach(entry -> map.put(entry.source(), entry.target()));
        return map;
    }

    public Optional<NodeId> targetOf(NodeId source) {
        return entries.stream().filter(entry -> entry.source().equals(source)).map(Entry::target).findFirst();
    }

    public int size() {
        return entries.size();
    }

    public record Entry(NodeId source, NodeId target) {
    }
}
