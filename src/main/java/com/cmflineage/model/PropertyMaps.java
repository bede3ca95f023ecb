package com.cmflineage.model;

import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Consumer;

public final class PropertyMaps {
    private static final Comparator<PropertyValue> LATEST_WINS = Comparator
            .comparing(PropertyValue::writtenAt)
            .thenComparing(value -> String.valueOf(value.value()));

    private PropertyMaps() {
    }

    public static Map<String, PropertyValue> stamp(Map<String, ?> raw, Instant writtenAt) {
        if (raw == null || raw.isEmpty()) {
            return Map.of();
        }
        Map<String, PropertyValue> stamped = new TreeMap<>();
        raw.forEach((key, value) -> {
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("property keys must be non-blank");
            }
            stamped.put(key, PropertyValue.of(value, writtenAt));
        });
        return Collections.unmodifiableMap(stamped);
    }

    public static Map<String, PropertyValue> addMissing(Map<String, PropertyValue> existing, Map<String, PropertyValue> incoming) {
        if (incoming.isEmpty() || existing.keySet().containsAll(incoming.keySet())) {
            return existing;
        }
        Map<String, PropertyValue> merged = new TreeMap<>(existing);
        incoming.forEach(merged::putIfAbsent);
        return Collections.unmodifiableMap(merged);
    }

    public static Map<String, PropertyValue> overwrite(Map<String, PropertyValue> existing, Map<String, PropertyValue> incoming) {
        if (incoming.isEmpty()) {
            return existing;
        }
        Map<String, PropertyValue> merged = new TreeMap<>(existing);
        boolean changed = false;
        for (Map.Entry<String, PropertyValue> entry : incoming.entrySet()) {
            PropertyValue current = merged.get(entry.getKey());
            PropertyValue candidate = entry.getValue();
            if (current != null && (current.equals(candidate) || candidate.writtenAt().isBefore(current.writtenAt()))) {
                continue;
            }
            merged.put(entry.getKey(), candidate);
            changed = true;
        }
        return changed ? Collections.unmodifiableMap(merged) : existing;
    }

    /**
     * Unions two maps. A key present on both sides with different values keeps the latest write; ties
     * on the timestamp fall back to the lexically greater value so every store picks the same winner.
     */
    public static Map<String, PropertyValue> reconcile(
            Map<String, PropertyValue> existing,
            Map<String, PropertyValue> incoming,
            String entityKey,
            Consumer<PropertyConflict> conflicts) {
        if (incoming.isEmpty()) {
            return existing;
        }
        Map<String, PropertyValue> merged = new TreeMap<>(existing);
        boolean changed = false;
        for (Map.Entry<String, PropertyValue> entry : incoming.entrySet()) {
            PropertyValue current = merged.get(entry.getKey());
            PropertyValue candidate = entry.getValue();
            if (current == null) {
                merged.put(entry.getKey(), candidate);
                changed = true;
                continue;
            }
            if (current.equals(candidate)) {
                continue;
            }
            PropertyValue winner = LATEST_WINS.compare(candidate, current) >= 0 ? candidate : current;
            if (!current.sameValue(candidate)) {
                conflicts.accept(new PropertyConflict(entityKey, entry.getKey(), winner,
                        winner == candidate ? current : candidate));
            }
            if (winner == candidate) {
                merged.put(entry.getKey(), candidate);
                changed = true;
            }
        }
        return changed ? Collections.unmodifiableMap(merged) : existing;
    }

    public static Map<String, Object> values(Map<String, PropertyValue> properties) {
        Map<String, Object> plain = new LinkedHashMap<>();
        properties.forEach((key, value) -> plain.put(key, value.value()));
        return plain;
    }
}
