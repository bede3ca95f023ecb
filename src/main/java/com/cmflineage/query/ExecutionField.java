package com.cmflineage.query;

import java.util.Comparator;
import java.util.Locale;
import java.util.function.Function;

public enum ExecutionField {
    CONTEXT_TYPE("context_type", ExecutionRow::contextType),
    CONTEXT_NAME("context_name", ExecutionRow::contextName),
    TOOL_NAME("tool_name", ExecutionRow::toolName),
    EXECUTION_UUID("execution_uuid", ExecutionRow::executionUuid),
    STARTED_AT("started_at", row -> row.startedAt().toString()),
    EXECUTION_ID("execution_id", row -> row.id().toString());

    private final String wireName;
    private final Function<ExecutionRow, String> textValue;

    ExecutionField(String wireName, Function<ExecutionRow, String> textValue) {
        this.wireName = wireName;
        this.textValue = textValue;
    }

    public String wireName() {
        return wireName;
    }

    public String textValue(ExecutionRow row) {
        return textValue.apply(row);
    }

    Comparator<ExecutionRow> comparator() {
        return switch (this) {
            case STARTED_AT -> Comparator.comparing(ExecutionRow::startedAt);
            case EXECUTION_ID -> Comparator.comparingLong(row -> row.id().sequence());
            default -> Comparator.comparing(textValue, Comparator.nullsFirst(Comparator.<String>naturalOrder()));
        };
    }

    public static ExecutionField parse(String value) {
        if (value == null || value.isBlank()) {
            return EXECUTION_ID;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ExecutionField field : values()) {
            if (field.wireName.equals(normalized) || field.name().equalsIgnoreCase(normalized)) {
                return field;
            }
        }
        throw new IllegalArgumentException("Unknown execution field: " + value);
    }
}
