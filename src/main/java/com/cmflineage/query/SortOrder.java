package com.cmflineage.query;

import java.util.Locale;

public enum SortOrder {
    ASC,
    DESC;

    public static SortOrder parse(String value) {
        if (value == null || value.isBlank()) {
            return ASC;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "asc", "ascending" -> ASC;
            case "desc", "descending" -> DESC;
            default -> throw new IllegalArgumentException("Unknown sort order: " + value);
        };
    }
}
