package com.cmflineage.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A scalar property value with the time it was written. Values are strings, booleans or numbers;
 * every number is held as a {@link Double} so that equality survives serialization.
 */
public record PropertyValue(Object value, Instant writtenAt) {
    public PropertyValue {
        value = normalize(value);
        Objects.requireNonNull(writtenAt, "writtenAt");
    }

    public static PropertyValue of(Object value, Instant writtenAt) {
        return new PropertyValue(value, writtenAt);
    }

    public boolean sameValue(PropertyValue other) {
        return other != null && value.equals(other.value);
    }

    private static Object normalize(Object value) {
        if (value instanceof String || value instanceof Boolean || value instanceof Double) {
            return value;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        throw new IllegalArgumentException("Unsupported property value type: "
                + (value == null ? "null" : value.getClass().getName()));
    }
}
