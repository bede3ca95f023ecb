package com.cmflineage.model;

public record PropertyConflict(String entityKey, String key, PropertyValue kept, PropertyValue discarded) {
}
