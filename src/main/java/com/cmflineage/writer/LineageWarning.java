package com.cmflineage.writer;

public record LineageWarning(Kind kind, String message) {
    public enum Kind {
        HASH_MISMATCH
    }
}
