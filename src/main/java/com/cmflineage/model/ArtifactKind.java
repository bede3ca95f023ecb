package com.cmflineage.model;

public enum ArtifactKind {
    DATASET,
    MODEL,
    METRIC,
    STATISTICS
}
