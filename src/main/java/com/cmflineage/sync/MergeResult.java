package com.cmflineage.sync;

import java.util.List;

import com.cmflineage.model.PropertyConflict;

public record MergeResult(
        IdMapping idMapping,
        MergeStats stats,
        List<PropertyConflict> conflicts,
        List<CycleWarning> cycles,
        long revision) {
    public MergeResult {
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
        cycles = cycles == null ? List.of() : List.copyOf(cycles);
    }
}
