package com.cmflineage.sync;

import java.util.List;

import com.cmflineage.model.PropertyConflict;

public record PushReceipt(
        IdMapping idMapping,
        long centralRevision,
        MergeStats stats,
        List<PropertyConflict> conflicts,
        List<CycleWarning> cycles) {
    public PushReceipt {
        idMapping = idMapping == null ? new IdMapping(List.of()) : idMapping;
        stats = stats == null ? MergeStats.empty() : stats;
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
        cycles = cycles == null ? List.of() : List.copyOf(cycles);
    }

    static PushReceipt of(MergeResult result) {
        return new PushReceipt(result.idMapping(), result.revision(), result.stats(), result.conflicts(), result.cycles());
    }
}
