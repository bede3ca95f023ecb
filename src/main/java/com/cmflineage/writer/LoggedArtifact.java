package com.cmflineage.writer;

import java.util.List;

import com.cmflineage.model.Artifact;
import com.cmflineage.model.Event;

public record LoggedArtifact(Artifact artifact, Event event, boolean created, List<LineageWarning> warnings) {
    public LoggedArtifact {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean deduplicated() {
        return !created;
    }
}
