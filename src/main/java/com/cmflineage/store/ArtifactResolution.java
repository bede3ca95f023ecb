package com.cmflineage.store;

import com.cmflineage.model.Artifact;

public record ArtifactResolution(Artifact artifact, boolean created, String previousPathHash) {
    public boolean pathContentChanged() {
        return previousPathHash != null && !previousPathHash.equals(artifact.hash());
    }
}
