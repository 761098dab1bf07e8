package com.stepflow.artifacts;

import com.stepflow.stepconfig.Source;

import java.util.Objects;
import java.util.UUID;

/**
 * Metadata registered for a newly persisted artifact.
 */
public record ArtifactRecordRequest(
        String name,
        String artifactType,
        String uri,
        Source materializer,
        Source dataType,
        UUID userId,
        UUID workspaceId,
        UUID artifactStoreId) {

    public ArtifactRecordRequest {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(materializer, "materializer");
        Objects.requireNonNull(dataType, "dataType");
        Objects.requireNonNull(artifactStoreId, "artifactStoreId");
    }
}
