package com.stepflow.artifacts;

import com.stepflow.stepconfig.Source;

import java.util.Objects;
import java.util.UUID;

/**
 * Stored artifact as known to the metadata store.
 */
public record ArtifactRecord(
        UUID id,
        String name,
        String artifactType,
        String uri,
        Source materializer,
        Source dataType,
        UUID artifactStoreId) {

    public ArtifactRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(dataType, "dataType");
    }

    static ArtifactRecord of(UUID id, ArtifactRecordRequest request) {
        return new ArtifactRecord(id, request.name(), request.artifactType(), request.uri(),
                request.materializer(), request.dataType(), request.artifactStoreId());
    }
}
