package com.stepflow.artifacts;

import java.util.UUID;

/**
 * Registry of artifact metadata (the service store).
 */
public interface ArtifactMetadataStore {

    /** Registers an artifact and returns its new id. */
    UUID createArtifactRecord(ArtifactRecordRequest request);

    /**
     * @throws IllegalArgumentException if no artifact with this id exists
     */
    ArtifactRecord getArtifactRecord(UUID id);
}
