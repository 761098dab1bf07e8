package com.stepflow.artifacts;

import com.stepflow.stepinterface.StepflowException;

import java.util.UUID;

/**
 * Thrown when an external artifact referenced by id lives in a different artifact store than the
 * active one.
 */
public class ArtifactStoreMismatchException extends StepflowException {

    private final UUID artifactId;
    private final UUID expectedArtifactStoreId;
    private final UUID actualArtifactStoreId;

    public ArtifactStoreMismatchException(UUID artifactId, UUID expectedArtifactStoreId, UUID actualArtifactStoreId) {
        super("Artifact store mismatch: artifact " + artifactId + " belongs to artifact store "
                + actualArtifactStoreId + " but the active artifact store is " + expectedArtifactStoreId);
        this.artifactId = artifactId;
        this.expectedArtifactStoreId = expectedArtifactStoreId;
        this.actualArtifactStoreId = actualArtifactStoreId;
    }

    public UUID getArtifactId() {
        return artifactId;
    }

    public UUID getExpectedArtifactStoreId() {
        return expectedArtifactStoreId;
    }

    public UUID getActualArtifactStoreId() {
        return actualArtifactStoreId;
    }
}
