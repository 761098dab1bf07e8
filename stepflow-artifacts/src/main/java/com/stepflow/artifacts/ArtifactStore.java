package com.stepflow.artifacts;

import java.util.UUID;

/**
 * Byte-level artifact persistence as seen by external artifact upload.
 */
public interface ArtifactStore {

    /** Id of the artifact store; stored artifacts are scoped to it. */
    UUID getId();

    /** Root path of the store. */
    String getPath();

    /** Location for artifact {@code name} under {@code scope} (e.g. {@code <root>/external_artifacts/<name>}). */
    String allocateLocation(String scope, String name);

    boolean exists(String uri);

    void makeDirectory(String uri);
}
