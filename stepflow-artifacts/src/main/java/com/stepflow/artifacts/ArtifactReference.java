package com.stepflow.artifacts;

import com.stepflow.stepinterface.DeclaredType;

/**
 * Typed handle to a value passed into a step: either an output of another invocation in the same
 * graph ({@link StepArtifact}) or a value or stored artifact supplied from outside ({@link ExternalArtifact}).
 */
public sealed interface ArtifactReference permits StepArtifact, ExternalArtifact {

    /**
     * Data type of the referenced artifact, used to check it against the input it is passed to.
     *
     * @param metadataStore used to look up the type of stored artifacts referenced by id
     */
    DeclaredType type(ArtifactMetadataStore metadataStore);
}
