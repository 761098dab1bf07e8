package com.stepflow.artifacts;

import com.stepflow.stepinterface.DeclaredType;

import java.util.Objects;

/**
 * Output {@code outputName} of invocation {@code invocationId}, declared as {@code declaredType}.
 * Returned when a step is called inside a pipeline build; passing it to another step makes that
 * invocation a downstream of {@code invocationId}.
 */
public record StepArtifact(String invocationId, String outputName, DeclaredType declaredType) implements ArtifactReference {

    public StepArtifact {
        Objects.requireNonNull(invocationId, "invocationId");
        Objects.requireNonNull(outputName, "outputName");
        Objects.requireNonNull(declaredType, "declaredType");
    }

    @Override
    public DeclaredType type(ArtifactMetadataStore metadataStore) {
        return declaredType;
    }
}
