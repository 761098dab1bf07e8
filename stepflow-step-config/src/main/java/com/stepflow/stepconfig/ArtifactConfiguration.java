package com.stepflow.stepconfig;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Finalized output configuration: the ordered, non-empty list of materializers for the output.
 */
public final class ArtifactConfiguration {

    private final List<Source> materializerSource;

    @JsonCreator
    public ArtifactConfiguration(@JsonProperty("materializerSource") List<Source> materializerSource) {
        if (materializerSource == null || materializerSource.isEmpty()) {
            throw new IllegalArgumentException("materializerSource must be non-empty");
        }
        this.materializerSource = List.copyOf(materializerSource);
    }

    public List<Source> getMaterializerSource() {
        return materializerSource;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ArtifactConfiguration)) return false;
        return materializerSource.equals(((ArtifactConfiguration) o).materializerSource);
    }

    @Override
    public int hashCode() {
        return Objects.hash(materializerSource);
    }

    @Override
    public String toString() {
        return "ArtifactConfiguration{materializerSource=" + materializerSource + "}";
    }
}
