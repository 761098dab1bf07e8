package com.stepflow.stepconfig;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Output configuration before finalization. A null materializer source means "not configured"
 * (resolved from the declared type at finalization).
 */
public final class PartialArtifactConfiguration {

    private final List<Source> materializerSource;

    @JsonCreator
    public PartialArtifactConfiguration(@JsonProperty("materializerSource") List<Source> materializerSource) {
        this.materializerSource = materializerSource != null ? List.copyOf(materializerSource) : null;
    }

    public static PartialArtifactConfiguration of(List<Source> materializerSource) {
        return new PartialArtifactConfiguration(materializerSource);
    }

    public List<Source> getMaterializerSource() {
        return materializerSource;
    }

    /**
     * Field-wise merge: fields set on {@code update} win.
     */
    public PartialArtifactConfiguration mergedWith(PartialArtifactConfiguration update) {
        if (update == null) return this;
        return new PartialArtifactConfiguration(
                update.materializerSource != null ? update.materializerSource : materializerSource);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PartialArtifactConfiguration)) return false;
        return Objects.equals(materializerSource, ((PartialArtifactConfiguration) o).materializerSource);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(materializerSource);
    }

    @Override
    public String toString() {
        return "PartialArtifactConfiguration{materializerSource=" + materializerSource + "}";
    }
}
