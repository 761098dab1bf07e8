package com.stepflow.stepconfig;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Step configuration while it is still being assembled: every field may be unset (null flags,
 * empty maps). Immutable; updates go through {@link ConfigurationMerger} or {@link #toBuilder()}.
 * {@code cachingParameters} and {@code externalInputArtifacts} are only set during finalization.
 */
public final class PartialStepConfiguration {

    private final String name;
    private final Boolean enableCache;
    private final Boolean enableArtifactMetadata;
    private final Boolean enableArtifactVisualization;
    private final String experimentTracker;
    private final String stepOperator;
    private final Map<String, Object> parameters;
    private final Map<String, Object> settings;
    private final Map<String, Object> extra;
    private final Source failureHookSource;
    private final Source successHookSource;
    private final Map<String, PartialArtifactConfiguration> outputs;
    private final Map<String, String> cachingParameters;
    private final Map<String, UUID> externalInputArtifacts;

    @JsonCreator
    public PartialStepConfiguration(
            @JsonProperty("name") String name,
            @JsonProperty("enableCache") Boolean enableCache,
            @JsonProperty("enableArtifactMetadata") Boolean enableArtifactMetadata,
            @JsonProperty("enableArtifactVisualization") Boolean enableArtifactVisualization,
            @JsonProperty("experimentTracker") String experimentTracker,
            @JsonProperty("stepOperator") String stepOperator,
            @JsonProperty("parameters") Map<String, Object> parameters,
            @JsonProperty("settings") Map<String, Object> settings,
            @JsonProperty("extra") Map<String, Object> extra,
            @JsonProperty("failureHookSource") Source failureHookSource,
            @JsonProperty("successHookSource") Source successHookSource,
            @JsonProperty("outputs") Map<String, PartialArtifactConfiguration> outputs,
            @JsonProperty("cachingParameters") Map<String, String> cachingParameters,
            @JsonProperty("externalInputArtifacts") Map<String, UUID> externalInputArtifacts) {
        this.name = Objects.requireNonNull(name, "name");
        this.enableCache = enableCache;
        this.enableArtifactMetadata = enableArtifactMetadata;
        this.enableArtifactVisualization = enableArtifactVisualization;
        this.experimentTracker = experimentTracker;
        this.stepOperator = stepOperator;
        this.parameters = ConfigMaps.copy(parameters);
        this.settings = ConfigMaps.copy(settings);
        this.extra = ConfigMaps.copy(extra);
        this.failureHookSource = failureHookSource;
        this.successHookSource = successHookSource;
        this.outputs = ConfigMaps.copy(outputs);
        this.cachingParameters = ConfigMaps.copy(cachingParameters);
        this.externalInputArtifacts = ConfigMaps.copy(externalInputArtifacts);
    }

    public static PartialStepConfiguration named(String name) {
        return builder(name).build();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public Builder toBuilder() {
        return new Builder(name)
                .enableCache(enableCache)
                .enableArtifactMetadata(enableArtifactMetadata)
                .enableArtifactVisualization(enableArtifactVisualization)
                .experimentTracker(experimentTracker)
                .stepOperator(stepOperator)
                .parameters(parameters)
                .settings(settings)
                .extra(extra)
                .failureHookSource(failureHookSource)
                .successHookSource(successHookSource)
                .outputs(outputs)
                .cachingParameters(cachingParameters)
                .externalInputArtifacts(externalInputArtifacts);
    }

    public String getName() {
        return name;
    }

    /** Null when not configured. */
    public Boolean getEnableCache() {
        return enableCache;
    }

    public Boolean getEnableArtifactMetadata() {
        return enableArtifactMetadata;
    }

    public Boolean getEnableArtifactVisualization() {
        return enableArtifactVisualization;
    }

    /** Name of the experiment tracker component the step runs with; null = none. */
    public String getExperimentTracker() {
        return experimentTracker;
    }

    /** Name of the step operator component the step runs on; null = orchestrator runs it. */
    public String getStepOperator() {
        return stepOperator;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    public Map<String, Object> getSettings() {
        return settings;
    }

    public Map<String, Object> getExtra() {
        return extra;
    }

    public Source getFailureHookSource() {
        return failureHookSource;
    }

    public Source getSuccessHookSource() {
        return successHookSource;
    }

    public Map<String, PartialArtifactConfiguration> getOutputs() {
        return outputs;
    }

    public Map<String, String> getCachingParameters() {
        return cachingParameters;
    }

    public Map<String, UUID> getExternalInputArtifacts() {
        return externalInputArtifacts;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PartialStepConfiguration)) return false;
        PartialStepConfiguration that = (PartialStepConfiguration) o;
        return name.equals(that.name)
                && Objects.equals(enableCache, that.enableCache)
                && Objects.equals(enableArtifactMetadata, that.enableArtifactMetadata)
                && Objects.equals(enableArtifactVisualization, that.enableArtifactVisualization)
                && Objects.equals(experimentTracker, that.experimentTracker)
                && Objects.equals(stepOperator, that.stepOperator)
                && parameters.equals(that.parameters)
                && settings.equals(that.settings)
                && extra.equals(that.extra)
                && Objects.equals(failureHookSource, that.failureHookSource)
                && Objects.equals(successHookSource, that.successHookSource)
                && outputs.equals(that.outputs)
                && cachingParameters.equals(that.cachingParameters)
                && externalInputArtifacts.equals(that.externalInputArtifacts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, enableCache, enableArtifactMetadata, enableArtifactVisualization,
                experimentTracker, stepOperator, parameters, settings, extra, failureHookSource,
                successHookSource, outputs, cachingParameters, externalInputArtifacts);
    }

    @Override
    public String toString() {
        return "PartialStepConfiguration{name=" + name
                + ", enableCache=" + enableCache
                + ", parameters=" + parameters
                + ", settings=" + settings.keySet()
                + ", outputs=" + outputs
                + ", extra=" + extra
                + "}";
    }

    public static final class Builder {
        private final String name;
        private Boolean enableCache;
        private Boolean enableArtifactMetadata;
        private Boolean enableArtifactVisualization;
        private String experimentTracker;
        private String stepOperator;
        private Map<String, Object> parameters;
        private Map<String, Object> settings;
        private Map<String, Object> extra;
        private Source failureHookSource;
        private Source successHookSource;
        private Map<String, PartialArtifactConfiguration> outputs;
        private Map<String, String> cachingParameters;
        private Map<String, UUID> externalInputArtifacts;

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder enableCache(Boolean enableCache) {
            this.enableCache = enableCache;
            return this;
        }

        public Builder enableArtifactMetadata(Boolean enableArtifactMetadata) {
            this.enableArtifactMetadata = enableArtifactMetadata;
            return this;
        }

        public Builder enableArtifactVisualization(Boolean enableArtifactVisualization) {
            this.enableArtifactVisualization = enableArtifactVisualization;
            return this;
        }

        public Builder experimentTracker(String experimentTracker) {
            this.experimentTracker = experimentTracker;
            return this;
        }

        public Builder stepOperator(String stepOperator) {
            this.stepOperator = stepOperator;
            return this;
        }

        public Builder parameters(Map<String, Object> parameters) {
            this.parameters = parameters;
            return this;
        }

        public Builder settings(Map<String, Object> settings) {
            this.settings = settings;
            return this;
        }

        public Builder extra(Map<String, Object> extra) {
            this.extra = extra;
            return this;
        }

        public Builder failureHookSource(Source failureHookSource) {
            this.failureHookSource = failureHookSource;
            return this;
        }

        public Builder successHookSource(Source successHookSource) {
            this.successHookSource = successHookSource;
            return this;
        }

        public Builder outputs(Map<String, PartialArtifactConfiguration> outputs) {
            this.outputs = outputs;
            return this;
        }

        public Builder cachingParameters(Map<String, String> cachingParameters) {
            this.cachingParameters = cachingParameters;
            return this;
        }

        public Builder externalInputArtifacts(Map<String, UUID> externalInputArtifacts) {
            this.externalInputArtifacts = externalInputArtifacts;
            return this;
        }

        public PartialStepConfiguration build() {
            return new PartialStepConfiguration(name, enableCache, enableArtifactMetadata,
                    enableArtifactVisualization, experimentTracker, stepOperator, parameters, settings, extra,
                    failureHookSource, successHookSource, outputs, cachingParameters, externalInputArtifacts);
        }
    }
}
