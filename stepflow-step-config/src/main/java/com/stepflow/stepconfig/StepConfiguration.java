package com.stepflow.stepconfig;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Finalized configuration of one step invocation. Created once when the invocation is finalized
 * and never changed afterwards; safe to share between threads. Parameters hold JSON-representable
 * values only; every declared output carries its resolved materializer list.
 */
public final class StepConfiguration {

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
    private final Map<String, ArtifactConfiguration> outputs;
    private final Map<String, String> cachingParameters;
    private final Map<String, UUID> externalInputArtifacts;

    @JsonCreator
    public StepConfiguration(
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
            @JsonProperty("outputs") Map<String, ArtifactConfiguration> outputs,
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

    /**
     * Completes a partial configuration with the resolved output configurations. Outputs of the
     * partial configuration are replaced.
     */
    public static StepConfiguration from(PartialStepConfiguration partial, Map<String, ArtifactConfiguration> outputs) {
        Objects.requireNonNull(partial, "partial");
        return new StepConfiguration(
                partial.getName(),
                partial.getEnableCache(),
                partial.getEnableArtifactMetadata(),
                partial.getEnableArtifactVisualization(),
                partial.getExperimentTracker(),
                partial.getStepOperator(),
                partial.getParameters(),
                partial.getSettings(),
                partial.getExtra(),
                partial.getFailureHookSource(),
                partial.getSuccessHookSource(),
                outputs,
                partial.getCachingParameters(),
                partial.getExternalInputArtifacts());
    }

    /** The same values as a partial configuration (e.g. as base for a further merge). */
    public PartialStepConfiguration toPartial() {
        Map<String, PartialArtifactConfiguration> partialOutputs = new LinkedHashMap<>();
        outputs.forEach((k, v) -> partialOutputs.put(k, PartialArtifactConfiguration.of(v.getMaterializerSource())));
        return PartialStepConfiguration.builder(name)
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
                .outputs(partialOutputs)
                .cachingParameters(cachingParameters)
                .externalInputArtifacts(externalInputArtifacts)
                .build();
    }

    public String getName() {
        return name;
    }

    public Boolean getEnableCache() {
        return enableCache;
    }

    /** Caching applies unless it was explicitly disabled. */
    @JsonIgnore
    public boolean isCachingEnabled() {
        return !Boolean.FALSE.equals(enableCache);
    }

    public Boolean getEnableArtifactMetadata() {
        return enableArtifactMetadata;
    }

    public Boolean getEnableArtifactVisualization() {
        return enableArtifactVisualization;
    }

    public String getExperimentTracker() {
        return experimentTracker;
    }

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

    public Map<String, ArtifactConfiguration> getOutputs() {
        return outputs;
    }

    /** Caching fingerprint material: step source hash and per-output materializer hashes. */
    public Map<String, String> getCachingParameters() {
        return cachingParameters;
    }

    /** Input name to id of the external artifact bound to it. */
    public Map<String, UUID> getExternalInputArtifacts() {
        return externalInputArtifacts;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StepConfiguration)) return false;
        StepConfiguration that = (StepConfiguration) o;
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
        return "StepConfiguration{name=" + name
                + ", enableCache=" + enableCache
                + ", parameters=" + parameters
                + ", outputs=" + outputs
                + ", cachingParameters=" + cachingParameters
                + ", externalInputArtifacts=" + externalInputArtifacts
                + "}";
    }
}
