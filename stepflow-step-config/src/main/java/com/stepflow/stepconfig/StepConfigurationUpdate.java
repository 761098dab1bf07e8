package com.stepflow.stepconfig;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Patch for a step configuration. Unset fields are null and leave the base value untouched.
 * Consumed by {@link ConfigurationMerger#merge}.
 */
public final class StepConfigurationUpdate {

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
    private final List<Source> allOutputsMaterializerSource;

    private StepConfigurationUpdate(Builder b) {
        this.enableCache = b.enableCache;
        this.enableArtifactMetadata = b.enableArtifactMetadata;
        this.enableArtifactVisualization = b.enableArtifactVisualization;
        this.experimentTracker = b.experimentTracker;
        this.stepOperator = b.stepOperator;
        this.parameters = b.parameters != null ? ConfigMaps.copy(b.parameters) : null;
        this.settings = b.settings != null ? ConfigMaps.copy(b.settings) : null;
        this.extra = b.extra != null ? ConfigMaps.copy(b.extra) : null;
        this.failureHookSource = b.failureHookSource;
        this.successHookSource = b.successHookSource;
        this.outputs = b.outputs != null ? ConfigMaps.copy(b.outputs) : null;
        this.allOutputsMaterializerSource = b.allOutputsMaterializerSource != null
                ? List.copyOf(b.allOutputsMaterializerSource) : null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Boolean getEnableCache() {
        return enableCache;
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

    public Map<String, PartialArtifactConfiguration> getOutputs() {
        return outputs;
    }

    /**
     * Materializers given without output names. The step template expands them to every declared
     * output before merging; the merger itself ignores this field.
     */
    public List<Source> getAllOutputsMaterializerSource() {
        return allOutputsMaterializerSource;
    }

    /** Copy of this update with {@code outputs} replaced and the all-outputs materializers dropped. */
    public StepConfigurationUpdate withOutputs(Map<String, PartialArtifactConfiguration> outputs) {
        Builder b = toBuilder();
        b.outputs = outputs;
        b.allOutputsMaterializerSource = null;
        return b.build();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.enableCache = enableCache;
        b.enableArtifactMetadata = enableArtifactMetadata;
        b.enableArtifactVisualization = enableArtifactVisualization;
        b.experimentTracker = experimentTracker;
        b.stepOperator = stepOperator;
        b.parameters = parameters;
        b.settings = settings;
        b.extra = extra;
        b.failureHookSource = failureHookSource;
        b.successHookSource = successHookSource;
        b.outputs = outputs;
        b.allOutputsMaterializerSource = allOutputsMaterializerSource;
        return b;
    }

    public static final class Builder {
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
        private List<Source> allOutputsMaterializerSource;

        private Builder() {
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

        public Builder parameter(String key, Object value) {
            if (parameters == null) parameters = new LinkedHashMap<>();
            else parameters = new LinkedHashMap<>(parameters);
            parameters.put(Objects.requireNonNull(key, "key"), value);
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

        public Builder onFailure(Class<?> hookClass) {
            return failureHookSource(Source.fromClass(hookClass));
        }

        public Builder successHookSource(Source successHookSource) {
            this.successHookSource = successHookSource;
            return this;
        }

        public Builder onSuccess(Class<?> hookClass) {
            return successHookSource(Source.fromClass(hookClass));
        }

        public Builder outputs(Map<String, PartialArtifactConfiguration> outputs) {
            this.outputs = outputs;
            return this;
        }

        /** Materializers for one output, tried in the given order. */
        public Builder outputMaterializers(String outputName, Class<?>... materializers) {
            return outputMaterializerSources(outputName,
                    Arrays.stream(materializers).map(Source::fromClass).toArray(Source[]::new));
        }

        public Builder outputMaterializerSources(String outputName, Source... sources) {
            if (outputs == null) outputs = new LinkedHashMap<>();
            else outputs = new LinkedHashMap<>(outputs);
            outputs.put(Objects.requireNonNull(outputName, "outputName"), PartialArtifactConfiguration.of(List.of(sources)));
            return this;
        }

        /** Materializers applied to every output of the step. */
        public Builder materializers(Class<?>... materializers) {
            this.allOutputsMaterializerSource = Arrays.stream(materializers).map(Source::fromClass).toList();
            return this;
        }

        public Builder materializerSources(List<Source> sources) {
            this.allOutputsMaterializerSource = sources;
            return this;
        }

        public StepConfigurationUpdate build() {
            return new StepConfigurationUpdate(this);
        }
    }
}
