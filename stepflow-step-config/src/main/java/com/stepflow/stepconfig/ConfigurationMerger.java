package com.stepflow.stepconfig;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Applies a {@link StepConfigurationUpdate} to a configuration and returns a new configuration.
 * <p>
 * Shallow merge ({@code deep == false}): every field set on the update replaces the base field,
 * maps included. Deep merge: flags and names are replaced, maps are merged recursively with the
 * update winning on collisions, outputs are merged per output name and then per field.
 * Setting keys of the update are validated before anything is merged.
 */
public final class ConfigurationMerger {

    private static final Logger log = LoggerFactory.getLogger(ConfigurationMerger.class);

    private ConfigurationMerger() {
    }

    public static PartialStepConfiguration merge(PartialStepConfiguration base, StepConfigurationUpdate update, boolean deep) {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(update, "update");
        if (update.getSettings() != null) {
            SettingKeys.validate(update.getSettings().keySet());
        }

        PartialStepConfiguration.Builder b = base.toBuilder();
        if (update.getEnableCache() != null) b.enableCache(update.getEnableCache());
        if (update.getEnableArtifactMetadata() != null) b.enableArtifactMetadata(update.getEnableArtifactMetadata());
        if (update.getEnableArtifactVisualization() != null) b.enableArtifactVisualization(update.getEnableArtifactVisualization());
        if (update.getExperimentTracker() != null) b.experimentTracker(update.getExperimentTracker());
        if (update.getStepOperator() != null) b.stepOperator(update.getStepOperator());
        if (update.getFailureHookSource() != null) b.failureHookSource(update.getFailureHookSource());
        if (update.getSuccessHookSource() != null) b.successHookSource(update.getSuccessHookSource());
        if (update.getParameters() != null) {
            b.parameters(deep ? ConfigMaps.recursiveUpdate(base.getParameters(), update.getParameters()) : update.getParameters());
        }
        if (update.getSettings() != null) {
            b.settings(deep ? ConfigMaps.recursiveUpdate(base.getSettings(), update.getSettings()) : update.getSettings());
        }
        if (update.getExtra() != null) {
            b.extra(deep ? ConfigMaps.recursiveUpdate(base.getExtra(), update.getExtra()) : update.getExtra());
        }
        if (update.getOutputs() != null) {
            b.outputs(deep ? mergeOutputs(base.getOutputs(), update.getOutputs()) : update.getOutputs());
        }
        PartialStepConfiguration merged = b.build();
        log.debug("Updated step configuration (deep={}): {}", deep, merged);
        return merged;
    }

    /** Merges into a finalized configuration; the result is partial again. */
    public static PartialStepConfiguration merge(StepConfiguration base, StepConfigurationUpdate update, boolean deep) {
        return merge(Objects.requireNonNull(base, "base").toPartial(), update, deep);
    }

    private static Map<String, PartialArtifactConfiguration> mergeOutputs(
            Map<String, PartialArtifactConfiguration> base,
            Map<String, PartialArtifactConfiguration> update) {
        Map<String, PartialArtifactConfiguration> out = new LinkedHashMap<>(base);
        update.forEach((name, config) -> {
            PartialArtifactConfiguration existing = out.get(name);
            out.put(name, existing != null ? existing.mergedWith(config) : config);
        });
        return out;
    }
}
