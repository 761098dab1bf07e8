package com.stepflow.stepconfig;

import java.util.Optional;

/**
 * Stack component types that may carry component-specific settings ({@code <type>.<flavor>} keys).
 */
public enum StackComponentType {
    ALERTER("alerter"),
    ANNOTATOR("annotator"),
    ARTIFACT_STORE("artifact_store"),
    CONTAINER_REGISTRY("container_registry"),
    DATA_VALIDATOR("data_validator"),
    EXPERIMENT_TRACKER("experiment_tracker"),
    FEATURE_STORE("feature_store"),
    IMAGE_BUILDER("image_builder"),
    MODEL_DEPLOYER("model_deployer"),
    MODEL_REGISTRY("model_registry"),
    ORCHESTRATOR("orchestrator"),
    STEP_OPERATOR("step_operator");

    private final String key;

    StackComponentType(String key) {
        this.key = key;
    }

    /** Lower-case key as used in setting names. */
    public String key() {
        return key;
    }

    public static Optional<StackComponentType> fromKey(String key) {
        for (StackComponentType type : values()) {
            if (type.key.equals(key)) return Optional.of(type);
        }
        return Optional.empty();
    }
}
