package com.stepflow.stepinterface;

import java.util.Map;
import java.util.Objects;

/**
 * Runtime context handed to an entrypoint that declares a parameter of this type. Gives access to
 * the step name, the invocation id and the declared output types. Declaring it disables caching
 * unless caching is enabled explicitly, since the context reaches outside the step's inputs.
 */
public class StepContext {

    private final String stepName;
    private final String invocationId;
    private final Map<String, DeclaredType> outputTypes;

    public StepContext(String stepName, String invocationId, Map<String, DeclaredType> outputTypes) {
        this.stepName = Objects.requireNonNull(stepName, "stepName");
        this.invocationId = invocationId;
        this.outputTypes = outputTypes != null ? Map.copyOf(outputTypes) : Map.of();
    }

    public String getStepName() {
        return stepName;
    }

    /** Invocation id within the pipeline graph; null when the step is run directly. */
    public String getInvocationId() {
        return invocationId;
    }

    public Map<String, DeclaredType> getOutputTypes() {
        return outputTypes;
    }
}
