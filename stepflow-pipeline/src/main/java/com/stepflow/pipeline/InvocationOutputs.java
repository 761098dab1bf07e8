package com.stepflow.pipeline;

import com.stepflow.artifacts.StepArtifact;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of calling a step in a pipeline build: one artifact reference per declared output,
 * in declaration order.
 */
public final class InvocationOutputs {

    private final String invocationId;
    private final Map<String, StepArtifact> outputs;

    InvocationOutputs(String invocationId, Map<String, StepArtifact> outputs) {
        this.invocationId = invocationId;
        this.outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
    }

    public String getInvocationId() {
        return invocationId;
    }

    /**
     * @throws IllegalArgumentException if the step declares no output with this name
     */
    public StepArtifact get(String outputName) {
        StepArtifact artifact = outputs.get(outputName);
        if (artifact == null) {
            throw new IllegalArgumentException("Step invocation '" + invocationId + "' has no output '" + outputName
                    + "'. Outputs: " + outputs.keySet());
        }
        return artifact;
    }

    /**
     * The only output of a single-output step.
     *
     * @throws IllegalStateException if the step has no or several outputs
     */
    public StepArtifact single() {
        if (outputs.size() != 1) {
            throw new IllegalStateException("Step invocation '" + invocationId + "' has " + outputs.size()
                    + " outputs " + outputs.keySet() + "; use get(name)");
        }
        return outputs.values().iterator().next();
    }

    public Map<String, StepArtifact> asMap() {
        return outputs;
    }

    @Override
    public String toString() {
        return "InvocationOutputs{" + invocationId + " -> " + outputs.keySet() + "}";
    }
}
