package com.stepflow.pipeline;

import com.stepflow.stepinterface.StepflowException;

/**
 * Thrown when a step is called with an upstream invocation id (explicit or through an artifact)
 * that is not registered in the pipeline build.
 */
public class InvalidUpstreamException extends StepflowException {

    private final String stepName;
    private final String upstreamId;

    public InvalidUpstreamException(String stepName, String upstreamId) {
        super("Unknown upstream step invocation '" + upstreamId + "' for step '" + stepName
                + "'. Upstream invocations must be called before their downstream steps in the same pipeline.");
        this.stepName = stepName;
        this.upstreamId = upstreamId;
    }

    public String getStepName() {
        return stepName;
    }

    public String getUpstreamId() {
        return upstreamId;
    }
}
