package com.stepflow.pipeline;

import com.stepflow.stepinterface.StepflowException;

/**
 * Thrown when an invocation id is already used in the pipeline build and suffixing is not allowed
 * (an explicit id was given).
 */
public class DuplicateInvocationException extends StepflowException {

    private final String invocationId;

    public DuplicateInvocationException(String invocationId) {
        super("Duplicate step invocation id '" + invocationId + "' in pipeline. Use a different id for each call.");
        this.invocationId = invocationId;
    }

    public String getInvocationId() {
        return invocationId;
    }
}
