package com.stepflow.pipeline;

import com.stepflow.stepinterface.StepflowException;

/**
 * Thrown at finalization when an ordering hint set with {@link StepTemplate#after(StepTemplate)}
 * involves a template that is called more than once in the same pipeline.
 */
public class AmbiguousOrderingException extends StepflowException {

    private final String stepName;

    public AmbiguousOrderingException(String stepName) {
        super("Setting upstream steps with after(...) is not allowed in combination with calling the step '"
                + stepName + "' multiple times in one pipeline.");
        this.stepName = stepName;
    }

    public String getStepName() {
        return stepName;
    }
}
