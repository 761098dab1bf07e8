package com.stepflow.pipeline;

import com.stepflow.stepinterface.StepInterfaceException;

/**
 * Thrown when a step input has neither an artifact, an external artifact nor a parameter value.
 */
public class MissingInputException extends StepInterfaceException {

    private final String stepName;
    private final String inputName;

    public MissingInputException(String stepName, String inputName) {
        super("Missing entrypoint input '" + inputName + "' for step '" + stepName + "'.");
        this.stepName = stepName;
        this.inputName = inputName;
    }

    public String getStepName() {
        return stepName;
    }

    public String getInputName() {
        return inputName;
    }
}
