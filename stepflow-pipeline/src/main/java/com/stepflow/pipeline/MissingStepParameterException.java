package com.stepflow.pipeline;

import com.stepflow.stepinterface.StepflowException;

import java.util.List;

/**
 * Thrown when {@link com.stepflow.annotations.Required} fields of a step parameters class have no
 * configured value.
 */
public class MissingStepParameterException extends StepflowException {

    private final String stepName;
    private final List<String> missingKeys;
    private final Class<?> parametersClass;

    public MissingStepParameterException(String stepName, List<String> missingKeys, Class<?> parametersClass) {
        super("Missing parameters " + missingKeys + " for step '" + stepName + "' (" + parametersClass.getSimpleName()
                + "). Configure them with StepConfigurationUpdate.parameter(...) or pass an initialized "
                + parametersClass.getSimpleName() + " when creating the step.");
        this.stepName = stepName;
        this.missingKeys = List.copyOf(missingKeys);
        this.parametersClass = parametersClass;
    }

    public String getStepName() {
        return stepName;
    }

    public List<String> getMissingKeys() {
        return missingKeys;
    }

    public Class<?> getParametersClass() {
        return parametersClass;
    }
}
