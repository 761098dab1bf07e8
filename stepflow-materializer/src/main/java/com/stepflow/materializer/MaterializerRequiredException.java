package com.stepflow.materializer;

import com.stepflow.stepinterface.StepInterfaceException;

/**
 * Thrown when an output is declared without a concrete type and no materializer was configured.
 */
public class MaterializerRequiredException extends StepInterfaceException {

    private final String stepName;
    private final String outputName;

    public MaterializerRequiredException(String stepName, String outputName) {
        super("An explicit materializer needs to be specified for output '" + outputName + "' of step '"
                + stepName + "' because its type is Any. Configure one with outputMaterializers(...).");
        this.stepName = stepName;
        this.outputName = outputName;
    }

    public String getStepName() {
        return stepName;
    }

    public String getOutputName() {
        return outputName;
    }
}
