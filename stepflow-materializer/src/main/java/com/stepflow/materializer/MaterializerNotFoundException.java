package com.stepflow.materializer;

import com.stepflow.stepinterface.StepInterfaceException;

/**
 * Thrown when no default materializer is registered for a type and none was configured.
 * {@code stepName} and {@code outputName} are null for external artifacts.
 */
public class MaterializerNotFoundException extends StepInterfaceException {

    private final String stepName;
    private final String outputName;
    private final String typeName;

    public MaterializerNotFoundException(String stepName, String outputName, String typeName) {
        super(message(stepName, outputName, typeName));
        this.stepName = stepName;
        this.outputName = outputName;
        this.typeName = typeName;
    }

    private static String message(String stepName, String outputName, String typeName) {
        String subject = outputName != null
                ? "output '" + outputName + "' of type `" + typeName + "` in step '" + stepName + "'"
                : "type `" + typeName + "`";
        return "Unable to find materializer for " + subject + ". Either set a materializer explicitly or "
                + "register a default materializer for the type (a BaseMaterializer subclass annotated with @Materializes).";
    }

    public String getStepName() {
        return stepName;
    }

    public String getOutputName() {
        return outputName;
    }

    public String getTypeName() {
        return typeName;
    }
}
