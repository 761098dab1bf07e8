package com.stepflow.stepinterface;

/**
 * Thrown when a step's entrypoint, its configuration or the arguments it is called with do not
 * match the declared step interface. Fatal to the declaration or call that triggered it.
 */
public class StepInterfaceException extends StepflowException {

    public StepInterfaceException(String message) {
        super(message);
    }

    public StepInterfaceException(String message, Throwable cause) {
        super(message, cause);
    }
}
