package com.stepflow.stepinterface;

/**
 * Base type of every error raised while declaring steps, building a pipeline graph or
 * finalizing step configurations. Errors are never retried inside the library.
 */
public class StepflowException extends RuntimeException {

    public StepflowException(String message) {
        super(message);
    }

    public StepflowException(String message, Throwable cause) {
        super(message, cause);
    }
}
