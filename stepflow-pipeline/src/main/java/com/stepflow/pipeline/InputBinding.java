package com.stepflow.pipeline;

import java.util.Objects;

/**
 * Wiring of a step input to the output of an upstream invocation.
 */
public record InputBinding(String invocationId, String outputName) {

    public InputBinding {
        Objects.requireNonNull(invocationId, "invocationId");
        Objects.requireNonNull(outputName, "outputName");
    }
}
