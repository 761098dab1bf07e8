package com.stepflow.pipeline;

import com.stepflow.stepinterface.StepflowException;

import java.util.List;

/**
 * Thrown when ordering hints close a cycle between invocations.
 */
public class CyclicDependencyException extends StepflowException {

    private final List<String> invocationIds;

    public CyclicDependencyException(List<String> invocationIds) {
        super("Step invocations form a cycle: " + invocationIds);
        this.invocationIds = List.copyOf(invocationIds);
    }

    /** Invocations that could not be ordered (the cycle and everything downstream of it). */
    public List<String> getInvocationIds() {
        return invocationIds;
    }
}
