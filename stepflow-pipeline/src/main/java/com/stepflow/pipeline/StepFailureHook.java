package com.stepflow.pipeline;

import com.stepflow.stepinterface.StepContext;
import com.stepflow.stepinterface.StepParameters;

/**
 * Called by the orchestrator when a step fails. Implementations need a public no-argument constructor.
 */
@FunctionalInterface
public interface StepFailureHook {

    /**
     * @param parameters the step parameters object, or null when the step has none
     */
    void onFailure(StepContext context, StepParameters parameters, Throwable error);
}
