package com.stepflow.pipeline;

import com.stepflow.stepinterface.StepContext;
import com.stepflow.stepinterface.StepParameters;

/**
 * Called by the orchestrator after a step succeeded. Implementations need a public no-argument constructor.
 */
@FunctionalInterface
public interface StepSuccessHook {

    void onSuccess(StepContext context, StepParameters parameters);
}
