/**
 * Step templates and pipeline graph building.
 * <ul>
 *   <li>{@link com.stepflow.pipeline.StepTemplate} – analysed step with its base configuration</li>
 *   <li>{@link com.stepflow.pipeline.PipelineBuild} – active build; registers invocations and finalizes them</li>
 *   <li>{@link com.stepflow.pipeline.PipelineInvocationGraph} – immutable, topologically ordered result for orchestrators</li>
 *   <li>{@link com.stepflow.pipeline.StepFailureHook} / {@link com.stepflow.pipeline.StepSuccessHook} – hook contracts</li>
 * </ul>
 */
package com.stepflow.pipeline;
