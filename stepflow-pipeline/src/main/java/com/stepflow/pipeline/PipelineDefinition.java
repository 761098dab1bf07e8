package com.stepflow.pipeline;

/**
 * Body of a pipeline: calls step templates against the given build.
 */
@FunctionalInterface
public interface PipelineDefinition {

    void define(PipelineBuild build);
}
