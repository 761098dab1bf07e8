package com.stepflow.pipeline;

import com.stepflow.stepconfig.StepConfiguration;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Finalized node of a {@link PipelineInvocationGraph}: everything an orchestrator needs to
 * schedule and dispatch one step invocation.
 *
 * @param upstream          ids of invocations that must finish first
 * @param externalArtifacts resolved external artifact ids by input name
 * @param inputs            producing invocation and output by input name
 */
public record InvocationNode(
        String invocationId,
        StepConfiguration configuration,
        Set<String> upstream,
        Map<String, UUID> externalArtifacts,
        Map<String, InputBinding> inputs) {

    public InvocationNode {
        Objects.requireNonNull(invocationId, "invocationId");
        Objects.requireNonNull(configuration, "configuration");
        upstream = Collections.unmodifiableSet(new LinkedHashSet<>(upstream));
        externalArtifacts = Collections.unmodifiableMap(new LinkedHashMap<>(externalArtifacts));
        inputs = Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
    }

    public String stepName() {
        return configuration.getName();
    }
}
