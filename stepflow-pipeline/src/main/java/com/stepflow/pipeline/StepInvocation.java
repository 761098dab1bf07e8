package com.stepflow.pipeline;

import com.stepflow.artifacts.ExternalArtifact;
import com.stepflow.artifacts.StepArtifact;
import com.stepflow.stepconfig.ConfigMaps;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * One use of a step template in a pipeline build, as registered by
 * {@link PipelineBuild#addInvocation}.
 */
public final class StepInvocation {

    private final String id;
    private final StepTemplate template;
    private final Map<String, StepArtifact> inputArtifacts;
    private final Map<String, ExternalArtifact> externalArtifacts;
    private final Map<String, Object> parameters;
    private final Set<String> invocationUpstream;

    StepInvocation(
            String id,
            StepTemplate template,
            Map<String, StepArtifact> inputArtifacts,
            Map<String, ExternalArtifact> externalArtifacts,
            Map<String, Object> parameters,
            Set<String> invocationUpstream) {
        this.id = id;
        this.template = template;
        this.inputArtifacts = Collections.unmodifiableMap(new LinkedHashMap<>(inputArtifacts));
        this.externalArtifacts = Collections.unmodifiableMap(new LinkedHashMap<>(externalArtifacts));
        this.parameters = ConfigMaps.copy(parameters);
        this.invocationUpstream = Collections.unmodifiableSet(new LinkedHashSet<>(invocationUpstream));
    }

    public String getId() {
        return id;
    }

    public StepTemplate getTemplate() {
        return template;
    }

    public Map<String, StepArtifact> getInputArtifacts() {
        return inputArtifacts;
    }

    public Map<String, ExternalArtifact> getExternalArtifacts() {
        return externalArtifacts;
    }

    /** Parameters passed at call time; they override the template's configured parameters. */
    public Map<String, Object> getParameters() {
        return parameters;
    }

    /**
     * Upstream ids known at call time: producers of input artifacts and explicit ids. Ordering
     * hints of the template are added when the graph is finalized.
     */
    public Set<String> getInvocationUpstream() {
        return invocationUpstream;
    }

    @Override
    public String toString() {
        return "StepInvocation{id=" + id + ", step=" + template.getName() + ", upstream=" + invocationUpstream + "}";
    }
}
