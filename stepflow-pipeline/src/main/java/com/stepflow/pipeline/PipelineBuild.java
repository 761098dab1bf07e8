package com.stepflow.pipeline;

import com.stepflow.artifacts.ArtifactUploadContext;
import com.stepflow.artifacts.ExternalArtifact;
import com.stepflow.artifacts.StepArtifact;
import com.stepflow.caching.CachingFingerprintCalculator;
import com.stepflow.caching.ClassFileSourceCodeReader;
import com.stepflow.caching.SourceCodeHasher;
import com.stepflow.config.StepflowConfig;
import com.stepflow.materializer.MaterializerRegistry;
import com.stepflow.materializer.MaterializerResolver;
import com.stepflow.stepconfig.PartialStepConfiguration;
import com.stepflow.stepconfig.StepConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The active pipeline build: collects step invocations and finalizes them into a
 * {@link PipelineInvocationGraph}.
 * <p>
 * At most one build is active per process. Open it with try-with-resources so it is released on
 * every exit path:
 * <pre>{@code
 * try (PipelineBuild build = PipelineBuild.begin("training", uploadContext)) {
 *     StepArtifact data = load.call(build, Map.of()).single();
 *     train.call(build, Map.of("data", data));
 *     graph = build.finalizeGraph();
 * }
 * }</pre>
 * A build is confined to the thread that opened it.
 */
public final class PipelineBuild implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PipelineBuild.class);

    private static final AtomicReference<PipelineBuild> ACTIVE = new AtomicReference<>();

    private final String name;
    private final ArtifactUploadContext uploadContext;
    private final MaterializerResolver materializerResolver;
    private final CachingFingerprintCalculator fingerprintCalculator;
    private final Map<String, StepInvocation> invocations = new LinkedHashMap<>();
    private boolean closed;

    private PipelineBuild(Builder b) {
        this.name = b.name;
        this.uploadContext = b.uploadContext;
        StepflowConfig config = uploadContext != null ? uploadContext.getConfig() : StepflowConfig.get();
        MaterializerRegistry registry = uploadContext != null ? uploadContext.getMaterializerRegistry() : MaterializerRegistry.getInstance();
        this.materializerResolver = b.materializerResolver != null ? b.materializerResolver : new MaterializerResolver(registry);
        this.fingerprintCalculator = b.fingerprintCalculator != null ? b.fingerprintCalculator
                : new CachingFingerprintCalculator(new SourceCodeHasher(config.getSourceHashAlgorithm(), new ClassFileSourceCodeReader()));
    }

    /**
     * Opens a build with default resolver and fingerprint calculator.
     *
     * @param uploadContext collaborators for external artifacts; may be null when none are used
     * @throws IllegalStateException if another build is active
     */
    public static PipelineBuild begin(String name, ArtifactUploadContext uploadContext) {
        return builder(name).uploadContext(uploadContext).begin();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Runs the definition inside a new build and returns the finalized graph. The build is
     * released even when the definition or finalization fails.
     */
    public static PipelineInvocationGraph build(String name, ArtifactUploadContext uploadContext, PipelineDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        try (PipelineBuild build = begin(name, uploadContext)) {
            definition.define(build);
            return build.finalizeGraph();
        }
    }

    /** The currently open build, if any. */
    public static Optional<PipelineBuild> active() {
        return Optional.ofNullable(ACTIVE.get());
    }

    public String getName() {
        return name;
    }

    public ArtifactUploadContext getUploadContext() {
        return uploadContext;
    }

    public StepflowConfig getConfig() {
        return uploadContext != null ? uploadContext.getConfig() : StepflowConfig.get();
    }

    /** Registered invocations in registration order. */
    public Map<String, StepInvocation> getInvocations() {
        return Collections.unmodifiableMap(invocations);
    }

    /**
     * Registers an invocation node.
     *
     * @param explicitUpstream ids of already registered invocations this one runs after
     * @param customId         id to use; null or blank derives it from the template name
     * @param allowSuffix      append {@code _2}, {@code _3}, ... when the id is taken
     * @return the invocation id
     * @throws DuplicateInvocationException if the id is taken and suffixing is not allowed
     * @throws InvalidUpstreamException     if an upstream id or artifact producer is not registered
     */
    public String addInvocation(
            StepTemplate template,
            Map<String, StepArtifact> inputArtifacts,
            Map<String, ExternalArtifact> externalArtifacts,
            Map<String, Object> parameters,
            Set<String> explicitUpstream,
            String customId,
            boolean allowSuffix) {
        ensureOpen();
        Objects.requireNonNull(template, "template");
        Set<String> upstream = new LinkedHashSet<>();
        for (StepArtifact artifact : inputArtifacts.values()) {
            upstream.add(artifact.invocationId());
        }
        upstream.addAll(explicitUpstream);
        for (String upstreamId : upstream) {
            if (!invocations.containsKey(upstreamId)) {
                throw new InvalidUpstreamException(template.getName(), upstreamId);
            }
        }

        String invocationId = customId != null && !customId.isBlank() ? customId : template.getName();
        if (invocations.containsKey(invocationId)) {
            if (!allowSuffix) {
                throw new DuplicateInvocationException(invocationId);
            }
            int suffix = 2;
            while (invocations.containsKey(invocationId + "_" + suffix)) {
                suffix++;
            }
            invocationId = invocationId + "_" + suffix;
        }
        invocations.put(invocationId, new StepInvocation(invocationId, template, inputArtifacts, externalArtifacts,
                parameters, upstream));
        log.debug("Pipeline '{}': added step invocation '{}' (upstream={})", name, invocationId, upstream);
        return invocationId;
    }

    /**
     * Full upstream set of an invocation: producers of its artifacts, explicit ids and the
     * invocations of templates it was ordered after.
     *
     * @throws AmbiguousOrderingException if ordering hints involve a template called more than once
     */
    public Set<String> resolveUpstream(String invocationId) {
        StepInvocation invocation = requireInvocation(invocationId);
        Set<String> upstream = new LinkedHashSet<>(invocation.getInvocationUpstream());
        StepTemplate template = invocation.getTemplate();
        if (template.getUpstreamTemplates().isEmpty()) {
            return upstream;
        }
        if (invocationsOf(template).size() > 1) {
            throw new AmbiguousOrderingException(template.getName());
        }
        for (StepTemplate upstreamTemplate : template.getUpstreamTemplates()) {
            List<String> ids = invocationsOf(upstreamTemplate);
            if (ids.size() > 1) {
                throw new AmbiguousOrderingException(upstreamTemplate.getName());
            }
            upstream.addAll(ids);
        }
        return upstream;
    }

    /**
     * Finalizes the configuration of one invocation: applies call-time parameters over the
     * template configuration, resolves external artifacts, resolves output materializers,
     * checks that every input is bound and computes the caching fingerprint.
     */
    public StepConfiguration finalizeInvocation(String invocationId) {
        StepInvocation invocation = requireInvocation(invocationId);
        resolveUpstream(invocationId);
        StepTemplate template = invocation.getTemplate();

        PartialStepConfiguration templateConfig = template.getConfiguration();
        Map<String, Object> parameters = new LinkedHashMap<>(templateConfig.getParameters());
        parameters.putAll(invocation.getParameters());
        PartialStepConfiguration base = templateConfig.toBuilder().parameters(parameters).build();

        Map<String, UUID> externalIds = new LinkedHashMap<>();
        if (!invocation.getExternalArtifacts().isEmpty()) {
            ArtifactUploadContext context = requireUploadContext();
            invocation.getExternalArtifacts().forEach((input, artifact) -> externalIds.put(input, artifact.resolve(context)));
        }

        Set<String> artifactInputs = new LinkedHashSet<>(invocation.getInputArtifacts().keySet());
        artifactInputs.addAll(externalIds.keySet());
        return template.finalizeConfiguration(base, artifactInputs, externalIds, materializerResolver, fingerprintCalculator);
    }

    /**
     * Finalizes every invocation in registration order and orders them topologically.
     *
     * @throws CyclicDependencyException if ordering hints close a cycle
     */
    public PipelineInvocationGraph finalizeGraph() {
        ensureOpen();
        Map<String, InvocationNode> nodes = new LinkedHashMap<>();
        for (StepInvocation invocation : invocations.values()) {
            StepConfiguration configuration = finalizeInvocation(invocation.getId());
            Map<String, InputBinding> inputs = new LinkedHashMap<>();
            invocation.getInputArtifacts().forEach((input, artifact) ->
                    inputs.put(input, new InputBinding(artifact.invocationId(), artifact.outputName())));
            nodes.put(invocation.getId(), new InvocationNode(invocation.getId(), configuration,
                    resolveUpstream(invocation.getId()), configuration.getExternalInputArtifacts(), inputs));
        }
        PipelineInvocationGraph graph = new PipelineInvocationGraph(name, topologicalOrder(nodes));
        log.info("Pipeline '{}' finalized with {} step invocation(s): {}", name, graph.size(), graph.getInvocationIds());
        return graph;
    }

    /** Releases the build. Safe to call more than once. */
    @Override
    public void close() {
        if (!closed) {
            closed = true;
            ACTIVE.compareAndSet(this, null);
            log.debug("Pipeline build '{}' closed", name);
        }
    }

    private static List<InvocationNode> topologicalOrder(Map<String, InvocationNode> nodes) {
        Map<String, Integer> pending = new HashMap<>();
        Map<String, List<String>> downstream = new HashMap<>();
        for (InvocationNode node : nodes.values()) {
            pending.put(node.invocationId(), node.upstream().size());
            for (String upstreamId : node.upstream()) {
                downstream.computeIfAbsent(upstreamId, k -> new ArrayList<>()).add(node.invocationId());
            }
        }
        Deque<String> ready = new ArrayDeque<>();
        for (InvocationNode node : nodes.values()) {
            if (node.upstream().isEmpty()) ready.add(node.invocationId());
        }
        List<InvocationNode> ordered = new ArrayList<>(nodes.size());
        while (!ready.isEmpty()) {
            String id = ready.poll();
            ordered.add(nodes.get(id));
            for (String next : downstream.getOrDefault(id, List.of())) {
                if (pending.merge(next, -1, Integer::sum) == 0) {
                    ready.add(next);
                }
            }
        }
        if (ordered.size() < nodes.size()) {
            List<String> remaining = new ArrayList<>();
            for (String id : nodes.keySet()) {
                if (pending.get(id) > 0) remaining.add(id);
            }
            throw new CyclicDependencyException(remaining);
        }
        return ordered;
    }

    private List<String> invocationsOf(StepTemplate template) {
        List<String> ids = new ArrayList<>();
        for (StepInvocation invocation : invocations.values()) {
            if (invocation.getTemplate() == template) ids.add(invocation.getId());
        }
        return ids;
    }

    private StepInvocation requireInvocation(String invocationId) {
        StepInvocation invocation = invocations.get(invocationId);
        if (invocation == null) {
            throw new IllegalArgumentException("No step invocation '" + invocationId + "' in pipeline '" + name + "'");
        }
        return invocation;
    }

    private ArtifactUploadContext requireUploadContext() {
        if (uploadContext == null) {
            throw new IllegalStateException("Pipeline build '" + name + "' has no artifact upload context for external artifacts");
        }
        return uploadContext;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Pipeline build '" + name + "' is closed");
        }
    }

    public static final class Builder {
        private final String name;
        private ArtifactUploadContext uploadContext;
        private MaterializerResolver materializerResolver;
        private CachingFingerprintCalculator fingerprintCalculator;

        private Builder(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Pipeline name must be non-blank");
            }
            this.name = name;
        }

        public Builder uploadContext(ArtifactUploadContext uploadContext) {
            this.uploadContext = uploadContext;
            return this;
        }

        /** Default: resolver over the upload context's registry (or the global one). */
        public Builder materializerResolver(MaterializerResolver materializerResolver) {
            this.materializerResolver = materializerResolver;
            return this;
        }

        /** Default: class-file hashing with the configured digest algorithm. */
        public Builder fingerprintCalculator(CachingFingerprintCalculator fingerprintCalculator) {
            this.fingerprintCalculator = fingerprintCalculator;
            return this;
        }

        /**
         * Opens the build and makes it the active one.
         *
         * @throws IllegalStateException if another build is active
         */
        public PipelineBuild begin() {
            PipelineBuild build = new PipelineBuild(this);
            if (!ACTIVE.compareAndSet(null, build)) {
                throw new IllegalStateException("Pipeline build '" + ACTIVE.get().getName()
                        + "' is still active; close it before starting '" + name + "'");
            }
            log.info("Pipeline build '{}' started", name);
            return build;
        }
    }
}
