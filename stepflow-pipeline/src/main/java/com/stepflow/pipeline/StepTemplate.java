package com.stepflow.pipeline;

import com.stepflow.annotations.Required;
import com.stepflow.annotations.Step;
import com.stepflow.artifacts.ArtifactMetadataStore;
import com.stepflow.artifacts.ExternalArtifact;
import com.stepflow.artifacts.StepArtifact;
import com.stepflow.caching.CachingFingerprintCalculator;
import com.stepflow.materializer.MaterializerResolver;
import com.stepflow.stepconfig.ArtifactConfiguration;
import com.stepflow.stepconfig.ConfigurationMerger;
import com.stepflow.stepconfig.PartialArtifactConfiguration;
import com.stepflow.stepconfig.PartialStepConfiguration;
import com.stepflow.stepconfig.SettingKeys;
import com.stepflow.stepconfig.Source;
import com.stepflow.stepconfig.StepConfiguration;
import com.stepflow.stepconfig.StepConfigurationUpdate;
import com.stepflow.stepinterface.DeclaredType;
import com.stepflow.stepinterface.InputDescriptor;
import com.stepflow.stepinterface.InputTypeChecker;
import com.stepflow.stepinterface.JsonValues;
import com.stepflow.stepinterface.ParameterSlot;
import com.stepflow.stepinterface.StepContext;
import com.stepflow.stepinterface.StepInterface;
import com.stepflow.stepinterface.StepInterfaceAnalyzer;
import com.stepflow.stepinterface.StepInterfaceException;
import com.stepflow.stepinterface.StepParameters;
import com.stepflow.stepinterface.StepflowException;
import com.stepflow.stepinterface.TypeCompatibility;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Named, reusable unit of computation: a step implementation object, its analysed interface and
 * its base configuration.
 * <p>
 * The interface is analysed once at creation. Afterwards the template changes only through
 * {@link #configure(StepConfigurationUpdate, boolean)} and {@link #after(StepTemplate)}.
 * Calling the template inside a {@link PipelineBuild} registers an invocation; {@link #run(Map)}
 * executes the entrypoint directly.
 */
public final class StepTemplate {

    private static final Logger log = LoggerFactory.getLogger(StepTemplate.class);

    private final Object implementation;
    private final StepInterface stepInterface;
    private final Set<StepTemplate> upstreamTemplates = new LinkedHashSet<>();
    private PartialStepConfiguration configuration;

    private StepTemplate(Builder b) {
        this.implementation = Objects.requireNonNull(b.implementation, "implementation");
        Class<?> stepClass = implementation.getClass();
        this.stepInterface = StepInterfaceAnalyzer.analyze(stepClass);

        Step step = stepClass.getAnnotation(Step.class);
        String name = b.name != null ? b.name : defaultName(stepClass, step);
        Boolean enableCache = b.enableCache != null ? b.enableCache : (step != null ? step.enableCache().toBoolean() : null);
        Boolean enableArtifactMetadata = b.enableArtifactMetadata != null ? b.enableArtifactMetadata
                : (step != null ? step.enableArtifactMetadata().toBoolean() : null);
        Boolean enableArtifactVisualization = b.enableArtifactVisualization != null ? b.enableArtifactVisualization
                : (step != null ? step.enableArtifactVisualization().toBoolean() : null);

        if (enableCache == null && stepInterface.hasContext()) {
            log.debug("Step '{}': Step context required and caching not explicitly enabled. Disabling caching.", name);
            enableCache = Boolean.FALSE;
        }
        log.debug("Step '{}': Caching {}.", name, Boolean.FALSE.equals(enableCache) ? "disabled" : "enabled");
        log.debug("Step '{}': Artifact metadata {}.", name, Boolean.FALSE.equals(enableArtifactMetadata) ? "disabled" : "enabled");
        log.debug("Step '{}': Artifact visualization {}.", name,
                Boolean.FALSE.equals(enableArtifactVisualization) ? "disabled" : "enabled");

        this.configuration = PartialStepConfiguration.builder(name)
                .enableCache(enableCache)
                .enableArtifactMetadata(enableArtifactMetadata)
                .enableArtifactVisualization(enableArtifactVisualization)
                .build();
        if (b.parameters != null) {
            configure(StepConfigurationUpdate.builder().parameters(parametersToMap(b.parameters)).build());
        }
        if (b.update != null) {
            configure(b.update);
        }
    }

    public static StepTemplate of(Object implementation) {
        return builder(implementation).build();
    }

    public static Builder builder(Object implementation) {
        return new Builder(implementation);
    }

    public String getName() {
        return configuration.getName();
    }

    public Object getImplementation() {
        return implementation;
    }

    public StepInterface getInterface() {
        return stepInterface;
    }

    /** Current base configuration; invocations start from a copy of it. */
    public PartialStepConfiguration getConfiguration() {
        return configuration;
    }

    /** Templates this one must run after (ordering hints). */
    public Set<StepTemplate> getUpstreamTemplates() {
        return Collections.unmodifiableSet(upstreamTemplates);
    }

    /** Deep-merges the update into the base configuration. */
    public StepTemplate configure(StepConfigurationUpdate update) {
        return configure(update, true);
    }

    /**
     * Validates the update and merges it into the base configuration.
     *
     * @param merge deep merge when true; otherwise every field set in the update replaces the base field
     * @throws com.stepflow.stepconfig.UnknownSettingException for an unknown setting key
     * @throws StepInterfaceException                          for parameters, outputs or hooks that do not fit the step
     */
    public StepTemplate configure(StepConfigurationUpdate update, boolean merge) {
        Objects.requireNonNull(update, "update");
        StepConfigurationUpdate expanded = expandAllOutputsMaterializers(update);
        validateConfiguration(expanded);
        configuration = ConfigurationMerger.merge(configuration, expanded, merge);
        return this;
    }

    /**
     * Orders this step after every invocation of {@code upstream} in the same pipeline. Only valid
     * when both templates are called once per pipeline; checked when the graph is finalized.
     */
    public StepTemplate after(StepTemplate upstream) {
        Objects.requireNonNull(upstream, "upstream");
        if (upstream == this) {
            throw new IllegalArgumentException("Step '" + getName() + "' cannot run after itself");
        }
        upstreamTemplates.add(upstream);
        return this;
    }

    /**
     * Calls the step: registers an invocation when a pipeline build is active, otherwise runs the
     * entrypoint and returns its result.
     */
    public Object invoke(Map<String, Object> arguments) {
        Optional<PipelineBuild> active = PipelineBuild.active();
        if (active.isPresent()) {
            return call(active.get(), arguments);
        }
        return run(arguments);
    }

    /**
     * Runs the entrypoint directly with validated arguments. Inputs not passed fall back to
     * configured parameters; the parameters object is built from configured parameters unless
     * one is passed under its argument name.
     *
     * @return the entrypoint result ({@code null} for void entrypoints)
     */
    public Object run(Map<String, Object> arguments) {
        Map<String, Object> args = arguments != null ? arguments : Map.of();
        for (String key : args.keySet()) {
            if (!stepInterface.isBindable(key)) {
                throw new StepInterfaceException("Unknown argument '" + key + "' for step '" + getName()
                        + "'. Valid inputs: " + stepInterface.getInputs().keySet());
            }
        }
        Object[] values = new Object[stepInterface.getParameterCount()];
        for (InputDescriptor input : stepInterface.getInputs().values()) {
            values[input.position()] = inputValue(input, args);
        }
        stepInterface.getContext().ifPresent(slot -> values[slot.position()] = newContext(slot));
        stepInterface.getLegacyParameter().ifPresent(slot -> values[slot.position()] = parametersObject(slot, args.get(slot.name())));

        log.debug("Running step '{}' outside of a pipeline build", getName());
        Method entrypoint = stepInterface.getEntrypoint();
        entrypoint.trySetAccessible();
        try {
            return entrypoint.invoke(implementation, values);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw new StepflowException("Step '" + getName() + "' failed", cause);
        } catch (IllegalAccessException e) {
            throw new StepflowException("Cannot invoke entrypoint of step '" + getName() + "'", e);
        }
    }

    public InvocationOutputs call(PipelineBuild build, Map<String, Object> arguments) {
        return call(build, arguments, null, List.of());
    }

    /**
     * Registers an invocation of this step in the build.
     * <p>
     * Arguments are split by value: {@link StepArtifact}s wire the input to an upstream output,
     * {@link ExternalArtifact}s are uploaded or verified at finalization and every other value
     * becomes a parameter.
     *
     * @param id    invocation id; null or blank derives it from the step name and suffixes it when taken
     * @param after ids of already registered invocations this one must run after
     * @return one artifact reference per declared output
     */
    public InvocationOutputs call(PipelineBuild build, Map<String, Object> arguments, String id, Collection<String> after) {
        Objects.requireNonNull(build, "build");
        Map<String, StepArtifact> artifacts = new LinkedHashMap<>();
        Map<String, ExternalArtifact> externalArtifacts = new LinkedHashMap<>();
        Map<String, Object> parameters = new LinkedHashMap<>();
        if (arguments != null) {
            for (Map.Entry<String, Object> e : arguments.entrySet()) {
                String key = e.getKey();
                Object value = e.getValue();
                InputDescriptor input = stepInterface.getInputs().get(key);
                if (input == null) {
                    throw new StepInterfaceException("Unknown input '" + key + "' for step '" + getName()
                            + "'. Valid inputs: " + stepInterface.getInputs().keySet());
                }
                if (value instanceof StepArtifact) {
                    StepArtifact artifact = (StepArtifact) value;
                    checkArtifactType(input, artifact.declaredType());
                    warnIfConfiguredAsParameter(key);
                    artifacts.put(key, artifact);
                } else if (value instanceof ExternalArtifact) {
                    ExternalArtifact external = (ExternalArtifact) value;
                    checkArtifactType(input, external.type(metadataStoreFor(build, external)));
                    warnIfConfiguredAsParameter(key);
                    if (external.isValue() && build.getConfig().isWarnExternalArtifactCaching()) {
                        log.warn("External artifact passed by value to input '{}' of step '{}'. The value is uploaded on "
                                + "every pipeline run, so this step is never served from cache. Upload it once and pass "
                                + "ExternalArtifact.ofId(...) to keep caching.", key, getName());
                    }
                    externalArtifacts.put(key, external);
                } else {
                    validateParameterValue(input, value);
                    parameters.put(key, value);
                }
            }
        }
        Set<String> explicitUpstream = after != null ? new LinkedHashSet<>(after) : Set.of();
        String invocationId = build.addInvocation(this, artifacts, externalArtifacts, parameters, explicitUpstream, id, id == null || id.isBlank());

        Map<String, StepArtifact> outputs = new LinkedHashMap<>();
        stepInterface.getOutputs().forEach((name, type) -> outputs.put(name, new StepArtifact(invocationId, name, type)));
        return new InvocationOutputs(invocationId, outputs);
    }

    /**
     * Builds the finalized configuration of one invocation from {@code base} (the template
     * configuration with invocation parameters applied). The template itself is not changed.
     *
     * @param artifactInputs    inputs bound to in-graph or external artifacts
     * @param externalArtifacts resolved ids of external artifacts by input name
     */
    StepConfiguration finalizeConfiguration(
            PartialStepConfiguration base,
            Set<String> artifactInputs,
            Map<String, UUID> externalArtifacts,
            MaterializerResolver materializerResolver,
            CachingFingerprintCalculator fingerprintCalculator) {
        String name = base.getName();
        Map<String, ArtifactConfiguration> outputs = new LinkedHashMap<>();
        Map<String, List<Source>> materializers = new LinkedHashMap<>();
        for (Map.Entry<String, DeclaredType> output : stepInterface.getOutputs().entrySet()) {
            PartialArtifactConfiguration configured = base.getOutputs().get(output.getKey());
            List<Source> sources = materializerResolver.resolve(name, output.getKey(), output.getValue(),
                    configured != null ? configured.getMaterializerSource() : null);
            materializers.put(output.getKey(), sources);
            outputs.put(output.getKey(), new ArtifactConfiguration(sources));
        }

        Map<String, Object> parameters = finalizeParameters(base.getParameters(), artifactInputs);
        for (InputDescriptor input : stepInterface.getInputs().values()) {
            if (!artifactInputs.contains(input.name()) && !parameters.containsKey(input.name())
                    && input.javaType() != Optional.class) {
                throw new MissingInputException(name, input.name());
            }
        }

        PartialStepConfiguration partial = base.toBuilder()
                .parameters(parameters)
                .cachingParameters(fingerprintCalculator.compute(stepInterface.getStepClass(), materializers))
                .externalInputArtifacts(externalArtifacts)
                .build();
        StepConfiguration finalized = StepConfiguration.from(partial, outputs);
        log.debug("Finalized configuration of step '{}': {}", name, finalized);
        return finalized;
    }

    private Map<String, Object> finalizeParameters(Map<String, Object> configured, Set<String> artifactInputs) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : configured.entrySet()) {
            if (stepInterface.getInputs().containsKey(e.getKey()) && !artifactInputs.contains(e.getKey())) {
                out.put(e.getKey(), JsonValues.toJsonValue(e.getValue()));
            }
        }
        stepInterface.getLegacyParameter().ifPresent(slot -> out.put(slot.name(), finalizeLegacyParameters(slot, configured)));
        return out;
    }

    /**
     * Assembles the values of the parameters object: a flat configured key first, then the map
     * configured under the parameter name, then the class default.
     */
    private Map<String, Object> finalizeLegacyParameters(ParameterSlot slot, Map<String, Object> configured) {
        Class<?> type = slot.type();
        Map<String, Object> defaults = defaultValues(type);
        Object nested = configured.get(slot.name());
        Map<?, ?> nestedValues = nested instanceof Map ? (Map<?, ?>) nested : Map.of();

        Map<String, Object> values = new LinkedHashMap<>();
        List<String> missing = new ArrayList<>();
        for (Map.Entry<String, Object> property : defaults.entrySet()) {
            String key = property.getKey();
            if (configured.containsKey(key) && !key.equals(slot.name())) {
                values.put(key, configured.get(key));
            } else if (nestedValues.containsKey(key)) {
                values.put(key, nestedValues.get(key));
            } else if (isRequired(type, key)) {
                missing.add(key);
            } else {
                values.put(key, property.getValue());
            }
        }
        if (!missing.isEmpty()) {
            throw new MissingStepParameterException(getName(), missing, type);
        }
        try {
            JsonValues.convert(values, type);
        } catch (StepInterfaceException e) {
            throw new StepInterfaceException("Failed to validate parameters of step '" + getName() + "' against "
                    + type.getSimpleName() + ": " + e.getMessage(), e);
        }
        return values;
    }

    private Map<String, Object> defaultValues(Class<?> type) {
        Object instance;
        try {
            instance = JsonValues.convert(Map.of(), type);
        } catch (StepInterfaceException e) {
            throw new StepInterfaceException("Parameters class " + type.getName() + " of step '" + getName()
                    + "' needs a no-argument constructor", e);
        }
        return asMap(JsonValues.toJsonValue(instance));
    }

    private static boolean isRequired(Class<?> type, String property) {
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
            for (Field field : c.getDeclaredFields()) {
                if (field.getName().equals(property)) {
                    return field.isAnnotationPresent(Required.class);
                }
            }
        }
        return false;
    }

    private Object inputValue(InputDescriptor input, Map<String, Object> args) {
        boolean optional = input.javaType() == Optional.class;
        Object value;
        if (args.containsKey(input.name())) {
            value = args.get(input.name());
        } else if (configuration.getParameters().containsKey(input.name())) {
            value = configuration.getParameters().get(input.name());
        } else if (optional) {
            return Optional.empty();
        } else {
            throw new MissingInputException(getName(), input.name());
        }
        if (value instanceof StepArtifact || value instanceof ExternalArtifact) {
            throw new StepInterfaceException("Artifact passed to input '" + input.name() + "' of step '" + getName()
                    + "' outside of a pipeline build");
        }
        if (optional && value instanceof Optional) {
            return value;
        }
        InputTypeChecker.validateInput(getName(), input.name(), input.type(), value);
        if (optional) {
            DeclaredType present = input.type().members().get(0);
            return Optional.ofNullable(value == null ? null : InputTypeChecker.coerce(present.javaType(), value));
        }
        return InputTypeChecker.coerce(input.javaType(), value);
    }

    private StepContext newContext(ParameterSlot slot) {
        if (!slot.type().isAssignableFrom(StepContext.class)) {
            throw new StepInterfaceException("Cannot create context of type " + slot.type().getName()
                    + " for step '" + getName() + "'");
        }
        return new StepContext(getName(), null, stepInterface.getOutputs());
    }

    private Object parametersObject(ParameterSlot slot, Object passed) {
        if (slot.type().isInstance(passed)) {
            return passed;
        }
        if (passed != null && !(passed instanceof Map)) {
            throw new StepInterfaceException("Expected " + slot.type().getSimpleName() + " for argument '" + slot.name()
                    + "' of step '" + getName() + "', got " + passed.getClass().getName());
        }
        Map<String, Object> configured = new LinkedHashMap<>(configuration.getParameters());
        if (passed != null) {
            configured.put(slot.name(), passed);
        }
        return JsonValues.convert(finalizeLegacyParameters(slot, configured), slot.type());
    }

    private Map<String, Object> parametersToMap(StepParameters parameters) {
        ParameterSlot slot = stepInterface.getLegacyParameter().orElseThrow(() -> new StepInterfaceException(
                "Step '" + getName() + "' has no parameters argument, cannot set " + parameters.getClass().getSimpleName()));
        if (!slot.type().isInstance(parameters)) {
            throw new StepInterfaceException("Expected " + slot.type().getSimpleName() + " as parameters of step '"
                    + getName() + "', got " + parameters.getClass().getName());
        }
        return asMap(JsonValues.toJsonValue(parameters));
    }

    private StepConfigurationUpdate expandAllOutputsMaterializers(StepConfigurationUpdate update) {
        List<Source> all = update.getAllOutputsMaterializerSource();
        if (all == null) {
            return update;
        }
        Map<String, PartialArtifactConfiguration> outputs = new LinkedHashMap<>();
        for (String outputName : stepInterface.getOutputs().keySet()) {
            outputs.put(outputName, PartialArtifactConfiguration.of(all));
        }
        if (update.getOutputs() != null) {
            outputs.putAll(update.getOutputs());
        }
        return update.withOutputs(outputs);
    }

    private void validateConfiguration(StepConfigurationUpdate update) {
        if (update.getSettings() != null) {
            SettingKeys.validate(update.getSettings().keySet());
        }
        if (update.getParameters() != null) {
            validateFunctionParameters(update.getParameters());
        }
        if (update.getOutputs() != null) {
            validateOutputs(update.getOutputs());
        }
        if (update.getFailureHookSource() != null) {
            HookValidator.validate(update.getFailureHookSource(), StepFailureHook.class);
        }
        if (update.getSuccessHookSource() != null) {
            HookValidator.validate(update.getSuccessHookSource(), StepSuccessHook.class);
        }
    }

    private void validateFunctionParameters(Map<String, Object> parameters) {
        for (Map.Entry<String, Object> e : parameters.entrySet()) {
            InputDescriptor input = stepInterface.getInputs().get(e.getKey());
            if (input != null) {
                validateParameterValue(input, e.getValue());
            } else if (stepInterface.getLegacyParameter().isEmpty()) {
                throw new StepInterfaceException("Unable to set parameter '" + e.getKey() + "' for step '" + getName()
                        + "': it is not an entrypoint input and the step has no parameters class.");
            }
        }
    }

    private void validateParameterValue(InputDescriptor input, Object value) {
        InputTypeChecker.validateInput(getName(), input.name(), input.type(), value);
        if (!JsonValues.isJsonSerializable(value)) {
            throw new StepInterfaceException("Argument type (" + value.getClass().getName() + ") for argument '"
                    + input.name() + "' of step '" + getName() + "' is not JSON serializable.");
        }
    }

    private void validateOutputs(Map<String, PartialArtifactConfiguration> outputs) {
        for (Map.Entry<String, PartialArtifactConfiguration> e : outputs.entrySet()) {
            String outputName = e.getKey();
            if (!stepInterface.getOutputs().containsKey(outputName)) {
                throw new StepInterfaceException("Got materializers for non-existent output '" + outputName
                        + "' of step '" + getName() + "'. Outputs of this step: " + stepInterface.getOutputs().keySet());
            }
            List<Source> sources = e.getValue().getMaterializerSource();
            if (sources != null) {
                for (Source source : sources) {
                    MaterializerResolver.loadMaterializerClass(source, "output '" + outputName + "' of step '" + getName() + "'");
                }
            }
        }
    }

    private void checkArtifactType(InputDescriptor input, DeclaredType artifactType) {
        if (!TypeCompatibility.isAssignable(input.type(), artifactType)) {
            throw new StepInterfaceException("Wrong artifact type for input '" + input.name() + "' of step '" + getName()
                    + "': expected " + input.type().describe() + ", got " + artifactType.describe());
        }
    }

    private void warnIfConfiguredAsParameter(String key) {
        if (configuration.getParameters().containsKey(key)) {
            log.warn("Step '{}': input '{}' is passed as an artifact and also configured as a parameter. "
                    + "The artifact is used and the parameter ignored.", getName(), key);
        }
    }

    private static ArtifactMetadataStore metadataStoreFor(PipelineBuild build, ExternalArtifact external) {
        if (build.getUploadContext() != null) {
            return build.getUploadContext().getMetadataStore();
        }
        if (!external.isValue() && !external.isSkipTypeChecking()) {
            throw new IllegalStateException("Pipeline build '" + build.getName()
                    + "' has no artifact upload context; external artifacts cannot be referenced by id.");
        }
        return null;
    }

    private static String defaultName(Class<?> stepClass, Step step) {
        if (step != null && !step.name().isBlank()) return step.name();
        return stepClass.getSimpleName().isEmpty() ? stepClass.getName() : stepClass.getSimpleName();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object jsonValue) {
        if (jsonValue instanceof Map) {
            return (Map<String, Object>) jsonValue;
        }
        return Map.of();
    }

    @Override
    public String toString() {
        return "StepTemplate{name=" + getName() + ", class=" + implementation.getClass().getName() + "}";
    }

    public static final class Builder {
        private final Object implementation;
        private String name;
        private Boolean enableCache;
        private Boolean enableArtifactMetadata;
        private Boolean enableArtifactVisualization;
        private StepParameters parameters;
        private StepConfigurationUpdate update;

        private Builder(Object implementation) {
            this.implementation = implementation;
        }

        /** Overrides the {@link Step#name()} / class-name default. */
        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder enableCache(Boolean enableCache) {
            this.enableCache = enableCache;
            return this;
        }

        public Builder enableArtifactMetadata(Boolean enableArtifactMetadata) {
            this.enableArtifactMetadata = enableArtifactMetadata;
            return this;
        }

        public Builder enableArtifactVisualization(Boolean enableArtifactVisualization) {
            this.enableArtifactVisualization = enableArtifactVisualization;
            return this;
        }

        /** Initialized parameters object; its values become configured parameters under its argument name. */
        public Builder parameters(StepParameters parameters) {
            this.parameters = parameters;
            return this;
        }

        /** Applied with a deep merge after the annotation defaults. */
        public Builder configure(StepConfigurationUpdate update) {
            this.update = update;
            return this;
        }

        public StepTemplate build() {
            return new StepTemplate(this);
        }
    }
}
