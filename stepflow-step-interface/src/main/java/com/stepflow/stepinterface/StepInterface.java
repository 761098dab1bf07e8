package com.stepflow.stepinterface;

import java.lang.reflect.Method;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed interface of a step: inputs, outputs, optional context parameter and optional step
 * parameters object. Derived once per step class by {@link StepInterfaceAnalyzer}; immutable.
 */
public final class StepInterface {

    /** Output name used when the entrypoint returns a single value. */
    public static final String SINGLE_OUTPUT_NAME = "output";

    private final Class<?> stepClass;
    private final Method entrypoint;
    private final Map<String, InputDescriptor> inputs;
    private final Map<String, DeclaredType> outputs;
    private final ParameterSlot context;
    private final ParameterSlot legacyParameter;

    StepInterface(Class<?> stepClass,
                  Method entrypoint,
                  Map<String, InputDescriptor> inputs,
                  Map<String, DeclaredType> outputs,
                  ParameterSlot context,
                  ParameterSlot legacyParameter) {
        this.stepClass = Objects.requireNonNull(stepClass, "stepClass");
        this.entrypoint = Objects.requireNonNull(entrypoint, "entrypoint");
        this.inputs = Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
        this.outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        this.context = context;
        this.legacyParameter = legacyParameter;
    }

    public Class<?> getStepClass() {
        return stepClass;
    }

    public Method getEntrypoint() {
        return entrypoint;
    }

    /** Inputs by name, in parameter order. */
    public Map<String, InputDescriptor> getInputs() {
        return inputs;
    }

    /** Declared output types by name, in declaration order. */
    public Map<String, DeclaredType> getOutputs() {
        return outputs;
    }

    public Optional<ParameterSlot> getContext() {
        return Optional.ofNullable(context);
    }

    public boolean hasContext() {
        return context != null;
    }

    /** The step parameters object parameter, if the entrypoint declares one. */
    public Optional<ParameterSlot> getLegacyParameter() {
        return Optional.ofNullable(legacyParameter);
    }

    public int getParameterCount() {
        return entrypoint.getParameterCount();
    }

    /** Input names plus the step parameters object name: the keys a step call may bind. */
    public boolean isBindable(String name) {
        return inputs.containsKey(name)
                || (legacyParameter != null && legacyParameter.name().equals(name));
    }

    @Override
    public String toString() {
        return "StepInterface{" + stepClass.getName()
                + ", inputs=" + inputs.keySet()
                + ", outputs=" + outputs.keySet()
                + ", context=" + (context != null)
                + ", parameters=" + (legacyParameter != null ? legacyParameter.type().getSimpleName() : "none")
                + "}";
    }
}
