package com.stepflow.stepinterface;

import com.stepflow.annotations.Entrypoint;
import com.stepflow.annotations.Input;
import com.stepflow.annotations.OneOf;
import com.stepflow.annotations.Output;
import com.stepflow.annotations.Outputs;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Derives the {@link StepInterface} of a step class from its single {@link Entrypoint} method.
 * Pure function of the class metadata; fails with {@link StepInterfaceException} and never
 * returns a partial interface.
 */
public final class StepInterfaceAnalyzer {

    private StepInterfaceAnalyzer() {
    }

    public static StepInterface analyze(Class<?> stepClass) {
        Objects.requireNonNull(stepClass, "stepClass");
        Method entrypoint = findEntrypoint(stepClass);
        String where = stepClass.getName() + "." + entrypoint.getName();
        if (entrypoint.isVarArgs()) {
            throw new StepInterfaceException(
                    "Unable to use variadic arguments in step entrypoint " + where + ": declare every input explicitly.");
        }

        Map<String, InputDescriptor> inputs = new LinkedHashMap<>();
        ParameterSlot context = null;
        ParameterSlot legacyParameter = null;
        Parameter[] parameters = entrypoint.getParameters();
        for (int i = 0; i < parameters.length; i++) {
            Parameter parameter = parameters[i];
            Class<?> type = parameter.getType();
            Input input = parameter.getAnnotation(Input.class);
            if (StepContext.class.isAssignableFrom(type)) {
                if (context != null) {
                    throw new StepInterfaceException("Found multiple context parameters in step entrypoint " + where
                            + " (" + context.name() + ", " + slotName(parameter, input) + "). Only one is allowed.");
                }
                context = new ParameterSlot(slotName(parameter, input), type, i);
            } else if (StepParameters.class.isAssignableFrom(type)) {
                if (legacyParameter != null) {
                    throw new StepInterfaceException("Found multiple parameter objects in step entrypoint " + where
                            + " (" + legacyParameter.name() + ", " + slotName(parameter, input) + "). Only one is allowed.");
                }
                legacyParameter = new ParameterSlot(slotName(parameter, input), type, i);
            } else {
                if (input == null) {
                    throw new StepInterfaceException("Missing @Input annotation for parameter " + i + " ("
                            + parameter.getName() + ") of step entrypoint " + where + ".");
                }
                String name = input.value();
                if (name == null || name.isBlank()) {
                    throw new StepInterfaceException("@Input name must be non-blank for parameter " + i + " of " + where);
                }
                if (inputs.containsKey(name)) {
                    throw new StepInterfaceException("Duplicate input name '" + name + "' in step entrypoint " + where);
                }
                DeclaredType declared = inputType(parameter, where);
                inputs.put(name, new InputDescriptor(name, declared, type, i));
            }
        }
        if (legacyParameter != null && inputs.containsKey(legacyParameter.name())) {
            throw new StepInterfaceException("Input name '" + legacyParameter.name()
                    + "' clashes with the parameter object of step entrypoint " + where);
        }

        Map<String, DeclaredType> outputs = parseOutputs(entrypoint, where);
        return new StepInterface(stepClass, entrypoint, inputs, outputs, context, legacyParameter);
    }

    private static Method findEntrypoint(Class<?> stepClass) {
        List<Method> candidates = Arrays.stream(stepClass.getMethods())
                .filter(m -> m.isAnnotationPresent(Entrypoint.class))
                .filter(m -> !m.isBridge() && !m.isSynthetic())
                .collect(Collectors.toList());
        if (candidates.isEmpty()) {
            throw new StepInterfaceException("Step class " + stepClass.getName()
                    + " must declare one public method annotated with @Entrypoint.");
        }
        if (candidates.size() > 1) {
            String names = candidates.stream().map(Method::getName).sorted().collect(Collectors.joining(", "));
            throw new StepInterfaceException("Step class " + stepClass.getName()
                    + " declares multiple @Entrypoint methods: " + names);
        }
        Method method = candidates.get(0);
        if (Modifier.isStatic(method.getModifiers())) {
            throw new StepInterfaceException("@Entrypoint method must not be static: " + stepClass.getName() + "." + method.getName());
        }
        return method;
    }

    private static String slotName(Parameter parameter, Input input) {
        return input != null && !input.value().isBlank() ? input.value() : parameter.getName();
    }

    private static DeclaredType inputType(Parameter parameter, String where) {
        OneOf oneOf = parameter.getAnnotation(OneOf.class);
        if (oneOf == null) {
            return DeclaredType.of(parameter.getParameterizedType());
        }
        checkUnionMembers(parameter.getType(), oneOf.value(), "parameter " + parameter.getName() + " of " + where);
        return DeclaredType.unionOf(oneOf.value());
    }

    private static Map<String, DeclaredType> parseOutputs(Method entrypoint, String where) {
        Class<?> returnType = entrypoint.getReturnType();
        Outputs outputs = entrypoint.getAnnotation(Outputs.class);
        Map<String, DeclaredType> result = new LinkedHashMap<>();
        if (returnType == void.class || returnType == Void.class) {
            if (outputs != null) {
                throw new StepInterfaceException("@Outputs declared on step entrypoint " + where + " which returns nothing.");
            }
            return result;
        }
        if (StepOutputs.class.isAssignableFrom(returnType)) {
            if (outputs == null || outputs.value().length == 0) {
                throw new StepInterfaceException("Missing return annotation: step entrypoint " + where
                        + " returns StepOutputs and must declare its outputs with @Outputs.");
            }
            for (Output output : outputs.value()) {
                if (output.name().isBlank()) {
                    throw new StepInterfaceException("@Output name must be non-blank in " + where);
                }
                if (result.containsKey(output.name())) {
                    throw new StepInterfaceException("Duplicate output name '" + output.name() + "' in " + where);
                }
                DeclaredType type = output.oneOf().length > 0
                        ? DeclaredType.unionOf(output.oneOf())
                        : DeclaredType.ofClass(output.type());
                result.put(output.name(), type);
            }
            return result;
        }
        if (outputs != null) {
            throw new StepInterfaceException("@Outputs requires step entrypoint " + where + " to return StepOutputs, found "
                    + returnType.getName());
        }
        OneOf oneOf = entrypoint.getAnnotation(OneOf.class);
        DeclaredType type;
        if (oneOf != null) {
            checkUnionMembers(returnType, oneOf.value(), "return type of " + where);
            type = DeclaredType.unionOf(oneOf.value());
        } else {
            type = DeclaredType.of(entrypoint.getGenericReturnType());
        }
        result.put(StepInterface.SINGLE_OUTPUT_NAME, type);
        return result;
    }

    private static void checkUnionMembers(Class<?> javaType, Class<?>[] members, String what) {
        if (members.length == 0) {
            throw new StepInterfaceException("@OneOf must list at least one type for " + what);
        }
        List<String> incompatible = new ArrayList<>();
        for (Class<?> member : members) {
            if (member == Void.class || member == void.class) {
                if (javaType.isPrimitive()) incompatible.add("None");
            } else if (!boxed(javaType).isAssignableFrom(boxed(member))) {
                incompatible.add(member.getName());
            }
        }
        if (!incompatible.isEmpty()) {
            throw new StepInterfaceException("@OneOf members " + incompatible + " are not assignable to "
                    + javaType.getName() + " for " + what);
        }
    }

    static Class<?> boxed(Class<?> type) {
        if (!type.isPrimitive()) return type;
        return ScalarKind.forClass(type).<Class<?>>map(ScalarKind::boxedType).orElse(type);
    }
}
