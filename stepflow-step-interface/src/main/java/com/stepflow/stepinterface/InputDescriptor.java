package com.stepflow.stepinterface;

import java.util.Objects;

/**
 * A step input: name from {@link com.stepflow.annotations.Input}, declared type, the Java type of
 * the entrypoint parameter and its position in the parameter list.
 */
public record InputDescriptor(String name, DeclaredType type, Class<?> javaType, int position) {
    public InputDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(javaType, "javaType");
    }
}
