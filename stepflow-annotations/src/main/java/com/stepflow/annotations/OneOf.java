package com.stepflow.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares a union type for an input (on the parameter) or for a single output (on the entrypoint).
 * Members are kept in declaration order; {@code Void.class} stands for an explicit null member.
 */
@Target({ElementType.PARAMETER, ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
public @interface OneOf {

    Class<?>[] value();
}
