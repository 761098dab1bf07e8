package com.stepflow.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares an entrypoint parameter as a step input. Required on every parameter that is neither
 * the step context nor the step parameters object.
 */
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
public @interface Input {

    /** Input name (key used when calling the step and in configured parameters). */
    String value();
}
