package com.stepflow.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the named outputs of an entrypoint that returns several values.
 * Only valid on entrypoints returning {@code StepOutputs}.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Outputs {

    Output[] value();
}
