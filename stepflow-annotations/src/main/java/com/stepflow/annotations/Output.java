package com.stepflow.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;

/**
 * Defines a single named output of a step. Used inside {@link Outputs#value()}.
 */
@Retention(RetentionPolicy.RUNTIME)
public @interface Output {

    /** Output name (e.g. "model", "score"). */
    String name();

    /** Declared type of the output. Ignored when {@link #oneOf()} is non-empty. */
    Class<?> type() default Object.class;

    /** Union members; {@code Void.class} stands for an explicit null member. */
    Class<?>[] oneOf() default {};
}
