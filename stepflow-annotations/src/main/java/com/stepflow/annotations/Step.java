package com.stepflow.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class as a step implementation. The class must declare exactly one public method
 * annotated with {@link Entrypoint}; a step template reads this annotation once when it is created.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface Step {

    /** Step name (used as the base invocation id). Empty = simple class name. */
    String name() default "";

    /** Whether outputs of this step may be served from cache. UNSET = decided at template creation. */
    Flag enableCache() default Flag.UNSET;

    /** Whether artifact metadata is collected for outputs of this step. */
    Flag enableArtifactMetadata() default Flag.UNSET;

    /** Whether artifact visualizations are generated for outputs of this step. */
    Flag enableArtifactVisualization() default Flag.UNSET;
}
