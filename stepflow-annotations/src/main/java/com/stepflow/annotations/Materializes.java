package com.stepflow.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a materializer class with the data types it can persist. Registering the class with the
 * materializer registry makes it the default materializer for each listed type.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface Materializes {

    /** Data types handled by the materializer (subtypes resolve to the closest registered type). */
    Class<?>[] types();

    /** Artifact type recorded for persisted values (e.g. DATA, MODEL, STATISTICS). */
    String artifactType() default "DATA";
}
