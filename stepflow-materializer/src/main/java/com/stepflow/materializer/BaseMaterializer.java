package com.stepflow.materializer;

import com.stepflow.annotations.Materializes;
import com.stepflow.stepinterface.StepflowException;

import java.io.IOException;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.List;
import java.util.Objects;

/**
 * Type-specific serialization strategy for artifacts. A materializer instance is bound to one
 * artifact location ({@code uri}). Subclasses declare the data types they handle with
 * {@link Materializes} and need a public constructor taking the uri.
 */
public abstract class BaseMaterializer {

    private final String uri;

    protected BaseMaterializer(String uri) {
        this.uri = Objects.requireNonNull(uri, "uri");
    }

    public String getUri() {
        return uri;
    }

    /** Reads the artifact stored at {@link #getUri()}. */
    public abstract Object load(Class<?> dataType) throws IOException;

    /** Writes {@code data} to {@link #getUri()}. The location directory already exists. */
    public abstract void save(Object data) throws IOException;

    /** Data types from {@link Materializes}; empty when the class is not annotated. */
    public static List<Class<?>> associatedTypes(Class<? extends BaseMaterializer> type) {
        Materializes ann = type.getAnnotation(Materializes.class);
        return ann != null ? List.of(ann.types()) : List.of();
    }

    /** Artifact type recorded for values persisted by the materializer. Default {@code DATA}. */
    public static String artifactType(Class<? extends BaseMaterializer> type) {
        Materializes ann = type.getAnnotation(Materializes.class);
        return ann != null ? ann.artifactType() : "DATA";
    }

    /**
     * Creates a materializer bound to {@code uri}.
     *
     * @throws StepflowException if the class has no accessible {@code (String)} constructor
     */
    public static BaseMaterializer create(Class<? extends BaseMaterializer> type, String uri) {
        try {
            Constructor<? extends BaseMaterializer> ctor = type.getDeclaredConstructor(String.class);
            ctor.setAccessible(true);
            return ctor.newInstance(uri);
        } catch (NoSuchMethodException | InstantiationException | IllegalAccessException e) {
            throw new StepflowException("Materializer " + type.getName() + " needs a constructor taking the artifact uri", e);
        } catch (InvocationTargetException e) {
            throw new StepflowException("Materializer " + type.getName() + " failed to initialize", e.getCause());
        }
    }
}
