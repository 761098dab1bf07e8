package com.stepflow.stepconfig;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.stepflow.stepinterface.StepflowException;

import java.util.Objects;

/**
 * Loadable identifier of a class (materializer, hook, data type): its fully qualified binary name.
 * Serialized as a plain JSON string.
 */
public record Source(String path) {

    public Source {
        Objects.requireNonNull(path, "path");
        if (path.isBlank()) {
            throw new IllegalArgumentException("Source path must be non-blank");
        }
    }

    public static Source fromClass(Class<?> type) {
        return new Source(Objects.requireNonNull(type, "type").getName());
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Source fromImportPath(String path) {
        return new Source(path.trim());
    }

    @JsonValue
    @Override
    public String path() {
        return path;
    }

    /**
     * Loads the class this source points to.
     *
     * @throws StepflowException if the class cannot be found or initialized
     */
    public Class<?> load() {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) loader = Source.class.getClassLoader();
        try {
            return Class.forName(path, true, loader);
        } catch (ClassNotFoundException | LinkageError e) {
            throw new StepflowException("Unable to load source '" + path + "'", e);
        }
    }

    /** Whether this source loads and is a subclass of {@code expected}. Never throws. */
    public boolean isSubclassOf(Class<?> expected) {
        try {
            return expected.isAssignableFrom(load());
        } catch (StepflowException e) {
            return false;
        }
    }

    @Override
    public String toString() {
        return path;
    }
}
