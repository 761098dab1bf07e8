package com.stepflow.stepinterface;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Return value of an entrypoint with several named outputs (declared with
 * {@link com.stepflow.annotations.Outputs}). Keeps insertion order.
 */
public final class StepOutputs {

    private final Map<String, Object> values;

    private StepOutputs(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static StepOutputs of(String name, Object value) {
        return builder().put(name, value).build();
    }

    public static StepOutputs of(String name1, Object value1, String name2, Object value2) {
        return builder().put(name1, value1).put(name2, value2).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Object get(String name) {
        return values.get(name);
    }

    public Set<String> names() {
        return values.keySet();
    }

    /** Values by output name (unmodifiable; may contain null values). */
    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "StepOutputs" + values;
    }

    public static final class Builder {
        private final Map<String, Object> values = new LinkedHashMap<>();

        public Builder put(String name, Object value) {
            Objects.requireNonNull(name, "name");
            if (values.containsKey(name)) {
                throw new IllegalArgumentException("Duplicate output name: " + name);
            }
            values.put(name, value);
            return this;
        }

        public StepOutputs build() {
            return new StepOutputs(values);
        }
    }
}
