package com.stepflow.stepinterface;

import java.util.Objects;

/**
 * The context parameter or the step parameters object of an entrypoint.
 */
public record ParameterSlot(String name, Class<?> type, int position) {
    public ParameterSlot {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }
}
