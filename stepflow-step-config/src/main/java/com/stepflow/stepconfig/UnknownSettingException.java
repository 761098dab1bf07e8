package com.stepflow.stepconfig;

import com.stepflow.stepinterface.StepflowException;

/**
 * Thrown when a settings key is neither a general key nor a {@code <componentType>.<flavor>} key.
 */
public class UnknownSettingException extends StepflowException {

    private final String key;

    public UnknownSettingException(String key) {
        super("Invalid setting key '" + key + "'. Setting keys must be a general key or of the form "
                + "'<component_type>.<flavor>' with a known stack component type.");
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
