package com.stepflow.stepconfig;

import com.stepflow.config.StepflowConfig;

import java.util.Collection;
import java.util.Optional;

/**
 * Validation of settings keys.
 */
public final class SettingKeys {

    private SettingKeys() {
    }

    public static boolean isGeneralKey(String key) {
        return StepflowConfig.get().getGeneralSettingKeys().contains(key);
    }

    /** Component type of a {@code <componentType>.<flavor>} key; empty for anything else. */
    public static Optional<StackComponentType> componentType(String key) {
        if (key == null) return Optional.empty();
        int dot = key.indexOf('.');
        if (dot <= 0 || dot == key.length() - 1 || key.indexOf('.', dot + 1) >= 0) {
            return Optional.empty();
        }
        return StackComponentType.fromKey(key.substring(0, dot));
    }

    public static boolean isValid(String key) {
        return key != null && (isGeneralKey(key) || componentType(key).isPresent());
    }

    /**
     * @throws UnknownSettingException for the first invalid key
     */
    public static void validate(Collection<String> keys) {
        if (keys == null) return;
        for (String key : keys) {
            if (!isValid(key)) {
                throw new UnknownSettingException(key);
            }
        }
    }
}
