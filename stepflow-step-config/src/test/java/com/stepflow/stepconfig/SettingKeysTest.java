package com.stepflow.stepconfig;

import com.stepflow.config.StepflowConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SettingKeysTest {

    @AfterEach
    void tearDown() {
        StepflowConfig.reset();
    }

    @Test
    void isValid_acceptsGeneralAndComponentKeys() {
        StepflowConfig.set(StepflowConfig.builder().build());

        assertTrue(SettingKeys.isValid("docker"));
        assertTrue(SettingKeys.isValid("resources"));
        assertTrue(SettingKeys.isValid("orchestrator.kubernetes"));
        assertTrue(SettingKeys.isValid("step_operator.sagemaker"));
        assertFalse(SettingKeys.isValid("orchestrator"));
        assertFalse(SettingKeys.isValid("orchestrator."));
        assertFalse(SettingKeys.isValid("scheduler.cron"));
        assertFalse(SettingKeys.isValid("orchestrator.a.b"));
    }

    @Test
    void componentType_parsesPrefix() {
        assertEquals(StackComponentType.EXPERIMENT_TRACKER,
                SettingKeys.componentType("experiment_tracker.mlflow").orElseThrow());
    }

    @Test
    void validate_honoursExtraGeneralKeys() {
        StepflowConfig.set(StepflowConfig.builder().generalSettingKeys(List.of("docker", "resources", "retry")).build());

        assertDoesNotThrow(() -> SettingKeys.validate(List.of("retry", "docker")));
        assertThrows(UnknownSettingException.class, () -> SettingKeys.validate(List.of("timeout")));
    }
}
