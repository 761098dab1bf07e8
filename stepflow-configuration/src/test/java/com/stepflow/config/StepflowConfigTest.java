package com.stepflow.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StepflowConfigTest {

    @AfterEach
    void tearDown() {
        StepflowConfig.reset();
    }

    @Test
    void builder_appliesDefaults() {
        StepflowConfig config = StepflowConfig.builder().build();

        assertEquals("external_artifacts", config.getExternalArtifactsDir());
        assertEquals(List.of("docker", "resources"), config.getGeneralSettingKeys());
        assertEquals("SHA-256", config.getSourceHashAlgorithm());
        assertTrue(config.isWarnExternalArtifactCaching());
    }

    @Test
    void builder_rejectsBlankExternalArtifactsDir() {
        assertThrows(IllegalArgumentException.class,
                () -> StepflowConfig.builder().externalArtifactsDir("  "));
    }

    @Test
    void set_replacesProcessWideConfig() {
        StepflowConfig custom = StepflowConfig.builder()
                .externalArtifactsDir("uploads")
                .warnExternalArtifactCaching(false)
                .build();

        StepflowConfig.set(custom);

        assertSame(custom, StepflowConfig.get());
        assertEquals("uploads", StepflowConfig.get().getExternalArtifactsDir());
        assertFalse(StepflowConfig.get().isWarnExternalArtifactCaching());
    }

    @Test
    void parseCommaSeparated_trimsAndDropsEmptyEntries() {
        assertEquals(List.of("gpu", "secrets"), StepflowConfig.parseCommaSeparated(" gpu, ,secrets "));
        assertTrue(StepflowConfig.parseCommaSeparated(null).isEmpty());
    }

    @Test
    void parseBoolean_acceptsTrueAndOne() {
        assertTrue(StepflowConfig.parseBoolean("TRUE", false));
        assertTrue(StepflowConfig.parseBoolean("1", false));
        assertFalse(StepflowConfig.parseBoolean("no", true));
        assertTrue(StepflowConfig.parseBoolean(" ", true));
    }
}
