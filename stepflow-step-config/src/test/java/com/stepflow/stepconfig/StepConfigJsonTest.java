package com.stepflow.stepconfig;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StepConfigJsonTest {

    @Test
    void toJson_rendersSourcesAsStringsAndSkipsNulls() {
        UUID artifactId = UUID.fromString("3f2b8c1e-0a4d-4e36-9d7c-5b1f2e6a9c10");
        PartialStepConfiguration partial = PartialStepConfiguration.builder("evaluate")
                .parameters(Map.of("threshold", 0.5))
                .cachingParameters(Map.of("step_source", "abc"))
                .externalInputArtifacts(Map.of("data", artifactId))
                .build();
        StepConfiguration config = StepConfiguration.from(partial,
                Map.of("output", new ArtifactConfiguration(List.of(new Source("com.example.JsonMaterializer")))));

        String json = StepConfigJson.toJson(config);

        assertTrue(json.contains("\"materializerSource\":[\"com.example.JsonMaterializer\"]"));
        assertTrue(json.contains(artifactId.toString()));
        assertFalse(json.contains("enableCache"));
        assertEquals(config, StepConfigJson.fromJson(json));
    }

    @Test
    void partialFromJson_readsUnsetFlagsAsNull() {
        PartialStepConfiguration partial = StepConfigJson.partialFromJson("""
                {
                  "name": "load",
                  "enableArtifactMetadata": false,
                  "settings": { "docker": { "image": "python:3.11" } }
                }
                """);

        assertEquals("load", partial.getName());
        assertEquals(Boolean.FALSE, partial.getEnableArtifactMetadata());
        assertEquals(null, partial.getEnableCache());
        assertEquals(Map.of("image", "python:3.11"), partial.getSettings().get("docker"));
    }
}
