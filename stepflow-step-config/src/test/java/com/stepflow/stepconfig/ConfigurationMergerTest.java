package com.stepflow.stepconfig;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigurationMergerTest {

    private static final Source JSON = new Source("com.example.JsonMaterializer");
    private static final Source CSV = new Source("com.example.CsvMaterializer");

    private static PartialStepConfiguration base() {
        return PartialStepConfiguration.builder("train")
                .enableCache(true)
                .parameters(Map.of("lr", 0.1, "optimizer", Map.of("name", "adam", "beta", 0.9)))
                .extra(Map.of("owner", "ml-team"))
                .outputs(Map.of("model", PartialArtifactConfiguration.of(List.of(JSON))))
                .build();
    }

    @Test
    void shallowMerge_replacesWholeMaps() {
        StepConfigurationUpdate update = StepConfigurationUpdate.builder()
                .parameters(Map.of("epochs", 5))
                .build();

        PartialStepConfiguration merged = ConfigurationMerger.merge(base(), update, false);

        assertEquals(Map.of("epochs", 5), merged.getParameters());
        assertEquals(Map.of("owner", "ml-team"), merged.getExtra());
        assertEquals(Boolean.TRUE, merged.getEnableCache());
    }

    @Test
    void shallowMerge_isIdempotent() {
        StepConfigurationUpdate update = StepConfigurationUpdate.builder()
                .enableCache(false)
                .parameters(Map.of("epochs", 5))
                .extra(Map.of("tag", "x"))
                .outputMaterializerSources("model", CSV)
                .build();

        PartialStepConfiguration once = ConfigurationMerger.merge(base(), update, false);
        PartialStepConfiguration twice = ConfigurationMerger.merge(once, update, false);

        assertEquals(once, twice);
    }

    @Test
    void deepMerge_unionsDisjointParameterKeys() {
        StepConfigurationUpdate first = StepConfigurationUpdate.builder().parameters(Map.of("a", 1)).build();
        StepConfigurationUpdate second = StepConfigurationUpdate.builder().parameters(Map.of("b", 2)).build();

        PartialStepConfiguration merged = ConfigurationMerger.merge(
                ConfigurationMerger.merge(PartialStepConfiguration.named("s"), first, true), second, true);

        assertEquals(Set.of("a", "b"), merged.getParameters().keySet());
    }

    @Test
    void deepMerge_recursesIntoNestedMaps() {
        StepConfigurationUpdate update = StepConfigurationUpdate.builder()
                .parameters(Map.of("optimizer", Map.of("beta", 0.99)))
                .build();

        PartialStepConfiguration merged = ConfigurationMerger.merge(base(), update, true);

        assertEquals(Map.of("name", "adam", "beta", 0.99), merged.getParameters().get("optimizer"));
        assertEquals(0.1, merged.getParameters().get("lr"));
    }

    @Test
    void deepMerge_mergesOutputsPerName() {
        StepConfigurationUpdate update = StepConfigurationUpdate.builder()
                .outputMaterializerSources("metrics", CSV)
                .build();

        PartialStepConfiguration merged = ConfigurationMerger.merge(base(), update, true);

        assertEquals(List.of(JSON), merged.getOutputs().get("model").getMaterializerSource());
        assertEquals(List.of(CSV), merged.getOutputs().get("metrics").getMaterializerSource());
    }

    @Test
    void merge_neverMutatesBase() {
        PartialStepConfiguration base = base();
        ConfigurationMerger.merge(base, StepConfigurationUpdate.builder().parameter("lr", 0.5).enableCache(false).build(), true);

        assertEquals(0.1, base.getParameters().get("lr"));
        assertEquals(Boolean.TRUE, base.getEnableCache());
    }

    @Test
    void merge_rejectsUnknownSettingKeysBeforeMerging() {
        StepConfigurationUpdate update = StepConfigurationUpdate.builder()
                .settings(Map.of("resources", Map.of("cpu", 2), "gpu_magic", Map.of()))
                .build();

        UnknownSettingException e = assertThrows(UnknownSettingException.class,
                () -> ConfigurationMerger.merge(base(), update, true));
        assertEquals("gpu_magic", e.getKey());
    }

    @Test
    void merge_keepsNullParameterValues() {
        Map<String, Object> params = new java.util.HashMap<>();
        params.put("threshold", null);
        PartialStepConfiguration merged = ConfigurationMerger.merge(PartialStepConfiguration.named("s"),
                StepConfigurationUpdate.builder().parameters(params).build(), false);

        assertTrue(merged.getParameters().containsKey("threshold"));
        assertNull(merged.getParameters().get("threshold"));
    }

    @Test
    void merge_copiesListValuesOutOfCallerReach() {
        List<Object> data = new ArrayList<>(List.of(1, 2, 3));
        List<Object> nested = new ArrayList<>(List.of("a"));
        StepConfigurationUpdate update = StepConfigurationUpdate.builder()
                .parameters(Map.of("data", data, "columns", Map.of("names", nested)))
                .build();

        PartialStepConfiguration merged = ConfigurationMerger.merge(base(), update, true);
        data.add(4);
        nested.add("b");

        assertEquals(List.of(1, 2, 3), merged.getParameters().get("data"));
        assertEquals(Map.of("names", List.of("a")), merged.getParameters().get("columns"));
        @SuppressWarnings("unchecked")
        List<Object> stored = (List<Object>) merged.getParameters().get("data");
        assertThrows(UnsupportedOperationException.class, () -> stored.add(5));
    }
}
