package com.stepflow.caching;

import com.stepflow.stepconfig.Source;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CachingFingerprintCalculatorTest {

    public static class TrainStep {
    }

    public static class JsonMaterializer {
    }

    public static class CsvMaterializer {
    }

    /** Serves fixed code text per class so tests can change "source" without recompiling. */
    static final class FakeReader implements SourceCodeReader {
        final Map<Class<?>, String> code = new HashMap<>();

        @Override
        public byte[] read(Class<?> type) {
            return code.getOrDefault(type, type.getName()).getBytes(StandardCharsets.UTF_8);
        }
    }

    private static Map<String, List<Source>> outputs() {
        Map<String, List<Source>> outputs = new LinkedHashMap<>();
        outputs.put("model", List.of(Source.fromClass(JsonMaterializer.class)));
        outputs.put("metrics", List.of(Source.fromClass(CsvMaterializer.class), Source.fromClass(JsonMaterializer.class)));
        outputs.put("unused", List.of());
        return outputs;
    }

    @Test
    void compute_isDeterministic() {
        FakeReader reader = new FakeReader();
        CachingFingerprintCalculator first = new CachingFingerprintCalculator(new SourceCodeHasher("SHA-256", reader));
        CachingFingerprintCalculator second = new CachingFingerprintCalculator(new SourceCodeHasher("SHA-256", reader));

        Map<String, String> a = first.compute(TrainStep.class, outputs());
        Map<String, String> b = second.compute(TrainStep.class, outputs());

        assertEquals(a, b);
        assertEquals(List.of("step_source", "model_materializer_source", "metrics_materializer_source"),
                List.copyOf(a.keySet()));
    }

    @Test
    void compute_changingOneMaterializerChangesOnlyItsEntries() {
        FakeReader reader = new FakeReader();
        CachingFingerprintCalculator calculator = new CachingFingerprintCalculator(new SourceCodeHasher("SHA-256", reader));
        Map<String, String> before = calculator.compute(TrainStep.class, outputs());

        reader.code.put(CsvMaterializer.class, "class CsvMaterializer { int version = 2; }");
        Map<String, String> after = calculator.compute(TrainStep.class, outputs());

        assertEquals(before.get("step_source"), after.get("step_source"));
        assertEquals(before.get("model_materializer_source"), after.get("model_materializer_source"));
        assertNotEquals(before.get("metrics_materializer_source"), after.get("metrics_materializer_source"));
    }

    @Test
    void compute_materializerOrderMatters() {
        CachingFingerprintCalculator calculator = new CachingFingerprintCalculator(new SourceCodeHasher("SHA-256", new FakeReader()));
        Source json = Source.fromClass(JsonMaterializer.class);
        Source csv = Source.fromClass(CsvMaterializer.class);

        String forward = calculator.compute(TrainStep.class, Map.of("out", List.of(json, csv))).get("out_materializer_source");
        String reverse = calculator.compute(TrainStep.class, Map.of("out", List.of(csv, json))).get("out_materializer_source");

        assertNotEquals(forward, reverse);
    }

    @Test
    void compute_stepSourceIsHexDigestOfCode() {
        FakeReader reader = new FakeReader();
        reader.code.put(TrainStep.class, "abc");
        CachingFingerprintCalculator calculator = new CachingFingerprintCalculator(new SourceCodeHasher("SHA-256", reader));

        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
                calculator.compute(TrainStep.class, null).get("step_source"));
    }

    @Test
    void hasher_rejectsUnknownAlgorithm() {
        assertThrows(IllegalArgumentException.class, () -> new SourceCodeHasher("NOPE-1", new FakeReader()));
    }
}
