package com.stepflow.materializer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BuiltInMaterializerTest {

    @TempDir
    Path tempDir;

    @Test
    void save_writesJsonIntoArtifactDirectory() throws Exception {
        Path uri = tempDir.resolve("external_artifacts").resolve("external_1");
        BaseMaterializer materializer = BaseMaterializer.create(JsonContainerMaterializer.class, uri.toString());

        materializer.save(Map.of("rows", List.of(1, 2, 3)));

        Path file = uri.resolve("data.json");
        assertTrue(Files.exists(file));
        assertEquals("{\"rows\":[1,2,3]}", Files.readString(file));
        assertEquals(Map.of("rows", List.of(1, 2, 3)), materializer.load(Map.class));
    }

    @Test
    void save_roundTripsScalar() throws Exception {
        BaseMaterializer materializer = BaseMaterializer.create(BuiltInMaterializer.class, tempDir.toString());

        materializer.save(42L);

        assertEquals(42L, materializer.load(Long.class));
        assertEquals("DATA", BaseMaterializer.artifactType(BuiltInMaterializer.class));
    }
}
