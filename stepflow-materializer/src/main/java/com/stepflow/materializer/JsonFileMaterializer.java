package com.stepflow.materializer;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Stores the value as {@code data.json} inside the artifact directory.
 */
abstract class JsonFileMaterializer extends BaseMaterializer {

    static final String DATA_FILENAME = "data.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    JsonFileMaterializer(String uri) {
        super(uri);
    }

    Path dataFile() {
        return Path.of(getUri()).resolve(DATA_FILENAME);
    }

    @Override
    public Object load(Class<?> dataType) throws IOException {
        return MAPPER.readValue(dataFile().toFile(), dataType);
    }

    @Override
    public void save(Object data) throws IOException {
        Files.createDirectories(Path.of(getUri()));
        MAPPER.writeValue(dataFile().toFile(), data);
    }
}
