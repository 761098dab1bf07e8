package com.stepflow.stepconfig;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * JSON rendering of step configurations (for logs and for orchestrators). Nulls are excluded.
 */
public final class StepConfigJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private StepConfigJson() {
    }

    /**
     * @throws UncheckedIOException on serialization failure
     */
    public static String toJson(StepConfiguration config) {
        try {
            return MAPPER.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    public static String toJsonPretty(StepConfiguration config) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    public static String toJson(PartialStepConfiguration config) {
        try {
            return MAPPER.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    /**
     * @throws UncheckedIOException on parse failure
     */
    public static StepConfiguration fromJson(String json) {
        try {
            return MAPPER.readValue(json, StepConfiguration.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static PartialStepConfiguration partialFromJson(String json) {
        try {
            return MAPPER.readValue(json, PartialStepConfiguration.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
