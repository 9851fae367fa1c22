package com.ivamare.agentqueue.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.Map;

/**
 * Jackson helpers shared by the wire codec, audit storage and tests.
 */
public final class Jsons {

    public static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private Jsons() {
    }

    /**
     * Mapper configured for message bodies: JSR-310 registered, ISO-8601 timestamps.
     *
     * @return a new ObjectMapper
     */
    public static ObjectMapper newObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules();
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    public static Map<String, Object> toMap(ObjectMapper mapper, Object value) {
        return mapper.convertValue(value, MAP_TYPE);
    }

    public static String toJson(ObjectMapper mapper, Object value) {
        if (value == null) {
            return null;
        }
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize JSON", e);
        }
    }

    public static Map<String, Object> readMap(ObjectMapper mapper, String json) {
        if (json == null) {
            return null;
        }
        try {
            return mapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to parse JSON", e);
        }
    }
}
