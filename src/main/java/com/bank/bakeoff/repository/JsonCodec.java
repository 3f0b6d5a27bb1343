package com.bank.bakeoff.repository;

import com.bank.bakeoff.exception.PipelineException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * JSON encoding of nested structures stored in string bins.
 */
final class JsonCodec {

    private final ObjectMapper objectMapper;

    JsonCodec() {
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    String write(Object value) {
        if (value == null) return null;
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new PipelineException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    <T> T read(String json, Class<T> type) {
        if (json == null || json.isEmpty()) return null;
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new PipelineException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }

    <T> T read(String json, TypeReference<T> type) {
        if (json == null || json.isEmpty()) return null;
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new PipelineException("Failed to deserialize " + type.getType(), e);
        }
    }
}
