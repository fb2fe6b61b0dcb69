package com.ai.codeindex.entity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.List;

/**
 * Stores a list of paths or path patterns as a JSON array.
 */
@Converter
public class StringListConverter implements AttributeConverter<List<String>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<String>> PATHS = new TypeReference<>() {};

    @Override
    public String convertToDatabaseColumn(List<String> paths) {
        try {
            return MAPPER.writeValueAsString(paths == null ? List.of() : paths);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize path list", e);
        }
    }

    @Override
    public List<String> convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return List.copyOf(MAPPER.readValue(json, PATHS));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt path list column", e);
        }
    }
}
