package com.washdispatch.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Stores a polygon as a JSON array of [lat, lng] pairs.
 * Unreadable rows come back as an empty polygon, which never matches any point.
 */
@Converter
@Slf4j
public class PolygonJsonConverter implements AttributeConverter<List<double[]>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<double[]>> TYPE_REF = new TypeReference<List<double[]>>() {};

    @Override
    public String convertToDatabaseColumn(List<double[]> polygon) {
        try {
            if (polygon == null) {
                return "[]";
            }
            return MAPPER.writeValueAsString(polygon);
        } catch (JsonProcessingException e) {
            log.error("Error while converting polygon to JSON", e);
            throw new IllegalArgumentException("Polygon cannot be serialized", e);
        }
    }

    @Override
    public List<double[]> convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        try {
            return MAPPER.readValue(json, TYPE_REF);
        } catch (JsonProcessingException e) {
            log.warn("Malformed polygon column ignored: {}", e.getOriginalMessage());
            return new ArrayList<>();
        }
    }
}
