package com.agilab.file_retrieval.domain.entity;

import com.agilab.file_retrieval.domain.model.CommandDefinition;
import com.agilab.file_retrieval.domain.model.EventDefinition;
import com.agilab.file_retrieval.domain.model.ProtocolSettings;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.List;

/**
 * JSON column mappings for the configuration's protocol settings and notification definitions.
 */
public final class JsonColumnConverters {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);

    private JsonColumnConverters() {
    }

    private static String write(Object value) {
        try {
            return value == null ? null : MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize column value of type " + value.getClass().getSimpleName(), e);
        }
    }

    private static <T> T read(String json, TypeReference<T> type) {
        try {
            return json == null || json.isBlank() ? null : MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot deserialize column value as " + type.getType(), e);
        }
    }

    @Converter
    public static class ProtocolSettingsConverter implements AttributeConverter<ProtocolSettings, String> {
        @Override
        public String convertToDatabaseColumn(ProtocolSettings attribute) {
            return write(attribute);
        }

        @Override
        public ProtocolSettings convertToEntityAttribute(String dbData) {
            return read(dbData, new TypeReference<>() {
            });
        }
    }

    @Converter
    public static class EventDefinitionsConverter implements AttributeConverter<List<EventDefinition>, String> {
        @Override
        public String convertToDatabaseColumn(List<EventDefinition> attribute) {
            return write(attribute == null ? List.of() : attribute);
        }

        @Override
        public List<EventDefinition> convertToEntityAttribute(String dbData) {
            List<EventDefinition> definitions = read(dbData, new TypeReference<>() {
            });
            return definitions == null ? List.of() : definitions;
        }
    }

    @Converter
    public static class CommandDefinitionsConverter implements AttributeConverter<List<CommandDefinition>, String> {
        @Override
        public String convertToDatabaseColumn(List<CommandDefinition> attribute) {
            return write(attribute == null ? List.of() : attribute);
        }

        @Override
        public List<CommandDefinition> convertToEntityAttribute(String dbData) {
            List<CommandDefinition> definitions = read(dbData, new TypeReference<>() {
            });
            return definitions == null ? List.of() : definitions;
        }
    }
}
