package com.example.dbmonitor.domain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

/**
 * Stores a list of value objects as a JSON text column.
 * One concrete converter per element type, since JPA needs a non-generic class.
 */
public abstract class JsonListConverter<T> implements AttributeConverter<List<T>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private final TypeReference<List<T>> type;

    protected JsonListConverter(TypeReference<List<T>> type) {
        this.type = type;
    }

    @Override
    public String convertToDatabaseColumn(List<T> attribute) {
        try {
            return MAPPER.writeValueAsString(attribute != null ? attribute : List.of());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unable to serialize column value", e);
        }
    }

    @Override
    public List<T> convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return new ArrayList<>();
        }
        try {
            return MAPPER.readValue(dbData, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unable to deserialize column value", e);
        }
    }

    @Converter
    public static class Columns extends JsonListConverter<ColumnDescriptor> {
        public Columns() {
            super(new TypeReference<>() {});
        }
    }

    @Converter
    public static class ForeignKeys extends JsonListConverter<ForeignKeyDescriptor> {
        public ForeignKeys() {
            super(new TypeReference<>() {});
        }
    }

    @Converter
    public static class Indexes extends JsonListConverter<IndexDescriptor> {
        public Indexes() {
            super(new TypeReference<>() {});
        }
    }

    @Converter
    public static class Strings extends JsonListConverter<String> {
        public Strings() {
            super(new TypeReference<>() {});
        }
    }

    @Converter
    public static class Suggestions extends JsonListConverter<Suggestion> {
        public Suggestions() {
            super(new TypeReference<>() {});
        }
    }
}
