package com.cronpilot.engine.model.converter;

import com.cronpilot.engine.util.Jsons;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import jakarta.persistence.AttributeConverter;

/**
 * Stores a value as a JSON document in a VARCHAR column.
 *
 * Used for the opaque parts of a job (inputs, labels) and for its nested
 * configuration records, which are always read and written as a whole.
 */
abstract class JsonColumnConverter<T> implements AttributeConverter<T, String> {

    private final JavaType type;

    protected JsonColumnConverter(JavaType type) {
        this.type = type;
    }

    @Override
    public String convertToDatabaseColumn(T attribute) {
        if (attribute == null) return null;
        try {
            return Jsons.mapper().writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + type + " column", e);
        }
    }

    @Override
    public T convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) return emptyValue();
        try {
            return Jsons.mapper().readValue(dbData, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt " + type + " column: " + e.getOriginalMessage(), e);
        }
    }

    /** Value used for NULL or blank columns. */
    protected abstract T emptyValue();
}
