package com.seat.exchange.models.converters;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.seat.exchange.exceptions.InternalServerErrorException;
import jakarta.persistence.AttributeConverter;

/**
 * Stores a value object as a JSON text column.
 */
public abstract class JsonColumnConverter<T> implements AttributeConverter<T, String> {
    private static final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final TypeReference<T> type;

    protected JsonColumnConverter(TypeReference<T> type) {
        this.type = type;
    }

    @Override
    public String convertToDatabaseColumn(T attribute) {
        if (attribute == null) {
            return null;
        }
        try {
            return om.writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            throw new InternalServerErrorException("Failed serializing column value: " + e.getOriginalMessage());
        }
    }

    @Override
    public T convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return null;
        }
        try {
            return om.readValue(dbData, type);
        } catch (JsonProcessingException e) {
            throw new InternalServerErrorException("Failed reading column value: " + e.getOriginalMessage());
        }
    }
}
