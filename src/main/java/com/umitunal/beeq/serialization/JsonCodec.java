package com.umitunal.beeq.serialization;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.umitunal.beeq.exception.SerializationException;

import java.io.IOException;

/**
 * JSON codec using Jackson, for payload classes shared with other services.
 *
 * @param <T> the type to serialize
 */
public class JsonCodec<T> implements PayloadCodec<T> {
    private final ObjectMapper mapper;
    private final Class<T> type;

    public JsonCodec(Class<T> type) {
        this(type, createDefaultMapper());
    }

    public JsonCodec(Class<T> type, ObjectMapper mapper) {
        this.type = type;
        this.mapper = mapper;
    }

    @Override
    public byte[] encode(T payload) throws SerializationException {
        try {
            return mapper.writeValueAsBytes(payload);
        } catch (IOException e) {
            throw new SerializationException("Failed to serialize " + type.getSimpleName() + " to JSON", e);
        }
    }

    @Override
    public T decode(byte[] bytes) throws SerializationException {
        try {
            return mapper.readValue(bytes, type);
        } catch (IOException e) {
            throw new SerializationException("Failed to deserialize " + type.getSimpleName() + " from JSON", e);
        }
    }

    private static ObjectMapper createDefaultMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        // Producers may run a newer payload version than the worker
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }
}
