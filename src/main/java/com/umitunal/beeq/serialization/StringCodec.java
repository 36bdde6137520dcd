package com.umitunal.beeq.serialization;

import com.umitunal.beeq.exception.SerializationException;

import java.nio.charset.StandardCharsets;

/**
 * Codec for String payloads using UTF-8 encoding.
 */
public class StringCodec implements PayloadCodec<String> {

    @Override
    public byte[] encode(String payload) throws SerializationException {
        if (payload == null) {
            throw new SerializationException("String payload must not be null");
        }
        return payload.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public String decode(byte[] bytes) {
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
