package com.umitunal.beeq.serialization;

import com.umitunal.beeq.exception.SerializationException;

/**
 * Interface for encoding and decoding job payloads.
 * The queue only ever stores the encoded bytes.
 *
 * @param <T> the type of payload
 */
public interface PayloadCodec<T> {

    /**
     * Encode a payload to bytes.
     */
    byte[] encode(T payload) throws SerializationException;

    /**
     * Decode bytes to a payload.
     */
    T decode(byte[] bytes) throws SerializationException;
}
