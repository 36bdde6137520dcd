package com.umitunal.beeq.serialization;

/**
 * Pass-through codec for payloads that are already serialized.
 */
public class ByteArrayCodec implements PayloadCodec<byte[]> {

    public static final ByteArrayCodec INSTANCE = new ByteArrayCodec();

    @Override
    public byte[] encode(byte[] payload) {
        return payload == null ? new byte[0] : payload;
    }

    @Override
    public byte[] decode(byte[] bytes) {
        return bytes;
    }
}
