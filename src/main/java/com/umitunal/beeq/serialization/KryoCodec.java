package com.umitunal.beeq.serialization;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.KryoException;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;
import com.umitunal.beeq.exception.SerializationException;

import java.io.ByteArrayOutputStream;

/**
 * Compact binary payloads using Kryo, for queues whose producers and workers share classes.
 * Kryo instances are not thread-safe, so each thread gets its own.
 *
 * @param <T> the type to serialize
 */
public class KryoCodec<T> implements PayloadCodec<T> {
    private final ThreadLocal<Kryo> kryoThreadLocal;
    private final Class<T> type;

    public KryoCodec(Class<T> type) {
        this(type, KryoCodec::defaultKryo);
    }

    /**
     * Create a Kryo codec with custom Kryo instance configuration,
     * e.g. with class registration required.
     */
    public KryoCodec(Class<T> type, KryoFactory factory) {
        this.type = type;
        this.kryoThreadLocal = ThreadLocal.withInitial(factory::create);
    }

    @Override
    public byte[] encode(T payload) throws SerializationException {
        Kryo kryo = kryoThreadLocal.get();
        ByteArrayOutputStream baos = new ByteArrayOutputStream();

        try (Output output = new Output(baos)) {
            kryo.writeObject(output, payload);
            output.flush();
            return baos.toByteArray();
        } catch (KryoException | IllegalArgumentException e) {
            throw new SerializationException("Kryo failed to encode " + type.getSimpleName(), e);
        }
    }

    @Override
    public T decode(byte[] bytes) throws SerializationException {
        Kryo kryo = kryoThreadLocal.get();

        try (Input input = new Input(bytes)) {
            return kryo.readObject(input, type);
        } catch (KryoException e) {
            throw new SerializationException("Kryo failed to decode " + type.getSimpleName(), e);
        }
    }

    private static Kryo defaultKryo() {
        Kryo kryo = new Kryo();
        kryo.setRegistrationRequired(false);
        kryo.setReferences(true);
        return kryo;
    }

    @FunctionalInterface
    public interface KryoFactory {
        Kryo create();
    }
}
