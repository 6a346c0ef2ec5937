package com.umitunal.qcast.serialization;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.KryoException;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;
import com.umitunal.qcast.core.BroadcastJob;

import java.io.ByteArrayOutputStream;

/**
 * Compact binary codec using Kryo. Kryo instances are not thread-safe, so
 * each thread gets its own from the factory.
 *
 * @param <T> the type to serialize
 */
public class KryoCodec<T> implements PayloadCodec<T> {
    private final ThreadLocal<Kryo> kryoThreadLocal;
    private final Class<T> type;

    public KryoCodec(Class<T> type, KryoFactory factory) {
        this.type = type;
        this.kryoThreadLocal = ThreadLocal.withInitial(factory::create);
    }

    /**
     * Codec for job records, using the hand-written field layout in
     * {@link BroadcastJobKryoSerializer}.
     */
    public static KryoCodec<BroadcastJob> forJobs() {
        return new KryoCodec<>(BroadcastJob.class, Factories::jobFactory);
    }

    @Override
    public byte[] encode(T value) {
        Kryo kryo = kryoThreadLocal.get();
        ByteArrayOutputStream baos = new ByteArrayOutputStream();

        try (Output output = new Output(baos)) {
            kryo.writeObject(output, value);
            output.flush();
            return baos.toByteArray();
        } catch (KryoException e) {
            throw new CodecException("Failed to serialize " + type.getSimpleName() + " with Kryo", e);
        }
    }

    @Override
    public T decode(byte[] bytes) {
        Kryo kryo = kryoThreadLocal.get();

        try (Input input = new Input(bytes)) {
            return kryo.readObject(input, type);
        } catch (KryoException e) {
            throw new CodecException("Failed to deserialize " + type.getSimpleName() + " with Kryo", e);
        }
    }

    /**
     * Factory interface for custom Kryo configuration.
     */
    @FunctionalInterface
    public interface KryoFactory {
        Kryo create();
    }

    public static class Factories {

        /**
         * Registration required, no reference tracking. Job records are flat
         * and never contain cycles.
         */
        public static Kryo jobFactory() {
            Kryo kryo = new Kryo();
            kryo.setRegistrationRequired(true);
            kryo.setReferences(false);
            kryo.register(BroadcastJob.class, new BroadcastJobKryoSerializer());
            return kryo;
        }
    }
}
